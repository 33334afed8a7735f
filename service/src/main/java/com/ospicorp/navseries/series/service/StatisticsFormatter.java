package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.SummaryStatistics;
import java.math.BigDecimal;
import java.math.RoundingMode;

// Display rounding only; the calculator keeps full precision
public final class StatisticsFormatter {
  static final int AMOUNT_SCALE = 4;
  static final int PERCENT_SCALE = 2;

  private StatisticsFormatter() {
  }

  public static SummaryStatistics round(SummaryStatistics s) {
    return new SummaryStatistics(
        amount(s.min()),
        amount(s.max()),
        amount(s.first()),
        amount(s.latest()),
        amount(s.change()),
        s.changePercent() == null ? null : percent(s.changePercent()),
        amount(s.mean()),
        amount(s.volatility()),
        s.count());
  }

  public static String describe(SummaryStatistics s) {
    String pct = s.changePercent() == null ? "n/a" : plain(s.changePercent(), PERCENT_SCALE) + "%";
    return "count=" + s.count()
        + " first=" + plain(s.first(), AMOUNT_SCALE)
        + " latest=" + plain(s.latest(), AMOUNT_SCALE)
        + " min=" + plain(s.min(), AMOUNT_SCALE)
        + " max=" + plain(s.max(), AMOUNT_SCALE)
        + " change=" + plain(s.change(), AMOUNT_SCALE)
        + " change%=" + pct
        + " mean=" + plain(s.mean(), AMOUNT_SCALE)
        + " volatility=" + plain(s.volatility(), AMOUNT_SCALE);
  }

  static double amount(double value) {
    return scale(value, AMOUNT_SCALE);
  }

  static double percent(double value) {
    return scale(value, PERCENT_SCALE);
  }

  // Non-finite values have no decimal form; they pass through unrounded
  private static double scale(double value, int places) {
    if (!Double.isFinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  private static String plain(double value, int places) {
    if (!Double.isFinite(value)) {
      return "n/a";
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).toPlainString();
  }
}
