package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import com.ospicorp.navseries.series.model.SummaryStatistics;
import java.util.Optional;

public final class StatisticsCalculator {
  private StatisticsCalculator() {
  }

  // Pass the filtered series, never the sampled one
  public static Optional<SummaryStatistics> summarize(ObservationSeries series) {
    if (series.isEmpty()) return Optional.empty();

    int count = series.size();
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Observation o : series) {
      min = Math.min(min, o.value());
      max = Math.max(max, o.value());
    }

    double[] moments = moments(series, 1d);
    if (!Double.isFinite(moments[0]) || !Double.isFinite(moments[1])) {
      // Sums overflowed: redo the pass on values scaled into [-1, 1]
      double scale = Math.max(Math.abs(min), Math.abs(max));
      double[] scaled = moments(series, scale);
      moments = new double[] {scaled[0] * scale, scaled[1] * scale};
    }
    double mean = moments[0];
    double volatility = moments[1];

    double first = series.first().value();
    double latest = series.last().value();
    double change = latest - first;
    Double changePercent = null;
    if (first != 0d) {
      double pct = (change / first) * 100d;
      changePercent = Double.isFinite(pct) ? pct : null;
    }

    return Optional.of(new SummaryStatistics(min, max, first, latest, change, changePercent, mean,
        volatility, count));
  }

  // {mean, population standard deviation} of value / scale
  private static double[] moments(ObservationSeries series, double scale) {
    int count = series.size();
    double sum = 0d;
    for (Observation o : series) {
      sum += o.value() / scale;
    }
    double mean = sum / count;
    double squares = 0d;
    for (Observation o : series) {
      double d = o.value() / scale - mean;
      squares += d * d;
    }
    return new double[] {mean, Math.sqrt(squares / count)};
  }
}
