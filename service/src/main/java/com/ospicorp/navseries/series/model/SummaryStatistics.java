package com.ospicorp.navseries.series.model;

import java.util.OptionalDouble;

// changePercent is null when undefined (zero baseline or overflow)
public record SummaryStatistics(
    double min,
    double max,
    double first,
    double latest,
    double change,
    Double changePercent,
    double mean,
    double volatility,
    int count
) {

  public boolean isChangePercentDefined() {
    return changePercent != null;
  }

  public OptionalDouble changePercentValue() {
    return changePercent == null ? OptionalDouble.empty() : OptionalDouble.of(changePercent);
  }
}
