package com.ospicorp.navseries.series.model;

import com.ospicorp.navseries.series.InvalidConfigurationException;

public record SamplingConfig(SamplingStrategy strategy, int maxPoints) {

  public SamplingConfig {
    if (strategy == null) {
      throw InvalidConfigurationException.missingStrategy();
    }
    if (maxPoints <= 0) {
      throw InvalidConfigurationException.nonPositiveMaxPoints(maxPoints);
    }
  }

  public static SamplingConfig of(String strategy, int maxPoints) {
    return new SamplingConfig(SamplingStrategy.parse(strategy), maxPoints);
  }
}
