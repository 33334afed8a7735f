package com.ospicorp.navseries.series.model;

import com.ospicorp.navseries.series.InvalidConfigurationException;
import java.util.Locale;

public enum SamplingStrategy {
  UNIFORM,
  RECENT,
  SMART;

  public static SamplingStrategy parse(String value) {
    if (value == null || value.isBlank()) {
      throw InvalidConfigurationException.missingStrategy();
    }
    try {
      return SamplingStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw InvalidConfigurationException.unknownStrategy(value);
    }
  }
}
