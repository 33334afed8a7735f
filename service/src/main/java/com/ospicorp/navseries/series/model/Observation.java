package com.ospicorp.navseries.series.model;

import java.time.LocalDate;
import java.util.Objects;

// Canonical data point; value is always finite once built by the normalizer
public record Observation(LocalDate date, double value) {

  public Observation {
    Objects.requireNonNull(date, "date");
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("value must be finite: " + value);
    }
  }
}
