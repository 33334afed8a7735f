package com.ospicorp.navseries.series.model;

import java.time.LocalDate;
import java.time.Period;
import java.util.Objects;

// Inclusive; a null bound is open, an inverted window matches nothing
public record DateRange(LocalDate start, LocalDate end) {

  private static final DateRange UNBOUNDED = new DateRange(null, null);

  public static DateRange unbounded() {
    return UNBOUNDED;
  }

  public static DateRange from(LocalDate start) {
    return new DateRange(start, null);
  }

  public static DateRange until(LocalDate end) {
    return new DateRange(null, end);
  }

  public static DateRange of(LocalDate start, LocalDate end) {
    return new DateRange(start, end);
  }

  public static DateRange trailing(LocalDate end, Period period) {
    Objects.requireNonNull(end, "end");
    Objects.requireNonNull(period, "period");
    return new DateRange(end.minus(period), end);
  }

  public boolean contains(LocalDate date) {
    return (start == null || !date.isBefore(start)) && (end == null || !date.isAfter(end));
  }
}
