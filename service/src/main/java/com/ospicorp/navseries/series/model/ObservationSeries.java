package com.ospicorp.navseries.series.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable sequence of observations ordered by date (non-decreasing). Observations sharing a
 * date keep the order they were supplied in.
 */
public final class ObservationSeries implements Iterable<Observation> {

  private static final ObservationSeries EMPTY = new ObservationSeries(List.of());
  private static final Comparator<Observation> BY_DATE = Comparator.comparing(Observation::date);

  private final List<Observation> observations;

  private ObservationSeries(List<Observation> observations) {
    this.observations = observations;
  }

  public static ObservationSeries empty() {
    return EMPTY;
  }

  public static ObservationSeries sorted(List<Observation> observations) {
    if (observations.isEmpty()) {
      return EMPTY;
    }
    List<Observation> copy = new ArrayList<>(observations);
    copy.sort(BY_DATE);
    return new ObservationSeries(Collections.unmodifiableList(copy));
  }

  public static ObservationSeries ofOrdered(List<Observation> observations) {
    if (observations.isEmpty()) {
      return EMPTY;
    }
    for (int i = 1; i < observations.size(); i++) {
      if (observations.get(i).date().isBefore(observations.get(i - 1).date())) {
        throw new IllegalArgumentException("observations out of date order at index " + i);
      }
    }
    return new ObservationSeries(Collections.unmodifiableList(new ArrayList<>(observations)));
  }

  public int size() {
    return observations.size();
  }

  public boolean isEmpty() {
    return observations.isEmpty();
  }

  public Observation get(int index) {
    return observations.get(index);
  }

  public Observation first() {
    return observations.get(0);
  }

  public Observation last() {
    return observations.get(observations.size() - 1);
  }

  public List<Observation> asList() {
    return observations;
  }

  public ObservationSeries tail(int fromIndex) {
    if (fromIndex <= 0) {
      return this;
    }
    if (fromIndex >= observations.size()) {
      return EMPTY;
    }
    return new ObservationSeries(
        Collections.unmodifiableList(new ArrayList<>(observations.subList(fromIndex, observations.size()))));
  }

  @Override
  public Iterator<Observation> iterator() {
    return observations.iterator();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ObservationSeries other)) {
      return false;
    }
    return observations.equals(other.observations);
  }

  @Override
  public int hashCode() {
    return observations.hashCode();
  }

  @Override
  public String toString() {
    return "ObservationSeries" + observations;
  }
}
