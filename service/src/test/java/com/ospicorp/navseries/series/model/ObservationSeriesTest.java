package com.ospicorp.navseries.series.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ObservationSeriesTest {

  private static final LocalDate DAY = LocalDate.of(2024, 1, 10);

  @Test
  void sortedIsStableForEqualDates() {
    var series = ObservationSeries.sorted(List.of(
        new Observation(DAY.plusDays(1), 1d),
        new Observation(DAY, 2d),
        new Observation(DAY, 3d)));

    assertThat(series.asList()).extracting(Observation::value).containsExactly(2d, 3d, 1d);
  }

  @Test
  void orderedFactoryRejectsOutOfOrderInput() {
    assertThrows(IllegalArgumentException.class, () -> ObservationSeries.ofOrdered(List.of(
        new Observation(DAY.plusDays(1), 1d),
        new Observation(DAY, 2d))));
  }

  @Test
  void isDetachedFromSourceList() {
    List<Observation> source = new ArrayList<>(List.of(new Observation(DAY, 1d)));
    var series = ObservationSeries.ofOrdered(source);
    source.add(new Observation(DAY.plusDays(1), 2d));

    assertEquals(1, series.size());
    assertThrows(UnsupportedOperationException.class,
        () -> series.asList().add(new Observation(DAY, 0d)));
  }

  @Test
  void observationRejectsNonFiniteValues() {
    assertThrows(IllegalArgumentException.class, () -> new Observation(DAY, Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> new Observation(DAY, Double.NEGATIVE_INFINITY));
  }

  @Test
  void tailCopiesSuffix() {
    var series = ObservationSeries.ofOrdered(List.of(
        new Observation(DAY, 1d),
        new Observation(DAY.plusDays(1), 2d),
        new Observation(DAY.plusDays(2), 3d)));

    assertSame(series, series.tail(0));
    assertTrue(series.tail(3).isEmpty());
    assertEquals(List.of(new Observation(DAY.plusDays(2), 3d)), series.tail(2).asList());
  }
}
