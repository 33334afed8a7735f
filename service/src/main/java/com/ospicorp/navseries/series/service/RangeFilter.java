package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.DateRange;
import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import java.util.ArrayList;
import java.util.List;

public final class RangeFilter {
  private RangeFilter() {
  }

  public static ObservationSeries filter(ObservationSeries series, DateRange range) {
    if (series.isEmpty()) return series;
    List<Observation> out = new ArrayList<>();
    for (Observation o : series) {
      if (range.contains(o.date())) {
        out.add(o);
      }
    }
    return ObservationSeries.ofOrdered(out);
  }
}
