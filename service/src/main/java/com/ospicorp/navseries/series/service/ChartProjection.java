package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.ChartPoint;
import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import java.util.ArrayList;
import java.util.List;

public final class ChartProjection {
  private ChartProjection() {
  }

  public static List<ChartPoint> project(ObservationSeries series) {
    List<ChartPoint> out = new ArrayList<>(series.size());
    for (Observation o : series) {
      out.add(new ChartPoint(o.date(), o.value()));
    }
    return out;
  }
}
