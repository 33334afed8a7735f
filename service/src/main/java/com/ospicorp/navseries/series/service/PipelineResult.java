package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.ChartPoint;
import com.ospicorp.navseries.series.model.DateRange;
import com.ospicorp.navseries.series.model.ObservationSeries;
import com.ospicorp.navseries.series.model.SamplingConfig;
import com.ospicorp.navseries.series.model.SummaryStatistics;
import java.util.List;
import java.util.Optional;

public record PipelineResult(
    DateRange range,
    SamplingConfig sampling,
    ObservationSeries filtered,
    ObservationSeries sampled,
    Optional<SummaryStatistics> statistics,
    List<ChartPoint> chartPoints,
    int rejectedRecords
) {

  // Nothing in range: a valid outcome, distinct from a failure
  public boolean isEmpty() {
    return filtered.isEmpty();
  }
}
