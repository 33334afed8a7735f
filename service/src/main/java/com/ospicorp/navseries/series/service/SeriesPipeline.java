package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.DateRange;
import com.ospicorp.navseries.series.model.ObservationSeries;
import com.ospicorp.navseries.series.model.SamplingConfig;
import com.ospicorp.navseries.series.model.SummaryStatistics;
import com.ospicorp.navseries.series.service.IngestionNormalizer.IngestionReport;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SeriesPipeline {

  private static final Logger log = LoggerFactory.getLogger(SeriesPipeline.class);

  private final IngestionNormalizer normalizer;

  public SeriesPipeline(IngestionNormalizer normalizer) {
    this.normalizer = normalizer;
  }

  public PipelineResult run(List<? extends Map<String, ?>> records, DateRange range,
      SamplingConfig sampling) {
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(sampling, "sampling");
    IngestionReport report = normalizer.normalizeWithReport(records);
    return run(report.series(), range, sampling, report.rejected());
  }

  public PipelineResult run(ObservationSeries series, DateRange range, SamplingConfig sampling) {
    return run(series, range, sampling, 0);
  }

  // Scheme-less records share the "" key; first-seen order
  public Map<String, PipelineResult> runByScheme(List<? extends Map<String, ?>> records,
      String schemeField, DateRange range, SamplingConfig sampling) {
    Objects.requireNonNull(schemeField, "schemeField");
    Map<String, PipelineResult> out = new LinkedHashMap<>();
    if (records == null) return out;
    Map<String, List<Map<String, ?>>> groups = new LinkedHashMap<>();
    for (Map<String, ?> record : records) {
      Object scheme = record == null ? null : record.get(schemeField);
      String key = scheme == null ? "" : scheme.toString().trim();
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
    }
    for (var e : groups.entrySet()) {
      out.put(e.getKey(), run(e.getValue(), range, sampling));
    }
    return out;
  }

  private PipelineResult run(ObservationSeries series, DateRange range, SamplingConfig sampling,
      int rejected) {
    ObservationSeries filtered = RangeFilter.filter(series, range);
    ObservationSeries sampled = Sampler.sample(filtered, sampling);
    Optional<SummaryStatistics> statistics = StatisticsCalculator.summarize(filtered);
    log.debug("Pipeline {} -> {} in range -> {} sampled ({} {})", series.size(), filtered.size(),
        sampled.size(), sampling.strategy(), sampling.maxPoints());
    return new PipelineResult(range, sampling, filtered, sampled, statistics,
        ChartProjection.project(sampled), rejected);
  }
}
