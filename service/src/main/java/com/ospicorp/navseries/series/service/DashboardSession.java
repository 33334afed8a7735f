package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.DateRange;
import com.ospicorp.navseries.series.model.ObservationSeries;
import com.ospicorp.navseries.series.model.SamplingConfig;
import com.ospicorp.navseries.series.service.IngestionNormalizer.IngestionReport;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one normalized series and recomputes the view whenever the range or sampling changes.
 * Each request takes a ticket; a result is published only while its ticket is still the newest,
 * so a slow stale recomputation can never replace a newer one.
 */
public class DashboardSession {

  private static final Logger log = LoggerFactory.getLogger(DashboardSession.class);

  private final SeriesPipeline pipeline;
  private final ObservationSeries series;
  private final int rejectedRecords;
  private final AtomicLong requested = new AtomicLong();
  private final AtomicReference<Published> latest = new AtomicReference<>();

  public DashboardSession(SeriesPipeline pipeline, IngestionNormalizer normalizer,
      List<? extends Map<String, ?>> records) {
    this.pipeline = pipeline;
    IngestionReport report = normalizer.normalizeWithReport(records);
    this.series = report.series();
    this.rejectedRecords = report.rejected();
  }

  public ObservationSeries series() {
    return series;
  }

  public int rejectedRecords() {
    return rejectedRecords;
  }

  public Optional<PipelineResult> recompute(DateRange range, SamplingConfig sampling) {
    long ticket = beginRequest();
    PipelineResult result = pipeline.run(series, range, sampling);
    return publish(ticket, result) ? Optional.of(result) : Optional.empty();
  }

  public Optional<PipelineResult> latest() {
    Published current = latest.get();
    return current == null ? Optional.empty() : Optional.of(current.result());
  }

  long beginRequest() {
    return requested.incrementAndGet();
  }

  boolean publish(long ticket, PipelineResult result) {
    if (ticket != requested.get()) {
      log.debug("Discarding stale result for request {} (newest is {})", ticket, requested.get());
      return false;
    }
    Published next = new Published(ticket, result);
    Published prev = latest.getAndAccumulate(next,
        (cur, cand) -> cur == null || cand.ticket() > cur.ticket() ? cand : cur);
    return prev == null || prev.ticket() < ticket;
  }

  private record Published(long ticket, PipelineResult result) {}
}
