package com.ospicorp.navseries.config;

import com.ospicorp.navseries.series.export.SeriesCsvExporter;
import com.ospicorp.navseries.series.model.DateRange;
import com.ospicorp.navseries.series.model.SamplingConfig;
import com.ospicorp.navseries.series.service.DashboardSession;
import com.ospicorp.navseries.series.service.IngestionNormalizer;
import com.ospicorp.navseries.series.service.PipelineResult;
import com.ospicorp.navseries.series.service.SeriesPipeline;
import com.ospicorp.navseries.series.service.StatisticsFormatter;
import com.ospicorp.navseries.series.source.CsvRecordSource;
import com.ospicorp.navseries.series.source.MockNavGenerator;
import com.ospicorp.navseries.series.source.RecordSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Loads one batch of NAV rows (a CSV file, or generated demo data when no file is configured),
 * runs the pipeline per scheme and logs the statistics. Optionally writes the sampled series of
 * the whole batch to CSV.
 */
@Component
public class NavSeriesRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(NavSeriesRunner.class);

  private final SeriesPipeline pipeline;
  private final IngestionNormalizer normalizer;
  private final SeriesCsvExporter exporter;
  private final boolean enabled;
  private final String inputFile;
  private final String schemeField;
  private final String strategy;
  private final int maxPoints;
  private final String rangeStart;
  private final String rangeEnd;
  private final int trailingDays;
  private final String exportFile;
  private final long mockSeed;
  private final int mockDays;

  public NavSeriesRunner(SeriesPipeline pipeline,
      IngestionNormalizer normalizer,
      SeriesCsvExporter exporter,
      @Value("${navseries.runner.enabled:true}") boolean enabled,
      @Value("${navseries.input.file:}") String inputFile,
      @Value("${navseries.input.scheme-field:Scheme Name}") String schemeField,
      @Value("${navseries.sampling.strategy:uniform}") String strategy,
      @Value("${navseries.sampling.max-points:100}") int maxPoints,
      @Value("${navseries.range.start:}") String rangeStart,
      @Value("${navseries.range.end:}") String rangeEnd,
      @Value("${navseries.range.trailing-days:0}") int trailingDays,
      @Value("${navseries.export.file:}") String exportFile,
      @Value("${navseries.mock.seed:8675309}") long mockSeed,
      @Value("${navseries.mock.days:365}") int mockDays) {
    this.pipeline = pipeline;
    this.normalizer = normalizer;
    this.exporter = exporter;
    this.enabled = enabled;
    this.inputFile = inputFile;
    this.schemeField = schemeField;
    this.strategy = strategy;
    this.maxPoints = maxPoints;
    this.rangeStart = rangeStart;
    this.rangeEnd = rangeEnd;
    this.trailingDays = trailingDays;
    this.exportFile = exportFile;
    this.mockSeed = mockSeed;
    this.mockDays = mockDays;
  }

  @Override
  public void run(String... args) {
    if (!enabled) {
      log.info("NAV series runner disabled via property navseries.runner.enabled=false");
      return;
    }
    // Fail fast on bad sampling settings before touching the source
    SamplingConfig sampling = SamplingConfig.of(strategy, maxPoints);
    RecordSource source = resolveSource();
    log.info("Loading NAV records from {}", source.describe());
    List<Map<String, Object>> records = source.fetch();

    DashboardSession session = new DashboardSession(pipeline, normalizer, records);
    DateRange range = resolveRange(session);
    Optional<PipelineResult> overall = session.recompute(range, sampling);
    overall.ifPresent(this::report);

    Map<String, PipelineResult> byScheme = pipeline.runByScheme(records, schemeField, range,
        sampling);
    if (byScheme.size() > 1) {
      byScheme.forEach((scheme, result) -> log.info("Scheme '{}': {}", scheme, summaryLine(result)));
    }

    if (StringUtils.hasText(exportFile) && overall.isPresent()) {
      export(overall.get());
    }
  }

  RecordSource resolveSource() {
    if (StringUtils.hasText(inputFile)) {
      return new CsvRecordSource(Path.of(inputFile));
    }
    LocalDate end = LocalDate.now();
    return new MockNavGenerator(end.minusDays(mockDays), end, mockSeed, null);
  }

  DateRange resolveRange(DashboardSession session) {
    LocalDate start = parseDate(rangeStart, "navseries.range.start");
    LocalDate end = parseDate(rangeEnd, "navseries.range.end");
    if (trailingDays > 0 && start == null) {
      LocalDate anchor = end;
      if (anchor == null) {
        anchor = session.series().isEmpty() ? LocalDate.now() : session.series().last().date();
      }
      return DateRange.trailing(anchor, Period.ofDays(trailingDays));
    }
    return new DateRange(start, end);
  }

  private void report(PipelineResult result) {
    log.info("Range {}..{}: {} in range, {} rendered ({} rejected row(s))",
        result.range().start() == null ? "*" : result.range().start(),
        result.range().end() == null ? "*" : result.range().end(),
        result.filtered().size(), result.sampled().size(), result.rejectedRecords());
    log.info("Statistics: {}", summaryLine(result));
  }

  private static String summaryLine(PipelineResult result) {
    return result.statistics()
        .map(StatisticsFormatter::describe)
        .orElse("no data in range");
  }

  private void export(PipelineResult result) {
    Path target = Path.of(exportFile);
    try {
      exporter.write(result.sampled(), target);
      log.info("Exported {} sampled point(s) to {}", result.sampled().size(), target);
    } catch (IOException ex) {
      log.error("Export to {} failed: {}", target, ex.getMessage(), ex);
      throw new UncheckedIOException(ex);
    }
  }

  private static LocalDate parseDate(String value, String property) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("Invalid " + property + " '" + value
          + "'. Expected yyyy-MM-dd.", ex);
    }
  }
}
