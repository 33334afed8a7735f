package com.ospicorp.navseries.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.navseries.series.InvalidConfigurationException;
import com.ospicorp.navseries.series.export.SeriesCsvExporter;
import com.ospicorp.navseries.series.service.DashboardSession;
import com.ospicorp.navseries.series.service.IngestionNormalizer;
import com.ospicorp.navseries.series.service.SeriesPipeline;
import com.ospicorp.navseries.series.source.CsvRecordSource;
import com.ospicorp.navseries.series.source.MockNavGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NavSeriesRunnerTest {

  private final IngestionNormalizer normalizer = new IngestionNormalizer();
  private final SeriesPipeline pipeline = new SeriesPipeline(normalizer);

  @TempDir
  Path tempDir;

  private NavSeriesRunner runner(boolean enabled, String input, String strategy, int maxPoints,
      String start, String end, int trailingDays, String export) {
    return new NavSeriesRunner(pipeline, normalizer, new SeriesCsvExporter(), enabled, input,
        "Scheme Name", strategy, maxPoints, start, end, trailingDays, export, 1L, 120);
  }

  @Test
  void exportsSampledSeriesFromCsvInput() throws IOException {
    Path input = tempDir.resolve("nav.csv");
    Files.writeString(input, String.join("\n",
        "Scheme Name,NAV Date,NAV (Rs)",
        "A,01-01-2024,10",
        "A,02-01-2024,11",
        "B,03-01-2024,12",
        "B,04-01-2024,13",
        "B,05-01-2024,14"));
    Path export = tempDir.resolve("sampled.csv");

    runner(true, input.toString(), "recent", 2, "2024-01-02", "", 0, export.toString()).run();

    assertThat(Files.readAllLines(export))
        .containsExactly("date,value", "2024-01-04,13.0", "2024-01-05,14.0");
  }

  @Test
  void disabledRunnerDoesNothing() {
    Path export = tempDir.resolve("never.csv");
    runner(false, "", "uniform", 10, "", "", 0, export.toString()).run();
    assertFalse(Files.exists(export));
  }

  @Test
  void unknownStrategyFailsBeforeLoading() {
    var r = runner(true, tempDir.resolve("missing.csv").toString(), "zigzag", 10, "", "", 0, "");
    var ex = assertThrows(InvalidConfigurationException.class, r::run);
    assertEquals(2002, ex.errorCode());
  }

  @Test
  void choosesSourceFromInputProperty() {
    assertThat(runner(true, "", "uniform", 10, "", "", 0, "").resolveSource())
        .isInstanceOf(MockNavGenerator.class);
    assertThat(runner(true, "nav.csv", "uniform", 10, "", "", 0, "").resolveSource())
        .isInstanceOf(CsvRecordSource.class);
  }

  @Test
  void trailingDaysAnchorOnLatestObservation() {
    var records = new MockNavGenerator(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30), 1L,
        null).fetch();
    var session = new DashboardSession(pipeline, normalizer, records);

    var range = runner(true, "", "uniform", 10, "", "", 30, "").resolveRange(session);

    assertEquals(LocalDate.of(2024, 5, 31), range.start());
    assertEquals(LocalDate.of(2024, 6, 30), range.end());
  }

  @Test
  void malformedRangePropertyIsRejected() {
    var session = new DashboardSession(pipeline, normalizer, List.of());
    var r = runner(true, "", "uniform", 10, "01/01/2024", "", 0, "");
    assertThrows(IllegalArgumentException.class, () -> r.resolveRange(session));
  }
}
