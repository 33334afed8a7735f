package com.ospicorp.navseries.series.export;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SeriesCsvExporterTest {

  private static final ObservationSeries SERIES = ObservationSeries.ofOrdered(List.of(
      new Observation(LocalDate.of(2024, 1, 1), 100.5),
      new Observation(LocalDate.of(2024, 1, 3), 90.25)));

  @TempDir
  Path tempDir;

  @Test
  void writesHeaderThenOneRowPerObservation() throws IOException {
    StringWriter out = new StringWriter();

    new SeriesCsvExporter().write(SERIES, out);

    assertThat(out.toString().lines().toList())
        .containsExactly("date,value", "2024-01-01,100.5", "2024-01-03,90.25");
  }

  @Test
  void emptySeriesStillCreatesTargetFile() throws IOException {
    Path target = tempDir.resolve("out/nav.csv");

    new SeriesCsvExporter().write(ObservationSeries.empty(), target);

    assertThat(Files.exists(target)).isTrue();
  }
}
