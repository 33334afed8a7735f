package com.ospicorp.navseries.series.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.service.IngestionNormalizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvRecordSourceTest {

  @TempDir
  Path tempDir;

  @Test
  void readsHeaderKeyedRowsAndSkipsBlankLines() throws IOException {
    Path file = tempDir.resolve("nav.csv");
    Files.writeString(file, String.join("\n",
        "Scheme Name,NAV Date,NAV (Rs)",
        "Growth Fund,02-01-2024,101.25",
        "",
        ",,",
        "Growth Fund,01-01-2024,100.5",
        "Growth Fund,bad-date,99",
        ""), StandardCharsets.UTF_8);

    var rows = new CsvRecordSource(file).fetch();

    assertEquals(3, rows.size());
    assertEquals("Growth Fund", rows.get(0).get("Scheme Name"));
    assertEquals("02-01-2024", rows.get(0).get("NAV Date"));

    var report = new IngestionNormalizer().normalizeWithReport(rows);
    assertEquals(1, report.rejected());
    assertThat(report.series().asList()).containsExactly(
        new Observation(LocalDate.of(2024, 1, 1), 100.5),
        new Observation(LocalDate.of(2024, 1, 2), 101.25));
  }

  @Test
  void missingFileSurfacesAsSourceFailure() {
    var source = new CsvRecordSource(tempDir.resolve("absent.csv"));

    var ex = assertThrows(RecordSourceException.class, source::fetch);
    assertThat(ex.getCause()).isInstanceOf(IOException.class);
    assertThat(source.describe()).startsWith("csv:");
  }
}
