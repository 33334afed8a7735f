package com.ospicorp.navseries.series.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class SeriesCsvExporter {
  private final CsvMapper mapper = new CsvMapper();
  private final CsvSchema schema = mapper.schemaFor(Row.class).withHeader();

  public void write(ObservationSeries series, Writer out) throws IOException {
    SequenceWriter writer = mapper.writer(schema).writeValues(out);
    for (Observation o : series) {
      writer.write(new Row(o.date().toString(), o.value()));
    }
    writer.flush();
  }

  public void write(ObservationSeries series, Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      write(series, out);
    }
  }

  @JsonPropertyOrder({"date", "value"})
  public record Row(String date, double value) {}
}
