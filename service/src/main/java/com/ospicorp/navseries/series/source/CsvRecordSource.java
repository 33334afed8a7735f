package com.ospicorp.navseries.series.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CsvRecordSource implements RecordSource {

  private static final Logger log = LoggerFactory.getLogger(CsvRecordSource.class);

  private final Path file;
  private final CsvMapper mapper = new CsvMapper();

  public CsvRecordSource(Path file) {
    this.file = Objects.requireNonNull(file, "file");
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
  }

  @Override
  public List<Map<String, Object>> fetch() {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException ex) {
      throw new RecordSourceException("Failed to read records from " + file, ex);
    }
  }

  List<Map<String, Object>> read(Reader reader) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<Map<String, Object>> rows = new ArrayList<>();
    int blank = 0;
    try (MappingIterator<Map<String, Object>> it = mapper
        .readerFor(new TypeReference<Map<String, Object>>() {})
        .with(schema)
        .readValues(reader)) {
      while (it.hasNextValue()) {
        Map<String, Object> row = it.nextValue();
        if (isBlank(row)) {
          blank++;
          continue;
        }
        rows.add(row);
      }
    }
    log.info("Read {} row(s) from {} ({} blank skipped)", rows.size(), file, blank);
    return rows;
  }

  @Override
  public String describe() {
    return "csv:" + file;
  }

  private static boolean isBlank(Map<String, Object> row) {
    for (Object value : row.values()) {
      if (value != null && !value.toString().isBlank()) {
        return false;
      }
    }
    return true;
  }
}
