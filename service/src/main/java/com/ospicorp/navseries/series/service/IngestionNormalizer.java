package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns loosely typed records (spreadsheet rows, generated maps) into a date-ordered
 * {@link ObservationSeries}. Rows that cannot be read are dropped and counted, never fatal.
 */
public class IngestionNormalizer {

  public static final String DEFAULT_DATE_FIELD = "NAV Date";
  public static final String DEFAULT_VALUE_FIELD = "NAV (Rs)";
  public static final List<String> DEFAULT_DATE_PATTERNS = List.of("dd-MM-uuuu", "uuuu-MM-dd");

  // Plain decimal text only; rejects hex and Java suffix forms such as "10d"
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private static final Logger log = LoggerFactory.getLogger(IngestionNormalizer.class);

  private final String dateField;
  private final String valueField;
  private final List<DateTimeFormatter> dateFormats;

  public IngestionNormalizer() {
    this(DEFAULT_DATE_FIELD, DEFAULT_VALUE_FIELD, DEFAULT_DATE_PATTERNS);
  }

  public IngestionNormalizer(String dateField, String valueField, List<String> datePatterns) {
    this.dateField = Objects.requireNonNull(dateField, "dateField");
    this.valueField = Objects.requireNonNull(valueField, "valueField");
    if (datePatterns == null || datePatterns.isEmpty()) {
      throw new IllegalArgumentException("at least one date pattern is required");
    }
    List<DateTimeFormatter> formats = new ArrayList<>(datePatterns.size());
    for (String pattern : datePatterns) {
      formats.add(DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT));
    }
    this.dateFormats = List.copyOf(formats);
  }

  public String dateField() {
    return dateField;
  }

  public String valueField() {
    return valueField;
  }

  public ObservationSeries normalize(Iterable<? extends Map<String, ?>> records) {
    return normalizeWithReport(records).series();
  }

  public IngestionReport normalizeWithReport(Iterable<? extends Map<String, ?>> records) {
    List<Observation> accepted = new ArrayList<>();
    int rejected = 0;
    if (records != null) {
      for (Map<String, ?> record : records) {
        Observation observation = toObservation(record);
        if (observation == null) {
          rejected++;
        } else {
          accepted.add(observation);
        }
      }
    }
    if (rejected > 0) {
      log.warn("Dropped {} malformed record(s); kept {}", rejected, accepted.size());
    } else {
      log.debug("Normalized {} record(s)", accepted.size());
    }
    return new IngestionReport(ObservationSeries.sorted(accepted), accepted.size(), rejected);
  }

  Observation toObservation(Map<String, ?> record) {
    if (record == null) {
      return null;
    }
    LocalDate date = parseDate(record.get(dateField));
    if (date == null) {
      return null;
    }
    Double value = parseValue(record.get(valueField));
    if (value == null) {
      return null;
    }
    return new Observation(date, value);
  }

  LocalDate parseDate(Object raw) {
    if (raw instanceof LocalDate date) {
      return date;
    }
    if (raw instanceof LocalDateTime dateTime) {
      return dateTime.toLocalDate();
    }
    if (!(raw instanceof CharSequence text)) {
      return null;
    }
    String trimmed = text.toString().trim();
    if (trimmed.isEmpty()) {
      return null;
    }
    for (DateTimeFormatter format : dateFormats) {
      LocalDate date = tryParse(trimmed, format);
      if (date != null) {
        return date;
      }
    }
    return null;
  }

  private static LocalDate tryParse(String text, DateTimeFormatter format) {
    try {
      return LocalDate.parse(text, format);
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  static Double parseValue(Object raw) {
    double value;
    if (raw instanceof Number number) {
      value = number.doubleValue();
    } else if (raw instanceof CharSequence text) {
      String trimmed = text.toString().trim();
      if (!DECIMAL.matcher(trimmed).matches()) {
        return null;
      }
      try {
        value = Double.parseDouble(trimmed);
      } catch (NumberFormatException ex) {
        return null;
      }
    } else {
      return null;
    }
    return Double.isFinite(value) ? value : null;
  }

  public record IngestionReport(ObservationSeries series, int accepted, int rejected) {}
}
