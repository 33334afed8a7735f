package com.ospicorp.navseries.series.source;

import com.ospicorp.navseries.series.service.IngestionNormalizer;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

// Deterministic daily random walk for demo data
public class MockNavGenerator implements RecordSource {

  public static final long DEFAULT_SEED = 8675309L;
  public static final String SCHEME_FIELD = "Scheme Name";

  private static final DateTimeFormatter SHEET_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");
  private static final double START_VALUE = 100.0;
  private static final double FLOOR = 50.0;
  private static final double TREND = 0.001;
  private static final double WEEKEND_FACTOR = 0.998;

  private final LocalDate start;
  private final LocalDate end;
  private final long seed;
  private final String scheme;

  public MockNavGenerator(LocalDate start, LocalDate end, long seed, String scheme) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = Objects.requireNonNull(end, "end");
    this.seed = seed;
    this.scheme = scheme;
  }

  @Override
  public List<Map<String, Object>> fetch() {
    Random random = new Random(seed);
    long days = ChronoUnit.DAYS.between(start, end);
    List<Map<String, Object>> rows = new ArrayList<>((int) Math.max(0, days + 1));
    double current = START_VALUE;
    for (long i = 0; i <= days; i++) {
      LocalDate date = start.plusDays(i);
      double volatility = 0.8 + random.nextDouble() * 0.4;
      double change = (random.nextDouble() - 0.5 + TREND) * volatility * 2;
      current = Math.max(FLOOR, current * (1 + change / 100));
      DayOfWeek dow = date.getDayOfWeek();
      if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
        current *= WEEKEND_FACTOR;
      }

      Map<String, Object> row = new LinkedHashMap<>();
      row.put(IngestionNormalizer.DEFAULT_DATE_FIELD, date.format(SHEET_DATE));
      row.put(IngestionNormalizer.DEFAULT_VALUE_FIELD, Math.round(current * 10_000d) / 10_000d);
      if (scheme != null) {
        row.put(SCHEME_FIELD, scheme);
      }
      rows.add(row);
    }
    return rows;
  }

  @Override
  public String describe() {
    return "mock:" + start + ".." + end + "@" + seed;
  }
}
