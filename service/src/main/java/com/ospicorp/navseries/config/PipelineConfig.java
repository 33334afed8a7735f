package com.ospicorp.navseries.config;

import com.ospicorp.navseries.series.export.SeriesCsvExporter;
import com.ospicorp.navseries.series.service.IngestionNormalizer;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

  @Bean
  IngestionNormalizer ingestionNormalizer(
      @Value("${navseries.input.date-field:NAV Date}") String dateField,
      @Value("${navseries.input.value-field:NAV (Rs)}") String valueField,
      @Value("${navseries.input.date-patterns:dd-MM-uuuu,uuuu-MM-dd}") List<String> datePatterns) {
    return new IngestionNormalizer(dateField, valueField, datePatterns);
  }

  @Bean
  SeriesCsvExporter seriesCsvExporter() {
    return new SeriesCsvExporter();
  }
}
