package com.ospicorp.navseries;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.navseries.series.service.IngestionNormalizer;
import com.ospicorp.navseries.series.service.SeriesPipeline;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = "navseries.input.date-patterns=dd-MM-uuuu,uuuu-MM-dd,dd/MM/uuuu")
class NavSeriesApplicationTest {

  @Autowired
  private ApplicationContext context;

  @Autowired
  private IngestionNormalizer normalizer;

  @Test
  void contextLoads() {
    assertThat(context).isNotNull();
    assertThat(context.getBean(SeriesPipeline.class)).isNotNull();
    assertThat(normalizer.dateField()).isEqualTo("NAV Date");
    assertThat(normalizer.valueField()).isEqualTo("NAV (Rs)");
    assertThat(normalizer.normalize(List.of(
        Map.of("NAV Date", "15/03/2024", "NAV (Rs)", "1")))).hasSize(1);
  }
}
