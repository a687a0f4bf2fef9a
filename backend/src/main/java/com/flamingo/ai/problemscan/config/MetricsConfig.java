package com.flamingo.ai.problemscan.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  @Value("${spring.application.name:problemscan}")
  private String applicationName;

  /** Enables {@code @Timed} on pipeline, OCR and retrieval entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterFilter applicationTagFilter() {
    return MeterFilter.commonTags(List.of(Tag.of("application", applicationName)));
  }
}
