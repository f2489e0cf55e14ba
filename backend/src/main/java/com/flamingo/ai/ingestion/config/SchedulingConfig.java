package com.flamingo.ai.ingestion.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Enables the periodic re-ingestion sweep and the stale task monitor. */
@Configuration
@EnableScheduling
public class SchedulingConfig {

  /** Wall clock used for task timestamps and scheduling cursors. */
  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
