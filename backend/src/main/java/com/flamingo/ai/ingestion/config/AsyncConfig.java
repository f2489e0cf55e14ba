package com.flamingo.ai.ingestion.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools for ingestion tasks.
 *
 * <p>Manual submissions and scheduled re-ingestion run on separate bounded pools so a large
 * scheduled sweep cannot starve user-triggered work. Both pools publish queue depth and active
 * worker gauges, and the {@code @Timed} stages that run on them are timed through {@link
 * TimedAspect}.
 */
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

  public static final String MANUAL_EXECUTOR = "manualIngestionExecutor";
  public static final String SCHEDULED_EXECUTOR = "scheduledIngestionExecutor";

  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  @Bean(name = MANUAL_EXECUTOR)
  public ThreadPoolTaskExecutor manualIngestionExecutor() {
    return buildExecutor("manual", "ingest-manual-", ingestionConfig.getWorkers().getManual());
  }

  @Bean(name = SCHEDULED_EXECUTOR)
  public ThreadPoolTaskExecutor scheduledIngestionExecutor() {
    return buildExecutor(
        "scheduled", "ingest-scheduled-", ingestionConfig.getWorkers().getScheduled());
  }

  @Bean
  public TimedAspect timedAspect() {
    return new TimedAspect(meterRegistry);
  }

  private ThreadPoolTaskExecutor buildExecutor(
      String poolName, String threadPrefix, IngestionConfig.Workers.Pool pool) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(pool.getCoreSize());
    executor.setMaxPoolSize(pool.getMaxSize());
    executor.setQueueCapacity(pool.getQueueCapacity());
    executor.setThreadNamePrefix(threadPrefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();

    Gauge.builder("ingestion.workers.queue", executor, e -> e.getQueueSize())
        .tag("pool", poolName)
        .description("Ingestion tasks waiting for a worker")
        .register(meterRegistry);
    Gauge.builder("ingestion.workers.active", executor, e -> e.getActiveCount())
        .tag("pool", poolName)
        .description("Ingestion tasks currently running")
        .register(meterRegistry);
    return executor;
  }
}
