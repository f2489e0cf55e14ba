package com.flamingo.ai.ingestion.service.task;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Reports tasks stuck in progress. Tasks are left untouched; re-running a source is always safe,
 * so recovery is a resubmission.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StaleTaskMonitor {

  private final TaskStore taskStore;
  private final IngestionConfig ingestionConfig;
  private final MeterRegistry meterRegistry;

  @Scheduled(
      fixedDelayString = "${ingestion.tasks.stale-check-interval:PT30M}",
      initialDelayString = "${ingestion.tasks.stale-check-interval:PT30M}")
  public void reportStaleTasks() {
    List<IngestionTask> stale = taskStore.findStale(ingestionConfig.getTasks().getStaleAfter());
    if (stale.isEmpty()) {
      return;
    }
    meterRegistry.counter("ingestion.task.stale").increment(stale.size());
    for (IngestionTask task : stale) {
      log.warn(
          "Task {} ({} for owner {}) has been in progress since {} without updates",
          task.getId(),
          task.getService().getKey(),
          task.getOwnerId(),
          task.getUpdatedAt());
    }
  }
}
