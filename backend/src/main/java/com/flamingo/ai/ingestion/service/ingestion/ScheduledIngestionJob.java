package com.flamingo.ai.ingestion.service.ingestion;

import com.flamingo.ai.ingestion.domain.entity.IngestionTask;
import com.flamingo.ai.ingestion.domain.entity.SourceSubscription;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import com.flamingo.ai.ingestion.domain.repository.SourceSubscriptionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.LocalDate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic re-ingestion of every enabled subscription.
 *
 * <p>A subscription whose {@code before} bound has passed is finished and skipped. Otherwise the
 * task collects from today when {@code before} lies in the future, or from the last sweep date.
 * The stored query is left as configured; only the sweep date and task id are recorded.
 */
@Component
@ConditionalOnProperty(prefix = "ingestion.scheduling", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ScheduledIngestionJob {

  private final SourceSubscriptionRepository subscriptionRepository;
  private final IngestionJobLauncher jobLauncher;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Scheduled(cron = "${ingestion.scheduling.cron:0 0 2 * * *}")
  public void run() {
    sweep();
  }

  /**
   * Submits one scheduled task per due subscription.
   *
   * @return number of submitted tasks
   */
  public int sweep() {
    LocalDate today = LocalDate.now(clock);
    int submitted = 0;
    for (SourceSubscription subscription : subscriptionRepository.findByEnabledTrue()) {
      try {
        if (submit(subscription, today)) {
          submitted++;
        }
      } catch (RuntimeException e) {
        meterRegistry.counter("ingestion.schedule.errors").increment();
        log.warn(
            "Scheduled ingestion for subscription {} failed: {}",
            subscription.getId(),
            e.getMessage());
      }
    }
    log.info("Scheduled sweep for {} submitted {} tasks", today, submitted);
    return submitted;
  }

  private boolean submit(SourceSubscription subscription, LocalDate today) {
    SourceQuery stored =
        subscription.getSourceQuery() != null ? subscription.getSourceQuery() : SourceQuery.empty();
    if (stored.before() != null && !stored.before().isAfter(today)) {
      log.debug("Subscription {} ended on {}, skipping", subscription.getId(), stored.before());
      return false;
    }
    if (!jobLauncher.canFetch(subscription.getService(), subscription.getOwnerId())) {
      log.warn(
          "Skipping subscription {}: no usable {} connector for owner {}",
          subscription.getId(),
          subscription.getService().getKey(),
          subscription.getOwnerId());
      return false;
    }

    SourceQuery query = stored;
    if (stored.before() != null) {
      query = stored.withAfter(today);
    } else if (subscription.getLastCollectDate() != null
        && (stored.after() == null || subscription.getLastCollectDate().isAfter(stored.after()))) {
      query = stored.withAfter(subscription.getLastCollectDate());
    }

    IngestionTask task =
        jobLauncher.submitScheduled(subscription.getOwnerId(), subscription.getService(), query);
    subscription.setLastCollectDate(today);
    subscription.setLastTaskId(task.getId());
    subscriptionRepository.save(subscription);
    meterRegistry.counter("ingestion.schedule.submitted").increment();
    return true;
  }
}
