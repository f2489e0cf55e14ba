package com.flamingo.ai.ingestion.service.ingestion;

import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.service.identity.ChunkIdentityResolver;
import com.flamingo.ai.ingestion.service.identity.DedupFilter;
import com.flamingo.ai.ingestion.service.vector.VectorUpsertClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Removes everything stored for one source, using the same filter re-ingestion deletes with. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceDeletionService {

  private final ChunkIdentityResolver identityResolver;
  private final VectorUpsertClient vectorUpsertClient;
  private final MeterRegistry meterRegistry;

  /**
   * Deletes a source's chunks.
   *
   * @param service source service
   * @param ownerId owner of the source
   * @param sourceId thread id, drive file id, or uploaded file name
   * @return number of deleted chunks
   */
  public long deleteSource(SourceService service, String ownerId, String sourceId) {
    DedupFilter filter = identityResolver.dedupFilter(service, ownerId, sourceId);
    long deleted = vectorUpsertClient.delete(filter);
    meterRegistry.counter("ingestion.sources.deleted").increment();
    log.info(
        "Deleted source {} of owner {} on {}: {} chunks removed",
        sourceId,
        ownerId,
        service.getKey(),
        deleted);
    return deleted;
  }
}
