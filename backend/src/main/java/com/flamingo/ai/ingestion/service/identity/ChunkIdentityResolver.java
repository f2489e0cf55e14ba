package com.flamingo.ai.ingestion.service.identity;

import static com.google.common.base.Strings.nullToEmpty;

import com.flamingo.ai.ingestion.domain.enums.SourceService;
import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.service.ingestion.model.Chunk;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes deterministic chunk ids and the filter that purges a source's previous generation.
 *
 * <p>A chunk id is {@code sha256(service|userId|sourceId|partKey)} followed by the page (when the
 * chunk comes from a paged document) and the chunk index. Ingesting an unchanged source therefore
 * produces the same ids; the dedup filter covers the case where the number of chunks shrank.
 */
@Component
public class ChunkIdentityResolver {

  private static final String FIELD_SEPARATOR = "|";

  /**
   * Returns the SHA-256 hex digest of the stable fields identifying one part of a source.
   *
   * @param service the source service
   * @param userId owner of the content
   * @param sourceId thread id, file id or file name
   * @param partKey attachment name, file name or per-event key; may be empty
   */
  public String baseHash(SourceService service, String userId, String sourceId, String partKey) {
    String stableKey =
        String.join(
            FIELD_SEPARATOR,
            service.getKey(),
            nullToEmpty(userId),
            nullToEmpty(sourceId),
            nullToEmpty(partKey));
    return Hashing.sha256().hashString(stableKey, StandardCharsets.UTF_8).toString();
  }

  /**
   * Returns copies of the chunks with ids assigned.
   *
   * <p>The part key and page are read from each chunk's metadata.
   */
  public List<Chunk> assignIds(
      SourceService service, String userId, String sourceId, List<Chunk> chunks) {
    List<Chunk> identified = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      Object partKey = chunk.metadata().get(MetadataKeys.PART_KEY);
      String base = baseHash(service, userId, sourceId, partKey != null ? partKey.toString() : "");
      Object page = chunk.metadata().get(MetadataKeys.PAGE);
      String id =
          page != null
              ? base + "-" + page + "-" + chunk.chunkIndex()
              : base + "-" + chunk.chunkIndex();
      identified.add(chunk.withId(id));
    }
    return identified;
  }

  /**
   * Returns the delete criteria for every chunk of a source.
   *
   * <p>Email threads and drive files match on {@code sourceId}; uploaded files match on {@code
   * fileName}, which is the upload's source id.
   */
  public DedupFilter dedupFilter(SourceService service, String userId, String sourceId) {
    Map<String, Object> criteria = new LinkedHashMap<>();
    criteria.put(MetadataKeys.SOURCE_SERVICE, service.getKey());
    criteria.put(MetadataKeys.USER_ID, userId);
    criteria.put(service.getDedupField(), sourceId);
    return new DedupFilter(criteria);
  }
}
