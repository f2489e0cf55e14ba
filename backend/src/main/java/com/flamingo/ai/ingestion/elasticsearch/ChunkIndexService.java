package com.flamingo.ai.ingestion.elasticsearch;

import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.CHUNK_INDEX;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.EXTRACTION;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.FILE_NAME;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.MIME_TYPE;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.PAGE;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.PART_KEY;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.SOURCE_ID;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.SOURCE_SERVICE;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.TASK_ID;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.TITLE;
import static com.flamingo.ai.ingestion.domain.model.MetadataKeys.USER_ID;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.service.vector.VectorRecord;
import com.flamingo.ai.ingestion.service.vector.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index holding ingested chunks and their embeddings.
 *
 * <p>Identity fields used by delete filters are mapped as keywords at the top level of each
 * document. The full chunk metadata is kept unindexed under {@code metadata}.
 */
@Service
@Slf4j
public class ChunkIndexService extends AbstractElasticsearchIndexService<VectorRecord>
    implements VectorStore {

  /** Keyword fields copied from metadata to the document root and accepted in delete filters. */
  static final Set<String> KEYWORD_FIELDS =
      Set.of(
          SOURCE_SERVICE, USER_ID, SOURCE_ID, FILE_NAME, PART_KEY, MIME_TYPE, TASK_ID, EXTRACTION);

  private static final Set<String> INTEGER_FIELDS = Set.of(PAGE, CHUNK_INDEX);

  @Value("${ingestion.elasticsearch.index-name:ingested-chunks}")
  private String indexName;

  @Value("${ingestion.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  private final Clock clock;

  @Autowired
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry, Clock clock) {
    super(elasticsearchClient, meterRegistry);
    this.clock = clock;
  }

  @VisibleForTesting
  ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      Clock clock,
      String indexName,
      int vectorDimensions) {
    this(elasticsearchClient, meterRegistry, clock);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_index";
  }

  @Override
  public long delete(Map<String, Object> criteria) {
    return deleteBy(criteria);
  }

  @Override
  public void upsert(List<VectorRecord> records) {
    indexDocuments(records);
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Delete filters match these exactly, so they must be keywords.
    for (String field : KEYWORD_FIELDS) {
      properties.put(field, Property.of(p -> p.keyword(k -> k)));
    }
    for (String field : INTEGER_FIELDS) {
      properties.put(field, Property.of(p -> p.integer(i -> i)));
    }
    properties.put(TITLE, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    properties.put("metadata", Property.of(p -> p.object(o -> o.enabled(false))));
    properties.put(MetadataKeys.INGESTED_AT, Property.of(p -> p.date(d -> d)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(VectorRecord record) {
    Map<String, Object> metadata = record.metadata();
    Map<String, Object> doc = new HashMap<>();
    doc.put("content", record.content());
    doc.put("embedding", record.embedding());
    doc.put("metadata", metadata);
    for (String field : KEYWORD_FIELDS) {
      Object value = metadata.get(field);
      if (value != null) {
        doc.put(field, value.toString());
      }
    }
    for (String field : INTEGER_FIELDS) {
      if (metadata.get(field) instanceof Number n) {
        doc.put(field, n.intValue());
      }
    }
    if (metadata.get(TITLE) != null) {
      doc.put(TITLE, metadata.get(TITLE).toString());
    }
    doc.put(MetadataKeys.INGESTED_AT, Instant.now(clock).toString());
    return doc;
  }

  @Override
  protected String getDocumentId(VectorRecord record) {
    return record.id();
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    if (criteria.isEmpty()) {
      throw new IllegalArgumentException("Refusing to delete with empty criteria");
    }
    for (String field : criteria.keySet()) {
      if (!KEYWORD_FIELDS.contains(field)) {
        throw new IllegalArgumentException("Field is not filterable: " + field);
      }
    }
    return Query.of(
        q ->
            q.bool(
                b -> {
                  criteria.forEach(
                      (field, value) ->
                          b.filter(f -> f.term(t -> t.field(field).value(String.valueOf(value)))));
                  return b;
                }));
  }
}
