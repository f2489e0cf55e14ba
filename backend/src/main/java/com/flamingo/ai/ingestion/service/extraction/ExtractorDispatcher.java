package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.UnsupportedMediaTypeException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionFailure;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourceItem;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes every part of a source item to its extractor and collects the resulting segments.
 *
 * <p>A part that cannot be extracted is recorded as a failure and skipped; its siblings are still
 * extracted. Segment metadata is layered as item metadata, then part details ({@code fileName},
 * {@code mimeType}, {@code ext}, {@code partKey}), then whatever the extractor adds.
 *
 * <p>The part key combines the part name, its position in the item and a hash of its bytes, so two
 * attachments sharing a name within one thread never share chunk ids. A part key set by the
 * extractor on a segment is appended to it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractorDispatcher {

  private final ContentExtractorRegistry registry;
  private final MeterRegistry meterRegistry;

  public ExtractionResult extract(SourceItem item) {
    ExtractionResult result = new ExtractionResult(List.of(), List.of());
    List<SourcePart> parts = item.parts();
    for (int i = 0; i < parts.size(); i++) {
      result = result.merge(extractPart(item, parts.get(i), i));
    }
    return result;
  }

  private ExtractionResult extractPart(SourceItem item, SourcePart part, int position) {
    String name = part.fileName() != null ? part.fileName() : item.sourceId();
    ContentExtractor extractor;
    try {
      extractor = registry.resolve(part.mediaType(), part.fileName());
    } catch (UnsupportedMediaTypeException e) {
      log.warn("Skipping {} in source {}: {}", name, item.sourceId(), e.getMessage());
      meterRegistry.counter("extraction.unsupported").increment();
      return ExtractionResult.failed(new ExtractionFailure(name, e.getMessage(), true));
    }

    try {
      ExtractionResult partResult = extractor.extract(part);
      String partKey = partKey(name, position, part.content());
      Map<String, Object> partMetadata = partMetadata(item, part, partKey);
      List<ExtractedSegment> segments = new ArrayList<>(partResult.segments().size());
      for (ExtractedSegment segment : partResult.segments()) {
        Map<String, Object> metadata = new LinkedHashMap<>(partMetadata);
        metadata.putAll(segment.metadata());
        Object segmentKey = segment.metadata().get(MetadataKeys.PART_KEY);
        if (segmentKey != null) {
          metadata.put(MetadataKeys.PART_KEY, partKey + "/" + segmentKey);
        }
        segments.add(new ExtractedSegment(segment.text(), metadata));
      }
      meterRegistry.counter("extraction.parts.success").increment();
      if (partResult.hasFailures()) {
        meterRegistry
            .counter("extraction.partial_failures")
            .increment(partResult.failures().size());
      }
      return new ExtractionResult(segments, partResult.failures());
    } catch (RuntimeException e) {
      log.warn(
          "Extraction failed for {} in source {}: {}", name, item.sourceId(), e.getMessage());
      meterRegistry.counter("extraction.parts.failure").increment();
      return ExtractionResult.failed(new ExtractionFailure(name, e.getMessage(), false));
    }
  }

  @VisibleForTesting
  static String partKey(String name, int position, byte[] content) {
    return name + "-" + position + "-" + Hashing.sha256().hashBytes(content);
  }

  private static Map<String, Object> partMetadata(
      SourceItem item, SourcePart part, String partKey) {
    Map<String, Object> metadata = new LinkedHashMap<>(item.metadata());
    if (part.fileName() != null) {
      metadata.put(MetadataKeys.FILE_NAME, part.fileName());
      String ext = ContentExtractorRegistry.extensionOf(part.fileName());
      if (!ext.isEmpty()) {
        metadata.put(MetadataKeys.EXT, ext);
      }
    }
    if (part.mediaType() != null) {
      metadata.put(
          MetadataKeys.MIME_TYPE, ContentExtractorRegistry.normalizeMediaType(part.mediaType()));
    }
    metadata.putAll(part.metadata());
    metadata.put(MetadataKeys.PART_KEY, partKey);
    return metadata;
  }
}
