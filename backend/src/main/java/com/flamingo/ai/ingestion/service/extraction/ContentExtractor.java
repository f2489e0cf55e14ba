package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import java.util.Set;

/**
 * Extracts plain text from one kind of content.
 *
 * <p>Implementations are Spring beans and are picked up by {@link ContentExtractorRegistry}; adding
 * a media type means adding an extractor, not touching the dispatcher.
 */
public interface ContentExtractor {

  /** Normalized media types handled by this extractor, e.g. {@code application/pdf}. */
  Set<String> supportedMediaTypes();

  /** Lower-case file extensions without the dot, used when the media type is unknown. */
  Set<String> supportedExtensions();

  /**
   * Extracts text segments from a part.
   *
   * <p>Failures scoped to a page or record are reported in the result and do not abort the rest of
   * the part.
   *
   * @param part the raw content
   * @return extracted segments and dropped pieces
   * @throws com.flamingo.ai.ingestion.exception.ExtractionException if the part cannot be read at
   *     all
   */
  ExtractionResult extract(SourcePart part);
}
