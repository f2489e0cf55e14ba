package com.flamingo.ai.ingestion.service.extraction;

/**
 * Reads text out of an image.
 *
 * <p>Implementations do not retry; callers decide what a failure means for their item.
 */
public interface OcrService {

  /**
   * @param image encoded image bytes
   * @param mediaType image media type, e.g. {@code image/png}
   * @return the recognized text, possibly empty
   * @throws com.flamingo.ai.ingestion.exception.LlmServiceException if the call or its response
   *     parsing fails
   */
  String extractText(byte[] image, String mediaType);
}
