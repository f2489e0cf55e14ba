package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.exception.LlmServiceException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link ContentExtractor} for PNG and JPEG files, read entirely through OCR. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImageContentExtractor implements ContentExtractor {

  private final OcrService ocrService;

  @Override
  public Set<String> supportedMediaTypes() {
    return Set.of("image/png", "image/jpeg", "image/jpg");
  }

  @Override
  public Set<String> supportedExtensions() {
    return Set.of("png", "jpg", "jpeg");
  }

  @Override
  public ExtractionResult extract(SourcePart part) {
    if (part.content().length == 0) {
      throw new ExtractionException(part.fileName(), "Image is empty");
    }
    String mediaType =
        "png".equals(ContentExtractorRegistry.extensionOf(part.fileName()))
                || "image/png".equals(ContentExtractorRegistry.normalizeMediaType(part.mediaType()))
            ? "image/png"
            : "image/jpeg";
    try {
      String text = ocrService.extractText(part.content(), mediaType);
      return ExtractionResult.of(
          List.of(new ExtractedSegment(text, Map.of(MetadataKeys.EXTRACTION, "ocr"))));
    } catch (LlmServiceException e) {
      throw new ExtractionException(part.fileName(), "OCR failed: " + e.getMessage(), e);
    }
  }
}
