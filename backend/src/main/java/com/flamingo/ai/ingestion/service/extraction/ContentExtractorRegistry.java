package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.exception.UnsupportedMediaTypeException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lookup table from media type and file extension to the extractor that handles it.
 *
 * <p>The declared media type wins; the extension is used when the media type is missing, generic
 * ({@code application/octet-stream}) or unknown.
 */
@Component
@Slf4j
public class ContentExtractorRegistry {

  private final Map<String, ContentExtractor> byMediaType = new HashMap<>();
  private final Map<String, ContentExtractor> byExtension = new HashMap<>();

  public ContentExtractorRegistry(List<ContentExtractor> extractors) {
    for (ContentExtractor extractor : extractors) {
      for (String mediaType : extractor.supportedMediaTypes()) {
        register(byMediaType, normalizeMediaType(mediaType), extractor);
      }
      for (String extension : extractor.supportedExtensions()) {
        register(byExtension, extension.toLowerCase(Locale.ROOT), extractor);
      }
    }
    log.info(
        "Registered {} extractors for {} media types and {} extensions",
        extractors.size(),
        byMediaType.size(),
        byExtension.size());
  }

  /**
   * Returns the extractor for a part.
   *
   * @param mediaType declared media type, may be null
   * @param fileName file name, may be null
   * @return the matching extractor
   * @throws UnsupportedMediaTypeException if neither the media type nor the extension is known
   */
  public ContentExtractor resolve(String mediaType, String fileName) {
    ContentExtractor extractor = byMediaType.get(normalizeMediaType(mediaType));
    if (extractor == null) {
      extractor = byExtension.get(extensionOf(fileName));
    }
    if (extractor == null) {
      throw new UnsupportedMediaTypeException(mediaType, fileName);
    }
    return extractor;
  }

  public boolean supports(String mediaType, String fileName) {
    return byMediaType.containsKey(normalizeMediaType(mediaType))
        || byExtension.containsKey(extensionOf(fileName));
  }

  /** Lower-cases a media type and drops parameters such as {@code charset}. */
  public static String normalizeMediaType(String mediaType) {
    if (mediaType == null) {
      return "";
    }
    int parameters = mediaType.indexOf(';');
    String base = parameters >= 0 ? mediaType.substring(0, parameters) : mediaType;
    return base.trim().toLowerCase(Locale.ROOT);
  }

  /** Returns the lower-case extension of a file name without the dot, or an empty string. */
  public static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static void register(
      Map<String, ContentExtractor> table, String key, ContentExtractor extractor) {
    ContentExtractor previous = table.putIfAbsent(key, extractor);
    if (previous != null && previous != extractor) {
      throw new IllegalStateException(
          String.format(
              "'%s' is claimed by both %s and %s",
              key, previous.getClass().getSimpleName(), extractor.getClass().getSimpleName()));
    }
  }
}
