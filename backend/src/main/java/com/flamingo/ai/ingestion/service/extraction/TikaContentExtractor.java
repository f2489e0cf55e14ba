package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link ContentExtractor} for Office documents, spreadsheets, plain text, Markdown and email
 * files.
 *
 * <p>Uses Apache Tika's {@link AutoDetectParser}; embedded documents such as attachments inside an
 * {@code .eml} or {@code .msg} file are parsed as well and their text is appended.
 */
@Service
@Slf4j
public class TikaContentExtractor implements ContentExtractor {

  private static final Set<String> MEDIA_TYPES =
      Set.of(
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/msword",
          "application/vnd.openxmlformats-officedocument.presentationml.presentation",
          "application/vnd.ms-powerpoint",
          "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
          "application/vnd.ms-excel",
          "text/plain",
          "text/markdown",
          "text/x-markdown",
          "message/rfc822",
          "application/vnd.ms-outlook");

  private static final Set<String> EXTENSIONS =
      Set.of("docx", "doc", "pptx", "ppt", "xlsx", "xls", "txt", "md", "eml", "msg");

  private final AutoDetectParser parser = new AutoDetectParser();

  @Override
  public Set<String> supportedMediaTypes() {
    return MEDIA_TYPES;
  }

  @Override
  public Set<String> supportedExtensions() {
    return EXTENSIONS;
  }

  @Override
  public ExtractionResult extract(SourcePart part) {
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (part.fileName() != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, part.fileName());
    }
    if (part.mediaType() != null) {
      metadata.set(Metadata.CONTENT_TYPE, part.mediaType());
    }
    ParseContext context = new ParseContext();
    context.set(Parser.class, parser);

    try {
      parser.parse(new ByteArrayInputStream(part.content()), handler, metadata, context);
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika failed for {} ({}): {}", part.fileName(), part.mediaType(), e.getMessage());
      throw new ExtractionException(
          part.fileName(), "Failed to parse document: " + e.getMessage(), e);
    }

    Map<String, Object> segmentMetadata = new HashMap<>();
    String title = metadata.get(TikaCoreProperties.TITLE);
    if (title != null && !title.isBlank()) {
      segmentMetadata.put(MetadataKeys.TITLE, title.strip());
    }
    return ExtractionResult.of(
        List.of(new ExtractedSegment(handler.toString().strip(), segmentMetadata)));
  }
}
