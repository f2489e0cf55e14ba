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
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Service;

/**
 * {@link ContentExtractor} for HTML files and HTML email bodies.
 *
 * <p>Scripts, styles and other non-content elements are removed. Block elements and line breaks
 * become newlines so the chunker can still split on paragraphs.
 */
@Service
@Slf4j
public class HtmlContentExtractor implements ContentExtractor {

  private static final String[] REMOVE_SELECTORS = {
    "script", "style", "noscript", "head", "template"
  };
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");
  private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+\\n");

  @Override
  public Set<String> supportedMediaTypes() {
    return Set.of("text/html", "application/xhtml+xml");
  }

  @Override
  public Set<String> supportedExtensions() {
    return Set.of("html", "htm", "xhtml");
  }

  @Override
  public ExtractionResult extract(SourcePart part) {
    Document document;
    try {
      document = Jsoup.parse(new ByteArrayInputStream(part.content()), null, "");
    } catch (IOException e) {
      throw new ExtractionException(part.fileName(), "Failed to parse HTML: " + e.getMessage(), e);
    }

    String title = document.title();
    for (String selector : REMOVE_SELECTORS) {
      document.select(selector).remove();
    }
    String text = toPlainText(document.body() != null ? document.body() : document);

    Map<String, Object> metadata = new HashMap<>();
    if (!title.isBlank()) {
      metadata.put(MetadataKeys.TITLE, title.strip());
    }
    return ExtractionResult.of(List.of(new ExtractedSegment(text, metadata)));
  }

  private static String toPlainText(Element root) {
    StringBuilder text = new StringBuilder();
    NodeTraversor.traverse(
        new NodeVisitor() {
          @Override
          public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
              text.append(textNode.text());
            } else if (node instanceof Element element && "br".equals(element.normalName())) {
              text.append('\n');
            }
          }

          @Override
          public void tail(Node node, int depth) {
            if (node instanceof Element element && element.isBlock()) {
              text.append("\n\n");
            }
          }
        },
        root);
    String normalized = TRAILING_SPACES.matcher(text.toString()).replaceAll("\n");
    return EXCESS_BLANK_LINES.matcher(normalized).replaceAll("\n\n").strip();
  }
}
