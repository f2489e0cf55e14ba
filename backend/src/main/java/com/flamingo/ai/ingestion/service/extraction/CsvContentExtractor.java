package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;

/**
 * {@link ContentExtractor} for CSV files, one segment per data row.
 *
 * <p>The first row is the header; every following row becomes {@code header: value} lines.
 */
@Service
@Slf4j
public class CsvContentExtractor implements ContentExtractor {

  private static final CSVFormat FORMAT =
      CSVFormat.DEFAULT
          .builder()
          .setHeader()
          .setSkipHeaderRecord(true)
          .setAllowMissingColumnNames(true)
          .setIgnoreEmptyLines(true)
          .setTrim(true)
          .get();

  @Override
  public Set<String> supportedMediaTypes() {
    return Set.of("text/csv");
  }

  @Override
  public Set<String> supportedExtensions() {
    return Set.of("csv");
  }

  @Override
  public ExtractionResult extract(SourcePart part) {
    String content = new String(part.content(), StandardCharsets.UTF_8);
    if (content.startsWith("\uFEFF")) {
      content = content.substring(1);
    }

    List<ExtractedSegment> segments = new ArrayList<>();
    try (CSVParser parser = FORMAT.parse(new StringReader(content))) {
      List<String> headers = parser.getHeaderNames();
      for (CSVRecord record : parser) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < record.size(); i++) {
          String header =
              i < headers.size() && !headers.get(i).isBlank()
                  ? headers.get(i)
                  : "column " + (i + 1);
          if (text.length() > 0) {
            text.append('\n');
          }
          text.append(header).append(": ").append(record.get(i));
        }
        long row = record.getRecordNumber();
        segments.add(
            new ExtractedSegment(
                text.toString(),
                Map.of("row", row, MetadataKeys.PART_KEY, part.fileName() + "#row-" + row)));
      }
    } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
      throw new ExtractionException(part.fileName(), "Failed to parse CSV: " + e.getMessage(), e);
    }
    log.debug("Extracted {} rows from {}", segments.size(), part.fileName());
    return ExtractionResult.of(segments);
  }
}
