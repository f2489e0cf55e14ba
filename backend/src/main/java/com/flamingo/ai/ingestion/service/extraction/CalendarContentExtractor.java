package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import com.google.common.hash.Hashing;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.component.CalendarComponent;
import net.fortuna.ical4j.model.component.VEvent;
import org.springframework.stereotype.Service;

/**
 * {@link ContentExtractor} for iCalendar files, one segment per event.
 *
 * <p>Each event is rendered as an {@code Event/Description/Start/End} block. Its part key combines
 * the file name, the SHA-256 of the file bytes and the event position, so re-ingesting the same
 * file yields the same chunk ids while a changed file yields new ones.
 */
@Service
@Slf4j
public class CalendarContentExtractor implements ContentExtractor {

  @Override
  public Set<String> supportedMediaTypes() {
    return Set.of("text/calendar");
  }

  @Override
  public Set<String> supportedExtensions() {
    return Set.of("ics");
  }

  @Override
  public ExtractionResult extract(SourcePart part) {
    Calendar calendar;
    try {
      calendar = new CalendarBuilder().build(new ByteArrayInputStream(part.content()));
    } catch (IOException | ParserException e) {
      throw new ExtractionException(
          part.fileName(), "Failed to parse calendar: " + e.getMessage(), e);
    }

    String fileHash = Hashing.sha256().hashBytes(part.content()).toString();
    List<ExtractedSegment> segments = new ArrayList<>();
    List<CalendarComponent> events = calendar.getComponents(Component.VEVENT);
    int eventIndex = 0;
    for (CalendarComponent component : events) {
      VEvent event = (VEvent) component;
      String start = valueOf(event.getStartDate());
      String end = valueOf(event.getEndDate());
      String text =
          "Event: "
              + valueOf(event.getSummary())
              + "\nDescription: "
              + valueOf(event.getDescription())
              + "\nStart: "
              + start
              + "\nEnd: "
              + end;

      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put(MetadataKeys.PART_KEY, part.fileName() + "-" + fileHash + "-" + eventIndex);
      metadata.put("eventIndex", eventIndex);
      metadata.put("start", start);
      metadata.put("end", end);
      String location = valueOf(event.getLocation());
      if (!location.isEmpty()) {
        metadata.put("location", location);
      }
      segments.add(new ExtractedSegment(text, metadata));
      eventIndex++;
    }
    log.debug("Extracted {} events from {}", segments.size(), part.fileName());
    return ExtractionResult.of(segments);
  }

  private static String valueOf(Property property) {
    return property == null || property.getValue() == null ? "" : property.getValue();
  }
}
