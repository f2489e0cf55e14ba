package com.flamingo.ai.ingestion.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.ingestion.exception.LlmServiceException;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Base64;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** OCR through a vision-capable chat model answering in JSON. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisionOcrService implements OcrService {

  private static final String PROMPT =
      """
      Extract all readable text from this image, keeping the reading order and paragraph breaks.
      Do not describe the image and do not add commentary.

      Return ONLY valid JSON matching this structure:
      {"content": "..."}
      If the image contains no text, return {"content": ""}.
      """;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ChatModel chatModel;
  private final MeterRegistry meterRegistry;

  @Override
  public String extractText(byte[] image, String mediaType) {
    meterRegistry.counter("extraction.ocr.calls").increment();
    UserMessage message =
        UserMessage.from(
            TextContent.from(PROMPT),
            ImageContent.from(Base64.getEncoder().encodeToString(image), mediaType));

    Timer.Sample sample = Timer.start(meterRegistry);
    ChatResponse response;
    try {
      response = chatModel.chat(message);
    } catch (RateLimitException e) {
      meterRegistry.counter("extraction.ocr.failures", "reason", "rate_limited").increment();
      throw new LlmServiceException("OCR call was rate limited", true, e);
    } catch (RuntimeException e) {
      meterRegistry.counter("extraction.ocr.failures", "reason", "error").increment();
      throw new LlmServiceException("OCR call failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("extraction.ocr.duration"));
    }

    String text = parseContent(response.aiMessage().text());
    log.debug("OCR returned {} chars for {} image bytes", text.length(), image.length);
    return text;
  }

  private String parseContent(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new LlmServiceException("OCR response was empty");
    }
    try {
      JsonNode content = MAPPER.readTree(raw).get("content");
      if (content == null || content.isNull()) {
        throw new LlmServiceException("OCR response has no 'content' field");
      }
      return content.asText();
    } catch (JsonProcessingException e) {
      throw new LlmServiceException("OCR response is not valid JSON: " + e.getMessage(), e);
    }
  }
}
