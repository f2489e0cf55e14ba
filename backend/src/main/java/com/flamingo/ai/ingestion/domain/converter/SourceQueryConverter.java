package com.flamingo.ai.ingestion.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.ingestion.domain.model.SourceQuery;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for persisting {@link SourceQuery} as JSON in a TEXT column. */
@Converter
@Slf4j
public class SourceQueryConverter implements AttributeConverter<SourceQuery, String> {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .findAndRegisterModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  @Override
  public String convertToDatabaseColumn(SourceQuery attribute) {
    if (attribute == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize source query", e);
    }
  }

  @Override
  public SourceQuery convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return SourceQuery.empty();
    }
    try {
      return MAPPER.readValue(dbData, SourceQuery.class);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize source query, using an empty one: {}", e.getMessage());
      return SourceQuery.empty();
    }
  }
}
