package com.flamingo.ai.digest.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.digest.domain.model.DigestSource;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;

/** JPA converter persisting digest entry sources as a JSON array of {@code {channel, msg_id}}. */
@Converter
public class DigestSourceListConverter implements AttributeConverter<List<DigestSource>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<SourceJson>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<DigestSource> attribute) {
    List<SourceJson> json =
        attribute == null
            ? List.of()
            : attribute.stream().map(s -> new SourceJson(s.channel(), s.msgId())).toList();
    try {
      return MAPPER.writeValueAsString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize digest sources", e);
    }
  }

  @Override
  public List<DigestSource> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(dbData, LIST_TYPE).stream()
          .map(s -> new DigestSource(s.channel(), s.msg_id()))
          .toList();
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to deserialize digest sources", e);
    }
  }

  record SourceJson(String channel, long msg_id) {}
}
