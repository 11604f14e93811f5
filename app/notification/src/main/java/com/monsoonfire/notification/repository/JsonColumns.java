package com.monsoonfire.notification.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/** JSONB column codec shared by the repositories. */
final class JsonColumns {

  private JsonColumns() {}

  static String write(ObjectMapper objectMapper, Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize json column", ex);
    }
  }

  static <T> T read(ObjectMapper objectMapper, String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse json column as " + type.getSimpleName(), ex);
    }
  }

  static <T> T read(ObjectMapper objectMapper, String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse json column", ex);
    }
  }
}
