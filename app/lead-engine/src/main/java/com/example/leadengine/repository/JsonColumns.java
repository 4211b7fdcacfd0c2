/*
 * どこで: Lead Engine データアクセス
 * 何を: jsonb 列と Java の値を相互変換する
 * なぜ: 各リポジトリで ObjectMapper の例外処理を重複させないため
 */
package com.example.leadengine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsonColumns {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize jsonb column", ex);
    }
  }

  public List<String> readStrings(String json) {
    return read(json, STRING_LIST, List.of());
  }

  public List<Long> readLongs(String json) {
    return read(json, LONG_LIST, List.of());
  }

  public <T> T read(String json, Class<T> type) {
    if (json == null || json.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse jsonb column", ex);
    }
  }

  private <T> T read(String json, TypeReference<T> type, T empty) {
    if (json == null || json.isBlank()) {
      return empty;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse jsonb column", ex);
    }
  }
}
