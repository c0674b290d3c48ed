package com.acme.store.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Map;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

  private Jsons() {}

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot encode " + o.getClass().getName() + " as JSON", e);
    }
  }

  /** Decodes {@code json}; malformed input is reported as {@link IllegalArgumentException}. */
  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot decode JSON as " + clazz.getSimpleName(), e);
    }
  }

  public static Map<String, String> toStringMap(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return M.readValue(json, STRING_MAP);
    } catch (Exception e) {
      throw new IllegalArgumentException("Cannot decode JSON headers", e);
    }
  }
}
