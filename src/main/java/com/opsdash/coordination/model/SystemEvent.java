package com.opsdash.coordination.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.enums.Severity;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemEvent(
    String id,
    EventType type,
    String source,
    Severity severity,
    Map<String, Object> data,
    Instant timestamp,
    String correlationId
) {

  public SystemEvent {
    data = data == null ? Map.of() : Map.copyOf(withoutNullValues(data));
  }

  public static SystemEvent of(EventType type, String source, Severity severity, Map<String, Object> data) {
    return new SystemEvent(UUID.randomUUID().toString(), type, source, severity, data, Instant.now(), null);
  }

  public boolean hasSource() {
    return source != null && !source.isEmpty();
  }

  public Object dataValue(String key) {
    return data.get(key);
  }

  /** Copy with a new id and source, and {@code extra} merged over the existing data. */
  public SystemEvent readdressed(String newId, String newSource, Map<String, Object> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(data);
    merged.putAll(extra);
    return new SystemEvent(newId, type, newSource, severity, merged, timestamp, correlationId);
  }

  private static Map<String, Object> withoutNullValues(Map<String, Object> data) {
    Map<String, Object> copy = new LinkedHashMap<>();
    data.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return copy;
  }
}
