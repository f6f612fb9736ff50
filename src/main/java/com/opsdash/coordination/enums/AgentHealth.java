package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentHealth {
  HEALTHY("healthy"),
  WARNING("warning"),
  CRITICAL("critical");

  private final String value;

  AgentHealth(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AgentHealth from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (AgentHealth candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown AgentHealth '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
