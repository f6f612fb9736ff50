package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {
  RUNNING("running"),
  STOPPED("stopped"),
  ERROR("error");

  private final String value;

  AgentStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AgentStatus from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (AgentStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown AgentStatus '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
