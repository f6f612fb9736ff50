package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentType {
  TERRAFORM("terraform"),
  KUBERNETES("kubernetes"),
  INCIDENT_RESPONSE("incident-response"),
  COST_OPTIMIZATION("cost-optimization");

  private final String value;

  AgentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AgentType from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (AgentType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown AgentType '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
