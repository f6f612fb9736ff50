package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictStrategyType {
  PRIORITY("priority"),
  FIRST_WINS("first_wins"),
  MERGE("merge"),
  ESCALATE("escalate");

  private final String value;

  ConflictStrategyType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ConflictStrategyType from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (ConflictStrategyType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ConflictStrategyType '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
