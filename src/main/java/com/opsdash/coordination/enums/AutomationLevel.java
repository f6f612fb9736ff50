package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AutomationLevel {
  MANUAL("manual"),
  SEMI_AUTO("semi-auto"),
  FULL_AUTO("full-auto");

  private final String value;

  AutomationLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AutomationLevel from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (AutomationLevel candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown AutomationLevel '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
