package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionStatus {
  PENDING("pending"),
  APPROVED("approved"),
  EXECUTING("executing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String value;

  ActionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ActionStatus from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (ActionStatus candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown ActionStatus '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
