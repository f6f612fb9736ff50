package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PolicyEffect {
  ALLOW("allow"),
  DENY("deny"),
  REQUIRE_APPROVAL("require_approval");

  private final String value;

  PolicyEffect(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static PolicyEffect from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (PolicyEffect candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown PolicyEffect '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
