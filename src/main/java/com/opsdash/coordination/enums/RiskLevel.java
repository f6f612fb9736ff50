package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
  LOW("low", 1),
  MEDIUM("medium", 2),
  HIGH("high", 3);

  private final String value;
  private final int rank;

  RiskLevel(String value, int rank) {
    this.value = value;
    this.rank = rank;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Ordering weight used when competing actions are ranked; higher is riskier. */
  public int rank() {
    return rank;
  }

  @JsonCreator
  public static RiskLevel from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (RiskLevel candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown RiskLevel '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
