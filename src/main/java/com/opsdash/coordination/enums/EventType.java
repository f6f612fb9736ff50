package com.opsdash.coordination.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
  INFRASTRUCTURE_CHANGE("infrastructure-change"),
  ALERT("alert"),
  METRIC_THRESHOLD("metric-threshold"),
  COST_ANOMALY("cost-anomaly"),
  DRIFT_DETECTED("drift-detected"),
  AGENT_REGISTRATION("agent-registration"),
  AGENT_ACTION("agent-action"),
  AGENT_HEARTBEAT("agent-heartbeat");

  private final String value;

  EventType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static EventType from(String raw) {
    if (raw == null) {
      return null;
    }
    String normalized = raw.trim();
    for (EventType candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)
          || candidate.name().equalsIgnoreCase(normalized.replace('-', '_'))) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown EventType '" + raw + "'");
  }

  @Override
  public String toString() {
    return value;
  }
}
