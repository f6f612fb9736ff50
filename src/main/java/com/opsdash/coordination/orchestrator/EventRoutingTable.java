package com.opsdash.coordination.orchestrator;

import com.opsdash.coordination.enums.AgentType;
import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.enums.Severity;
import com.opsdash.coordination.model.SystemEvent;
import java.util.Locale;

/** Decides which kinds of agent care about a system event. */
public class EventRoutingTable {

  public boolean isRelevant(AgentType agentType, SystemEvent event) {
    if (agentType == null || event == null || event.type() == null) {
      return false;
    }
    EventType type = event.type();
    return switch (agentType) {
      case TERRAFORM -> type == EventType.INFRASTRUCTURE_CHANGE
          || type == EventType.DRIFT_DETECTED
          || (type == EventType.ALERT && "terraform".equals(stringValue(event, "component")));
      case KUBERNETES -> type == EventType.METRIC_THRESHOLD
          || (type == EventType.ALERT && "kubernetes".equals(stringValue(event, "component")));
      case INCIDENT_RESPONSE -> type == EventType.ALERT
          || event.severity() == Severity.HIGH
          || event.severity() == Severity.CRITICAL;
      case COST_OPTIMIZATION -> type == EventType.COST_ANOMALY
          || (type == EventType.METRIC_THRESHOLD && metricMentionsCost(event));
    };
  }

  private boolean metricMentionsCost(SystemEvent event) {
    String metric = stringValue(event, "metric");
    return metric != null && metric.toLowerCase(Locale.ROOT).contains("cost");
  }

  private String stringValue(SystemEvent event, String key) {
    Object value = event.dataValue(key);
    return value != null ? value.toString() : null;
  }
}
