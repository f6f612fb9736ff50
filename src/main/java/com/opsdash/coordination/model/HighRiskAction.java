package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.RiskLevel;
import java.time.Instant;

/**
 * An action blocked pending a human decision. The wrapped action always carries
 * {@link RiskLevel#HIGH}.
 */
public record HighRiskAction(
    AgentAction action,
    String policyName,
    Instant approvalRequestedAt,
    String approvedBy,
    Instant approvedAt
) {

  public static HighRiskAction pending(AgentAction action, String policyName, Instant requestedAt) {
    return new HighRiskAction(action.withRiskLevel(RiskLevel.HIGH), policyName, requestedAt, null, null);
  }

  public String id() {
    return action.id();
  }

  public boolean approvalRequired() {
    return true;
  }

  public HighRiskAction decidedBy(String actor, Instant at) {
    return new HighRiskAction(action, policyName, approvalRequestedAt, actor, at);
  }
}
