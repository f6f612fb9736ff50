package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.PolicyOutcome;

public record PolicyDecision(
    String actionId,
    PolicyOutcome outcome,
    String policyId,
    String policyName
) {

  public static PolicyDecision defaultAllow(String actionId) {
    return new PolicyDecision(actionId, PolicyOutcome.ALLOWED, null, null);
  }

  public boolean allowed() {
    return outcome == PolicyOutcome.ALLOWED;
  }
}
