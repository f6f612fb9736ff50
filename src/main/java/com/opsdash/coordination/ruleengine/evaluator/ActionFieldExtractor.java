package com.opsdash.coordination.ruleengine.evaluator;

import com.opsdash.coordination.enums.PolicyConditionField;
import com.opsdash.coordination.model.AgentAction;
import java.util.List;

/**
 * Reads a condition field off a proposed action. Single-valued fields yield a
 * one-element list, absent values an empty one.
 */
public class ActionFieldExtractor {

  public List<String> extract(AgentAction action, PolicyConditionField field) {
    if (action == null || field == null) {
      return List.of();
    }
    return switch (field) {
      case RISK_LEVEL -> single(action.riskLevel() != null ? action.riskLevel().value() : null);
      case ACTION_TYPE -> single(action.type());
      case DESCRIPTION -> single(action.description());
      case TARGET_RESOURCE -> action.targetResources();
      case AGENT_ID -> single(action.agentId());
      case STATUS -> single(action.status() != null ? action.status().value() : null);
      case ESTIMATED_IMPACT -> single(action.estimatedImpact());
    };
  }

  private List<String> single(String value) {
    return value == null ? List.of() : List.of(value);
  }
}
