package com.opsdash.coordination.enums;

/**
 * Attributes of a proposed agent action that a policy condition can inspect.
 * {@link #TARGET_RESOURCE} is multi-valued: one value per targeted resource.
 */
public enum PolicyConditionField {
  RISK_LEVEL,
  ACTION_TYPE,
  DESCRIPTION,
  TARGET_RESOURCE,
  AGENT_ID,
  STATUS,
  ESTIMATED_IMPACT
}
