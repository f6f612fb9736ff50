package com.opsdash.coordination.enums;

/**
 * In-process coordination notices raised for a presentation layer. These are not
 * part of the durable event stream.
 */
public enum NoticeType {
  BUS_CONNECTED,
  BUS_DISCONNECTED,
  SUBSCRIPTION_ERROR,
  ORCHESTRATOR_STARTED,
  ORCHESTRATOR_STOPPED,
  AGENT_REGISTERED,
  AGENT_UNREGISTERED,
  AGENT_STATUS_CHANGED,
  AGENT_METRICS_UPDATED,
  AGENT_UNHEALTHY,
  APPROVAL_REQUESTED,
  APPROVAL_EXPIRED,
  ACTION_APPROVED,
  ACTION_REJECTED
}
