package com.opsdash.coordination.exception;

public class NotFoundException extends RuntimeException {

  public NotFoundException(String kind, String id) {
    super(kind + " not found: " + id);
  }

  public static NotFoundException agent(String agentId) {
    return new NotFoundException("Agent", agentId);
  }

  public static NotFoundException pendingApproval(String actionId) {
    return new NotFoundException("Pending approval", actionId);
  }
}
