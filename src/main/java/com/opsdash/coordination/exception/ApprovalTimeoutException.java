package com.opsdash.coordination.exception;

import java.time.Duration;

public class ApprovalTimeoutException extends RuntimeException {

  private final String actionId;

  public ApprovalTimeoutException(String actionId, Duration timeout) {
    super("Approval request timeout for action " + actionId + " after " + timeout.toMillis() + "ms");
    this.actionId = actionId;
  }

  public String getActionId() {
    return actionId;
  }
}
