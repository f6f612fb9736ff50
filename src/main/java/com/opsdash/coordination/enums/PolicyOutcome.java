package com.opsdash.coordination.enums;

public enum PolicyOutcome {
  ALLOWED,
  DENIED,
  PENDING_APPROVAL
}
