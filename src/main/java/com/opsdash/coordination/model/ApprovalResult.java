package com.opsdash.coordination.model;

import java.time.Instant;

public record ApprovalResult(
    boolean approved,
    String approvedBy,
    Instant approvedAt,
    String reason
) {}
