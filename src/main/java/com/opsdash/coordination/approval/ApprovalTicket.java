package com.opsdash.coordination.approval;

import com.opsdash.coordination.model.ApprovalResult;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of registering a request: the decision future of the pending entry and
 * whether this call created it.
 */
public record ApprovalTicket(boolean created, CompletableFuture<ApprovalResult> decision) {}
