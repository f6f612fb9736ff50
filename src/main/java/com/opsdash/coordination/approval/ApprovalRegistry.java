package com.opsdash.coordination.approval;

import com.opsdash.coordination.enums.NoticeType;
import com.opsdash.coordination.exception.ApprovalTimeoutException;
import com.opsdash.coordination.exception.NotFoundException;
import com.opsdash.coordination.model.ApprovalResult;
import com.opsdash.coordination.model.HighRiskAction;
import com.opsdash.coordination.notification.CoordinationNotice;
import com.opsdash.coordination.notification.NotificationService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Actions waiting for a human decision, keyed by action id.
 *
 * <p>Each entry carries a decision future and an expiry timer started at registration.
 * Whichever of approve, reject or expiry removes the entry first settles the future; the
 * others then see the id as unknown.
 */
public class ApprovalRegistry {

  private static final Logger log = LoggerFactory.getLogger(ApprovalRegistry.class);

  private final Map<String, PendingApproval> pending = new ConcurrentHashMap<>();
  private final Duration timeout;
  private final Clock clock;
  private final NotificationService notifications;
  private final ScheduledExecutorService scheduler;

  public ApprovalRegistry(Duration timeout, Clock clock, NotificationService notifications) {
    this.timeout = timeout;
    this.clock = clock;
    this.notifications = notifications;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, "approval-expiry");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Starts waiting for a decision on {@code request}. An action that is already pending
   * keeps its existing entry and timer.
   */
  public ApprovalTicket register(HighRiskAction request) {
    PendingApproval entry = new PendingApproval(request, new CompletableFuture<>());
    PendingApproval existing = pending.putIfAbsent(request.id(), entry);
    if (existing != null) {
      log.debug("Action {} is already awaiting approval", request.id());
      return new ApprovalTicket(false, existing.decision);
    }
    entry.expiry = scheduler.schedule(() -> expire(entry), timeout.toMillis(), TimeUnit.MILLISECONDS);
    return new ApprovalTicket(true, entry.decision);
  }

  public HighRiskAction approve(String actionId, String approvedBy, String reason) {
    return decide(actionId, true, approvedBy, reason);
  }

  public HighRiskAction reject(String actionId, String rejectedBy, String reason) {
    return decide(actionId, false, rejectedBy, reason);
  }

  public boolean isPending(String actionId) {
    return pending.containsKey(actionId);
  }

  /** Pending requests, oldest first. */
  public List<HighRiskAction> pending() {
    return pending.values().stream()
        .map(entry -> entry.request)
        .sorted(Comparator.comparing(HighRiskAction::approvalRequestedAt,
            Comparator.nullsFirst(Comparator.naturalOrder())))
        .toList();
  }

  public int size() {
    return pending.size();
  }

  public void shutdown() {
    scheduler.shutdownNow();
  }

  private HighRiskAction decide(String actionId, boolean approved, String actor, String reason) {
    PendingApproval entry = pending.remove(actionId);
    if (entry == null) {
      throw NotFoundException.pendingApproval(actionId);
    }
    if (entry.expiry != null) {
      entry.expiry.cancel(false);
    }
    Instant decidedAt = clock.instant();
    entry.decision.complete(new ApprovalResult(approved, actor, decidedAt, reason));
    return entry.request.decidedBy(actor, decidedAt);
  }

  private void expire(PendingApproval entry) {
    String actionId = entry.request.id();
    if (!pending.remove(actionId, entry)) {
      return;
    }
    ApprovalTimeoutException timeoutError = new ApprovalTimeoutException(actionId, timeout);
    entry.decision.completeExceptionally(timeoutError);
    log.warn("Approval for action {} expired after {}ms", actionId, timeout.toMillis());

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("actionId", actionId);
    details.put("agentId", entry.request.action().agentId());
    details.put("policyName", entry.request.policyName());
    notifications.notify(CoordinationNotice.of(clock.instant(),
        NoticeType.APPROVAL_EXPIRED, actionId, timeoutError.getMessage(), details));
  }

  private static final class PendingApproval {
    private final HighRiskAction request;
    private final CompletableFuture<ApprovalResult> decision;
    private volatile ScheduledFuture<?> expiry;

    private PendingApproval(HighRiskAction request, CompletableFuture<ApprovalResult> decision) {
      this.request = request;
      this.decision = decision;
    }
  }
}
