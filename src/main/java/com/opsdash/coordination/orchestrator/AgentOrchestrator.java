package com.opsdash.coordination.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.coordination.approval.ApprovalRegistry;
import com.opsdash.coordination.approval.ApprovalTicket;
import com.opsdash.coordination.bus.EventBus;
import com.opsdash.coordination.bus.EventHandler;
import com.opsdash.coordination.bus.EventSubscription;
import com.opsdash.coordination.bus.HandlerResult;
import com.opsdash.coordination.bus.TopicNames;
import com.opsdash.coordination.conflict.ConflictResolver;
import com.opsdash.coordination.enums.ActionStatus;
import com.opsdash.coordination.enums.AgentHealth;
import com.opsdash.coordination.enums.AgentStatus;
import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.enums.NoticeType;
import com.opsdash.coordination.enums.PolicyOutcome;
import com.opsdash.coordination.enums.RiskLevel;
import com.opsdash.coordination.enums.Severity;
import com.opsdash.coordination.exception.NotFoundException;
import com.opsdash.coordination.model.ActionResult;
import com.opsdash.coordination.model.Agent;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.AgentConfig;
import com.opsdash.coordination.model.AgentMetrics;
import com.opsdash.coordination.model.AgentView;
import com.opsdash.coordination.model.ApprovalResult;
import com.opsdash.coordination.model.ConflictResolutionStrategy;
import com.opsdash.coordination.model.HighRiskAction;
import com.opsdash.coordination.model.PolicyDecision;
import com.opsdash.coordination.model.PolicyRule;
import com.opsdash.coordination.model.SystemEvent;
import com.opsdash.coordination.notification.CoordinationNotice;
import com.opsdash.coordination.notification.NotificationService;
import com.opsdash.coordination.ruleengine.PolicyEngine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates agents over the {@link EventBus}: keeps the agent registry, routes system
 * events to the agents that care about them, enforces policy on proposed actions and
 * drives the approval workflow for the ones a policy holds back.
 *
 * <p>State changes are announced twice: as coordination events on the bus (source
 * {@value #SOURCE}) for other services, and as {@link CoordinationNotice}s for dashboards.
 */
public class AgentOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

  public static final String SOURCE = "orchestrator";

  static final List<EventType> ROUTED_TYPES = List.of(
      EventType.INFRASTRUCTURE_CHANGE,
      EventType.ALERT,
      EventType.METRIC_THRESHOLD,
      EventType.COST_ANOMALY,
      EventType.DRIFT_DETECTED
  );

  private final EventBus eventBus;
  private final PolicyEngine policyEngine;
  private final ApprovalRegistry approvals;
  private final ConflictResolver conflictResolver;
  private final EventRoutingTable routingTable;
  private final NotificationService notifications;
  private final ObjectMapper objectMapper;
  private final OrchestratorSettings settings;
  private final Clock clock;

  private final Map<String, Agent> agents = new ConcurrentHashMap<>();
  private final Map<String, TrackedAction> activeActions = new ConcurrentHashMap<>();
  private final Map<String, ActionStats> stats = new ConcurrentHashMap<>();
  private final Map<String, EventHandler> inboundHandlers = new LinkedHashMap<>();

  private volatile boolean running;

  public AgentOrchestrator(EventBus eventBus,
                           PolicyEngine policyEngine,
                           ApprovalRegistry approvals,
                           ConflictResolver conflictResolver,
                           EventRoutingTable routingTable,
                           NotificationService notifications,
                           ObjectMapper objectMapper,
                           OrchestratorSettings settings,
                           Clock clock) {
    this.eventBus = eventBus;
    this.policyEngine = policyEngine;
    this.approvals = approvals;
    this.conflictResolver = conflictResolver;
    this.routingTable = routingTable;
    this.notifications = notifications;
    this.objectMapper = objectMapper;
    this.settings = settings;
    this.clock = clock;

    EventHandler registration = this::handleAgentRegistration;
    EventHandler action = this::handleAgentAction;
    EventHandler heartbeat = this::handleAgentHeartbeat;
    EventHandler routing = event -> {
      routeEvent(event);
      return HandlerResult.ok();
    };
    bindInbound(EventType.AGENT_REGISTRATION, registration);
    bindInbound(EventType.AGENT_ACTION, action);
    bindInbound(EventType.AGENT_HEARTBEAT, heartbeat);
    ROUTED_TYPES.forEach(type -> bindInbound(type, routing));
  }

  /**
   * Connects the bus when needed and subscribes every inbound topic this orchestrator is
   * not yet listening on. Calling it again after the bus dropped its subscriptions
   * restores them.
   */
  public synchronized void start() {
    if (running && isListening()) {
      return;
    }
    try {
      if (!eventBus.isHealthy()) {
        eventBus.connect();
      }
      inboundHandlers.forEach((topic, handler) -> {
        if (!eventBus.isSubscribed(topic, handler)) {
          eventBus.subscribe(new EventSubscription(topic, handler, AgentOrchestrator::isExternal));
        }
      });
    } catch (RuntimeException e) {
      log.error("Failed to start agent orchestrator", e);
      throw e;
    }
    if (running) {
      log.info("Agent orchestrator resubscribed to {} topics", inboundHandlers.size());
      return;
    }
    running = true;
    log.info("Agent orchestrator started, listening on {} topics", inboundHandlers.size());
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.ORCHESTRATOR_STARTED, null,
        "Agent orchestrator started", null));
  }

  /** Restores the inbound subscriptions of a running orchestrator after a bus reconnect. */
  public void ensureListening() {
    if (running && !isListening()) {
      log.warn("Agent orchestrator lost its event bus subscriptions, resubscribing");
      start();
    }
  }

  private boolean isListening() {
    return eventBus.isHealthy() && inboundHandlers.entrySet().stream()
        .allMatch(entry -> eventBus.isSubscribed(entry.getKey(), entry.getValue()));
  }

  public synchronized void stop() {
    if (!running) {
      return;
    }
    try {
      inboundHandlers.forEach(eventBus::unsubscribe);
    } catch (RuntimeException e) {
      log.error("Error stopping agent orchestrator", e);
      throw e;
    } finally {
      running = false;
    }
    log.info("Agent orchestrator stopped");
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.ORCHESTRATOR_STOPPED, null,
        "Agent orchestrator stopped", null));
  }

  public boolean isRunning() {
    return running;
  }

  public boolean isHealthy() {
    return running && eventBus.isHealthy();
  }

  public AgentView registerAgent(AgentConfig config) {
    Agent agent = new Agent(config, clock.instant());
    Agent replaced = agents.put(agent.getId(), agent);
    if (replaced != null) {
      log.info("Agent re-registered: {} ({})", agent.getId(), config.type());
    } else {
      log.info("Agent registered: {} ({})", agent.getId(), config.type());
    }

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("action", "agent_registered");
    data.put("agentId", agent.getId());
    data.put("agentType", config.type() != null ? config.type().value() : null);
    publishCoordinationEvent(Severity.LOW, data);

    AgentView view = viewOf(agent);
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.AGENT_REGISTERED, agent.getId(),
        "Agent registered: " + agent.getId(), Map.of("agent", view)));
    return view;
  }

  public void unregisterAgent(String agentId) {
    if (!agents.containsKey(agentId)) {
      throw NotFoundException.agent(agentId);
    }

    activeActions.values().stream()
        .filter(tracked -> agentId.equals(tracked.action().agentId()))
        .map(tracked -> tracked.action().id())
        .toList()
        .forEach(actionId -> cancelAction(actionId, "Agent unregistered"));

    agents.remove(agentId);
    stats.remove(agentId);
    log.info("Agent unregistered: {}", agentId);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("action", "agent_unregistered");
    data.put("agentId", agentId);
    publishCoordinationEvent(Severity.LOW, data);

    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.AGENT_UNREGISTERED, agentId,
        "Agent unregistered: " + agentId, null));
  }

  public List<AgentView> getAgents() {
    return agents.values().stream()
        .sorted(Comparator.comparing(Agent::getId))
        .map(this::viewOf)
        .toList();
  }

  public Optional<AgentView> getAgent(String agentId) {
    return Optional.ofNullable(agents.get(agentId)).map(this::viewOf);
  }

  /**
   * Publishes a copy of {@code event} for every running agent it is relevant to.
   *
   * @return the number of agents the event reached
   */
  public int routeEvent(SystemEvent event) {
    List<Agent> relevant = agents.values().stream()
        .filter(Agent::isRunning)
        .filter(agent -> routingTable.isRelevant(agent.getConfig().type(), event))
        .toList();

    if (relevant.isEmpty()) {
      log.warn("No relevant agents found for event {} of type {}", event.id(), event.type());
      return 0;
    }

    int routed = 0;
    for (Agent agent : relevant) {
      try {
        Map<String, Object> routing = new LinkedHashMap<>();
        routing.put("originalEventId", event.id());
        routing.put("routedTo", agent.getId());
        routing.put("routedAt", clock.instant().toString());
        SystemEvent copy = event.readdressed(UUID.randomUUID().toString(),
            TopicNames.routedSource(agent.getId()), routing);
        eventBus.publish(copy);
        routed++;
        log.debug("Event {} routed to agent {}", event.id(), agent.getId());
      } catch (RuntimeException e) {
        log.error("Failed to route event {} to agent {}", event.id(), agent.getId(), e);
      }
    }
    return routed;
  }

  public boolean enforcePolicy(AgentAction action) {
    return decide(action).allowed();
  }

  /**
   * Evaluates {@code action} against the policy set. Actions held for approval are
   * registered as pending and come back as {@link PolicyOutcome#PENDING_APPROVAL}.
   */
  public PolicyDecision decide(AgentAction action) {
    if (approvals.isPending(action.id())) {
      return new PolicyDecision(action.id(), PolicyOutcome.PENDING_APPROVAL, null, null);
    }
    if (activeActions.containsKey(action.id())) {
      log.debug("Action {} is already active, keeping its earlier decision", action.id());
      return new PolicyDecision(action.id(), PolicyOutcome.ALLOWED, null, null);
    }
    Optional<PolicyRule> match = policyEngine.match(action);
    if (match.isEmpty()) {
      log.debug("No policies matched action {}, allowing by default", action.id());
      return PolicyDecision.defaultAllow(action.id());
    }

    PolicyRule policy = match.get();
    log.debug("Action {} matched policy {} ({})", action.id(), policy.id(), policy.effect());
    PolicyOutcome outcome = switch (policy.effect()) {
      case ALLOW -> PolicyOutcome.ALLOWED;
      case DENY -> {
        log.info("Action {} denied by policy {}", action.id(), policy.name());
        yield PolicyOutcome.DENIED;
      }
      case REQUIRE_APPROVAL -> handleApprovalRequired(action, policy)
          ? PolicyOutcome.ALLOWED
          : PolicyOutcome.PENDING_APPROVAL;
    };
    return new PolicyDecision(action.id(), outcome, policy.id(), policy.name());
  }

  /** Decides {@code action} and tracks it as active when it may proceed. */
  public PolicyDecision submitAction(AgentAction action) {
    PolicyDecision decision = decide(action);
    if (decision.allowed()) {
      track(action);
      log.debug("Action {} allowed and tracked", action.id());
    } else {
      log.info("Action {} blocked by policy: {}", action.id(), decision.outcome());
    }
    return decision;
  }

  public List<PolicyRule> getPolicies() {
    return policyEngine.getRules();
  }

  public void addPolicy(PolicyRule policy) {
    policyEngine.addRule(policy);
  }

  public boolean removePolicy(String policyId) {
    return policyEngine.removeRule(policyId);
  }

  /**
   * Future that settles when {@code request} is approved, rejected or expires. The request
   * is registered first if it is not already pending.
   */
  public CompletableFuture<ApprovalResult> requestApproval(HighRiskAction request) {
    ApprovalTicket ticket = approvals.register(request);
    if (ticket.created()) {
      announceApprovalRequest(request);
    }
    return ticket.decision();
  }

  public void approveAction(String actionId, String approvedBy, String reason) {
    HighRiskAction decided = approvals.approve(actionId, approvedBy, reason);
    log.info("Action {} approved by {}", actionId, approvedBy);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("action", "action_approved");
    data.put("actionId", actionId);
    data.put("approvedBy", approvedBy);
    data.put("reason", reason);
    publishCoordinationEvent(Severity.LOW, data);

    track(decided.action().withStatus(ActionStatus.APPROVED));
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.ACTION_APPROVED, actionId,
        "Action " + actionId + " approved by " + approvedBy, data));
  }

  public void rejectAction(String actionId, String rejectedBy, String reason) {
    approvals.reject(actionId, rejectedBy, reason);
    log.info("Action {} rejected by {}: {}", actionId, rejectedBy, reason);

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("action", "action_rejected");
    data.put("actionId", actionId);
    data.put("rejectedBy", rejectedBy);
    data.put("reason", reason);
    publishCoordinationEvent(Severity.LOW, data);

    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.ACTION_REJECTED, actionId,
        "Action " + actionId + " rejected by " + rejectedBy, data));
  }

  public List<HighRiskAction> getPendingApprovals() {
    return approvals.pending();
  }

  public List<AgentAction> resolveConflicts(List<AgentAction> conflicting) {
    return resolveConflicts(conflicting, settings.conflictStrategy());
  }

  public List<AgentAction> resolveConflicts(List<AgentAction> conflicting, ConflictResolutionStrategy strategy) {
    if (conflicting != null && conflicting.size() > 1) {
      log.info("Resolving conflicts between {} actions", conflicting.size());
    }
    return conflictResolver.resolve(conflicting, strategy, this::escalateConflict);
  }

  public List<AgentAction> getActiveActions() {
    return activeActions.values().stream()
        .sorted(Comparator.comparing(TrackedAction::trackedAt))
        .map(TrackedAction::action)
        .toList();
  }

  public List<AgentAction> getActiveActions(String agentId) {
    return getActiveActions().stream()
        .filter(action -> agentId.equals(action.agentId()))
        .toList();
  }

  public AgentMetrics getMetrics(String agentId) {
    ActionStats agentStats = stats.get(agentId);
    return agentStats != null ? agentStats.snapshot() : AgentMetrics.empty();
  }

  /**
   * Marks running agents whose heartbeat went stale as errored and publishes status,
   * health and metrics notices for every agent.
   */
  public void performHealthCheck() {
    Instant now = clock.instant();
    for (Agent agent : agents.values()) {
      AgentStatus previousStatus = agent.getStatus();
      AgentHealth previousHealth = agent.getReportedHealth();
      Duration silence = agent.sinceHeartbeat(now);

      if (silence.compareTo(settings.heartbeatStaleAfter()) > 0 && agent.isRunning()) {
        agent.setStatus(AgentStatus.ERROR);
        log.warn("Agent {} marked as unhealthy (no heartbeat for {}ms)", agent.getId(), silence.toMillis());
        notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.AGENT_UNHEALTHY, agent.getId(),
            "No heartbeat for " + silence.toMillis() + "ms", null));
      }

      AgentHealth currentHealth = agent.healthAt(now);
      agent.setReportedHealth(currentHealth);
      if (previousStatus != agent.getStatus() || previousHealth != currentHealth) {
        announceStatusChange(agent, currentHealth);
      }

      notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.AGENT_METRICS_UPDATED, agent.getId(),
          null, Map.of("metrics", getMetrics(agent.getId()))));
    }
  }

  HandlerResult handleAgentRegistration(SystemEvent event) {
    Object agentConfig = event.dataValue("agentConfig");
    if (agentConfig == null) {
      log.debug("Registration event {} carries no agentConfig", event.id());
      return HandlerResult.ok();
    }
    try {
      registerAgent(objectMapper.convertValue(agentConfig, AgentConfig.class));
    } catch (IllegalArgumentException e) {
      log.error("Error handling agent registration {}", event.id(), e);
      return HandlerResult.failed(e);
    }
    return HandlerResult.ok();
  }

  HandlerResult handleAgentAction(SystemEvent event) {
    Object payload = event.dataValue("action");
    if (payload == null) {
      log.debug("Action event {} carries no action", event.id());
      return HandlerResult.ok();
    }
    AgentAction action;
    try {
      action = objectMapper.convertValue(payload, AgentAction.class);
    } catch (IllegalArgumentException e) {
      log.error("Error handling agent action {}", event.id(), e);
      return HandlerResult.failed(e);
    }

    if (action.isFinished()) {
      completeAction(action);
    } else {
      submitAction(action);
    }
    return HandlerResult.ok();
  }

  HandlerResult handleAgentHeartbeat(SystemEvent event) {
    Object agentId = event.dataValue("agentId");
    Agent agent = agentId != null ? agents.get(agentId.toString()) : null;
    if (agent == null) {
      log.debug("Heartbeat from unknown agent {}", agentId);
      return HandlerResult.ok();
    }
    Instant now = clock.instant();
    AgentStatus previous = agent.heartbeat(now);
    AgentHealth previousHealth = agent.getReportedHealth();
    agent.setReportedHealth(AgentHealth.HEALTHY);
    if (previous != AgentStatus.RUNNING || previousHealth != AgentHealth.HEALTHY) {
      announceStatusChange(agent, AgentHealth.HEALTHY);
    }
    return HandlerResult.ok();
  }

  private boolean handleApprovalRequired(AgentAction action, PolicyRule policy) {
    if (settings.autoApprovalEnabled() && canAutoApprove(action)) {
      log.info("Action {} auto-approved", action.id());
      return true;
    }
    HighRiskAction request = HighRiskAction.pending(action, policy.name(), clock.instant());
    if (approvals.register(request).created()) {
      announceApprovalRequest(request);
      log.info("Approval requested for action {} due to policy {}", action.id(), policy.name());
    }
    return false;
  }

  /** An escalated action stops being active until someone approves it. */
  private void escalateConflict(AgentAction action, PolicyRule policy) {
    if (activeActions.remove(action.id()) != null) {
      log.info("Active action {} withdrawn pending conflict review", action.id());
    }
    handleApprovalRequired(action, policy);
  }

  private boolean canAutoApprove(AgentAction action) {
    return action.riskLevel() == RiskLevel.LOW
        || (action.riskLevel() == RiskLevel.MEDIUM && !action.touchesProduction());
  }

  private void announceApprovalRequest(HighRiskAction request) {
    AgentAction action = request.action();
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("action", "approval_requested");
    data.put("actionId", action.id());
    data.put("agentId", action.agentId());
    data.put("description", action.description());
    data.put("riskLevel", action.riskLevel().value());
    data.put("targetResources", action.targetResources());
    data.put("policyName", request.policyName());
    publishCoordinationEvent(Severity.MEDIUM, data);

    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.APPROVAL_REQUESTED, action.id(),
        "Approval requested due to policy " + request.policyName(), data));
  }

  private void track(AgentAction action) {
    activeActions.compute(action.id(), (id, existing) ->
        new TrackedAction(action, existing != null ? existing.trackedAt() : clock.instant()));
  }

  private void completeAction(AgentAction report) {
    TrackedAction tracked = activeActions.remove(report.id());
    if (tracked == null) {
      log.debug("Completion report for untracked action {}", report.id());
      return;
    }
    boolean success = report.status() == ActionStatus.COMPLETED;
    long responseMs = Duration.between(tracked.trackedAt(), clock.instant()).toMillis();
    stats.computeIfAbsent(report.agentId(), id -> new ActionStats()).record(success, responseMs);
    log.info("Action {} {} after {}ms", report.id(), report.status(), responseMs);
  }

  private void cancelAction(String actionId, String reason) {
    TrackedAction tracked = activeActions.remove(actionId);
    if (tracked == null) {
      return;
    }
    AgentAction cancelled = tracked.action().withOutcome(ActionStatus.FAILED, ActionResult.cancelled(reason));

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("action", "action_cancelled");
    data.put("actionId", actionId);
    data.put("agentId", cancelled.agentId());
    data.put("status", cancelled.status().value());
    data.put("reason", reason);
    publishCoordinationEvent(Severity.MEDIUM, data);
    log.info("Action {} cancelled: {}", actionId, reason);
  }

  private void announceStatusChange(Agent agent, AgentHealth health) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("agentId", agent.getId());
    details.put("status", clientStatus(agent));
    details.put("health", health.value());
    details.put("lastActivity", agent.getLastHeartbeat().toString());
    notifications.notify(CoordinationNotice.of(clock.instant(), NoticeType.AGENT_STATUS_CHANGED, agent.getId(),
        "Agent " + agent.getId() + " is " + clientStatus(agent) + " (" + health.value() + ")", details));
  }

  private void publishCoordinationEvent(Severity severity, Map<String, Object> data) {
    SystemEvent event = new SystemEvent(UUID.randomUUID().toString(), EventType.INFRASTRUCTURE_CHANGE,
        SOURCE, severity, data, clock.instant(), null);
    try {
      eventBus.publish(event);
    } catch (RuntimeException e) {
      log.error("Failed to publish coordination event {} ({})", event.id(), data.get("action"), e);
    }
  }

  private AgentView viewOf(Agent agent) {
    Instant now = clock.instant();
    return new AgentView(
        agent.getId(),
        agent.getConfig().name(),
        agent.getConfig().type(),
        clientStatus(agent),
        agent.healthAt(now),
        agent.getLastHeartbeat(),
        getMetrics(agent.getId())
    );
  }

  private static String clientStatus(Agent agent) {
    return agent.isRunning() ? "active" : "inactive";
  }

  private void bindInbound(EventType type, EventHandler handler) {
    inboundHandlers.put(TopicNames.forType(type), handler);
    inboundHandlers.put(TopicNames.sourcesOf(type), handler);
  }

  /** Drops events the orchestrator emitted itself so routed copies never loop back. */
  static boolean isExternal(SystemEvent event) {
    String source = event.source();
    return source == null
        || !(source.equals(SOURCE) || source.startsWith(TopicNames.routedSource("")));
  }

  private record TrackedAction(AgentAction action, Instant trackedAt) {}
}
