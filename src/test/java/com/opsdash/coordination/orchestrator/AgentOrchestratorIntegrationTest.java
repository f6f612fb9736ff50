package com.opsdash.coordination.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opsdash.coordination.approval.ApprovalRegistry;
import com.opsdash.coordination.bus.EventBus;
import com.opsdash.coordination.bus.EventBusSettings;
import com.opsdash.coordination.bus.EventHandler;
import com.opsdash.coordination.bus.EventSubscription;
import com.opsdash.coordination.bus.HandlerResult;
import com.opsdash.coordination.bus.TopicNames;
import com.opsdash.coordination.bus.transport.InMemoryBusTransport;
import com.opsdash.coordination.conflict.ConflictResolver;
import com.opsdash.coordination.enums.AgentType;
import com.opsdash.coordination.enums.AutomationLevel;
import com.opsdash.coordination.enums.EventType;
import com.opsdash.coordination.enums.NoticeType;
import com.opsdash.coordination.enums.RiskLevel;
import com.opsdash.coordination.enums.Severity;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.AgentConfig;
import com.opsdash.coordination.model.SystemEvent;
import com.opsdash.coordination.notification.NotificationService;
import com.opsdash.coordination.ruleengine.DefaultPolicies;
import com.opsdash.coordination.ruleengine.PolicyEngine;
import com.opsdash.coordination.ruleengine.evaluator.PolicyRuleEvaluator;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class AgentOrchestratorIntegrationTest {

  private NotificationService notifications;
  private EventBus bus;
  private ApprovalRegistry approvals;
  private AgentOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.systemUTC();
    notifications = mock(NotificationService.class);
    ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    bus = new EventBus(new InMemoryBusTransport(clock), objectMapper, notifications,
        new EventBusSettings(2, Duration.ofMillis(10), true, Duration.ofDays(30), 2), clock);
    approvals = new ApprovalRegistry(Duration.ofMinutes(5), clock, notifications);
    orchestrator = new AgentOrchestrator(bus,
        new PolicyEngine(new PolicyRuleEvaluator(), DefaultPolicies.all()),
        approvals,
        new ConflictResolver(),
        new EventRoutingTable(),
        notifications,
        objectMapper,
        OrchestratorSettings.defaults(),
        clock);
    orchestrator.start();
  }

  @AfterEach
  void tearDown() {
    orchestrator.stop();
    approvals.shutdown();
    bus.shutdown();
  }

  @Test
  void infrastructureChangeFansOutOnceAndIsRoutedToTerraformAgent() throws Exception {
    orchestrator.registerAgent(new AgentConfig("A", "Terraform A", AgentType.TERRAFORM, true,
        AutomationLevel.FULL_AUTO, null, false, null, null, null));
    EventHandler fanOut = okHandler();
    EventHandler agentChannel = okHandler();
    bus.subscribe(EventSubscription.of("events:infrastructure-change:terraform", fanOut));
    bus.subscribe(EventSubscription.of(TopicNames.routedTo("A"), agentChannel));

    SystemEvent change = SystemEvent.of(EventType.INFRASTRUCTURE_CHANGE, "terraform", Severity.MEDIUM,
        Map.of("resource", "vpc-main"));
    bus.publish(change);

    ArgumentCaptor<SystemEvent> routed = ArgumentCaptor.forClass(SystemEvent.class);
    verify(agentChannel, timeout(2000)).handle(routed.capture());
    assertThat(routed.getValue().source()).isEqualTo("orchestrator-to-A");
    assertThat(routed.getValue().data())
        .containsEntry("originalEventId", change.id())
        .containsEntry("routedTo", "A");

    verify(fanOut, after(300)).handle(any());
    verify(agentChannel).handle(any());
  }

  @Test
  void highRiskProductionActionWaitsForApproval() {
    AgentAction action = new AgentAction("act-42", "A", "apply-plan", "Apply network plan",
        List.of("prod-db"), RiskLevel.HIGH, "downtime possible", null, null, null);

    assertThat(orchestrator.enforcePolicy(action)).isFalse();
    assertThat(orchestrator.getPendingApprovals()).hasSize(1);

    orchestrator.approveAction("act-42", "ops-lead", null);

    assertThat(orchestrator.getPendingApprovals()).isEmpty();
    assertThat(orchestrator.getActiveActions()).extracting(AgentAction::id).containsExactly("act-42");
  }

  @Test
  void agentActionEventIsDecidedFromTheBus() {
    Map<String, Object> action = Map.of(
        "id", "act-7",
        "agentId", "k8s-1",
        "type", "scale-deployment",
        "description", "Scale checkout",
        "targetResources", List.of("prod-checkout"),
        "riskLevel", "medium");

    bus.publish(SystemEvent.of(EventType.AGENT_ACTION, "k8s-1", Severity.LOW, Map.of("action", action)));

    verify(notifications, timeout(2000))
        .notify(argThat(notice -> notice.type() == NoticeType.APPROVAL_REQUESTED));
    assertThat(orchestrator.getPendingApprovals())
        .singleElement()
        .satisfies(pending -> assertThat(pending.policyName()).isEqualTo("Production Environment Protection"));
  }

  private EventHandler okHandler() throws Exception {
    EventHandler handler = mock(EventHandler.class);
    given(handler.handle(any())).willReturn(HandlerResult.ok());
    return handler;
  }
}
