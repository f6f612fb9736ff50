package com.opsdash.coordination.conflict;

import com.opsdash.coordination.enums.ConflictStrategyType;
import com.opsdash.coordination.enums.RiskLevel;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.ConflictResolutionStrategy;
import com.opsdash.coordination.model.PolicyRule;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ConflictResolverTest {

  private final ConflictResolver resolver = new ConflictResolver();
  private final ConflictEscalator escalator = mock(ConflictEscalator.class);

  @Test
  void zeroOrOneActionIsReturnedUnchanged() {
    AgentAction only = action("a1", RiskLevel.LOW, null);

    assertThat(resolver.resolve(List.of(), strategy(ConflictStrategyType.ESCALATE), escalator)).isEmpty();
    assertThat(resolver.resolve(List.of(only), strategy(ConflictStrategyType.ESCALATE), escalator))
        .containsExactly(only);
    verifyNoInteractions(escalator);
  }

  @Test
  void priorityPicksHighestRisk() {
    AgentAction low = action("low", RiskLevel.LOW, null);
    AgentAction high = action("high", RiskLevel.HIGH, null);

    assertThat(resolver.resolve(List.of(low, high), strategy(ConflictStrategyType.PRIORITY), escalator))
        .containsExactly(high);
    assertThat(resolver.resolve(List.of(high, low), strategy(ConflictStrategyType.PRIORITY), escalator))
        .containsExactly(high);
  }

  @Test
  void priorityTieGoesToEarliestExecution() {
    AgentAction later = action("later", RiskLevel.MEDIUM, Instant.parse("2026-03-01T10:05:00Z"));
    AgentAction earlier = action("earlier", RiskLevel.MEDIUM, Instant.parse("2026-03-01T10:00:00Z"));
    AgentAction unscheduled = action("unscheduled", RiskLevel.LOW, null);

    assertThat(resolver.resolve(List.of(later, unscheduled, earlier), null, escalator))
        .containsExactly(earlier);
  }

  @Test
  void firstWinsAndMergeKeepFirstAction() {
    AgentAction first = action("first", RiskLevel.LOW, null);
    AgentAction second = action("second", RiskLevel.HIGH, null);

    assertThat(resolver.resolve(List.of(first, second), strategy(ConflictStrategyType.FIRST_WINS), escalator))
        .containsExactly(first);
    assertThat(resolver.resolve(List.of(first, second), strategy(ConflictStrategyType.MERGE), escalator))
        .containsExactly(first);
  }

  @Test
  void escalateSendsEveryActionForApprovalAsHighRisk() {
    AgentAction first = action("first", RiskLevel.LOW, null);
    AgentAction second = action("second", RiskLevel.MEDIUM, null);

    List<AgentAction> resolved =
        resolver.resolve(List.of(first, second), strategy(ConflictStrategyType.ESCALATE), escalator);

    assertThat(resolved).isEmpty();
    ArgumentCaptor<AgentAction> actions = ArgumentCaptor.forClass(AgentAction.class);
    ArgumentCaptor<PolicyRule> policies = ArgumentCaptor.forClass(PolicyRule.class);
    verify(escalator, times(2)).escalate(actions.capture(), policies.capture());
    assertThat(actions.getAllValues()).extracting(AgentAction::riskLevel).containsOnly(RiskLevel.HIGH);
    assertThat(policies.getValue().name()).isEqualTo("Conflict Escalation");
    assertThat(policies.getValue().priority()).isEqualTo(1000);
  }

  @Test
  void escalationFailureDoesNotStopOtherActions() {
    ConflictEscalator failing = mock(ConflictEscalator.class);
    doThrow(new IllegalStateException("bus down"))
        .doNothing()
        .when(failing).escalate(any(), any());

    List<AgentAction> resolved = resolver.resolve(
        List.of(action("a", RiskLevel.LOW, null), action("b", RiskLevel.LOW, null)),
        strategy(ConflictStrategyType.ESCALATE), failing);

    assertThat(resolved).isEmpty();
    verify(failing, times(2)).escalate(any(), any());
  }

  private ConflictResolutionStrategy strategy(ConflictStrategyType type) {
    return ConflictResolutionStrategy.of(type);
  }

  private AgentAction action(String id, RiskLevel risk, Instant executedAt) {
    return new AgentAction(id, "agent-1", "apply-plan", "Apply", List.of("vpc"), risk, "minimal",
        null, executedAt, null);
  }
}
