package com.opsdash.coordination.conflict;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import com.opsdash.coordination.enums.PolicyEffect;
import com.opsdash.coordination.enums.RiskLevel;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.ConflictResolutionStrategy;
import com.opsdash.coordination.model.PolicyRule;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reduces competing actions on the same resources to the ones allowed to proceed. */
public class ConflictResolver {

  private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

  public static final PolicyRule ESCALATION_POLICY = new PolicyRule(
      "conflict-escalation", "Conflict Escalation", PolicyEffect.REQUIRE_APPROVAL, 1000, true,
      ConditionGroupOperator.AND, List.of());

  private static final Comparator<AgentAction> BY_RISK_THEN_AGE =
      Comparator.<AgentAction>comparingInt(action -> rankOf(action.riskLevel())).reversed()
          .thenComparing(action -> action.executedAt() != null ? action.executedAt() : Instant.EPOCH);

  public List<AgentAction> resolve(List<AgentAction> actions,
                                   ConflictResolutionStrategy strategy,
                                   ConflictEscalator escalator) {
    if (actions == null || actions.size() <= 1) {
      return actions == null ? List.of() : actions;
    }
    ConflictResolutionStrategy effective = strategy != null
        ? strategy
        : ConflictResolutionStrategy.of(null);
    log.debug("Resolving conflict between {} actions with strategy {}", actions.size(), effective.type());

    return switch (effective.type()) {
      case PRIORITY -> List.of(actions.stream().sorted(BY_RISK_THEN_AGE).findFirst().orElseThrow());
      case FIRST_WINS -> List.of(actions.get(0));
      // Merging competing actions is not defined; the first one proceeds.
      case MERGE -> List.of(actions.get(0));
      case ESCALATE -> escalate(actions, escalator);
    };
  }

  private List<AgentAction> escalate(List<AgentAction> actions, ConflictEscalator escalator) {
    for (AgentAction action : actions) {
      AgentAction highRisk = action.withRiskLevel(RiskLevel.HIGH);
      try {
        escalator.escalate(highRisk, ESCALATION_POLICY);
      } catch (RuntimeException e) {
        log.error("Failed to escalate conflicting action {}", action.id(), e);
      }
    }
    log.info("Escalated {} conflicting actions for approval", actions.size());
    return List.of();
  }

  private static int rankOf(RiskLevel level) {
    return level != null ? level.rank() : 0;
  }
}
