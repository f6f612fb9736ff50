package com.opsdash.coordination.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.opsdash.coordination.enums.ActionStatus;
import com.opsdash.coordination.enums.RiskLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentAction(
    @NotBlank String id,
    @NotBlank String agentId,
    String type,
    String description,
    List<String> targetResources,
    @NotNull RiskLevel riskLevel,
    String estimatedImpact,
    ActionStatus status,
    Instant executedAt,
    ActionResult result
) {

  public AgentAction {
    targetResources = targetResources == null ? List.of() : List.copyOf(targetResources);
    status = status == null ? ActionStatus.PENDING : status;
  }

  public AgentAction withRiskLevel(RiskLevel level) {
    return new AgentAction(id, agentId, type, description, targetResources, level,
        estimatedImpact, status, executedAt, result);
  }

  public AgentAction withStatus(ActionStatus newStatus) {
    return new AgentAction(id, agentId, type, description, targetResources, riskLevel,
        estimatedImpact, newStatus, executedAt, result);
  }

  public AgentAction withOutcome(ActionStatus newStatus, ActionResult newResult) {
    return new AgentAction(id, agentId, type, description, targetResources, riskLevel,
        estimatedImpact, newStatus, executedAt, newResult);
  }

  public boolean touchesProduction() {
    return targetResources.stream()
        .anyMatch(resource -> resource != null && resource.toLowerCase(Locale.ROOT).contains("prod"));
  }

  public boolean isFinished() {
    return status == ActionStatus.COMPLETED || status == ActionStatus.FAILED;
  }
}
