package com.opsdash.coordination.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.opsdash.coordination.enums.AgentType;
import com.opsdash.coordination.enums.AutomationLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Externally supplied agent descriptor. The orchestrator never mutates it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentConfig(
    @NotBlank String id,
    String name,
    @NotNull AgentType type,
    boolean enabled,
    AutomationLevel automationLevel,
    Map<String, Double> thresholds,
    boolean approvalRequired,
    List<Integration> integrations,
    Instant createdAt,
    Instant updatedAt
) {

  public AgentConfig {
    thresholds = thresholds == null ? Map.of() : Map.copyOf(thresholds);
    integrations = integrations == null ? List.of() : List.copyOf(integrations);
  }
}
