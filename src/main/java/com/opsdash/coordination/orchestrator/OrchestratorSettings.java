package com.opsdash.coordination.orchestrator;

import com.opsdash.coordination.model.ConflictResolutionStrategy;
import java.time.Duration;

public record OrchestratorSettings(
    Duration actionTimeout,
    boolean autoApprovalEnabled,
    ConflictResolutionStrategy conflictStrategy,
    Duration heartbeatStaleAfter
) {

  public static OrchestratorSettings defaults() {
    return new OrchestratorSettings(Duration.ofMinutes(5), false,
        ConflictResolutionStrategy.of(null), Duration.ofMinutes(2));
  }
}
