package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.AgentHealth;
import com.opsdash.coordination.enums.AgentType;
import java.time.Instant;

/** Dashboard-facing projection of a registered agent. */
public record AgentView(
    String id,
    String name,
    AgentType type,
    String status,
    AgentHealth health,
    Instant lastActivity,
    AgentMetrics metrics
) {}
