package com.opsdash.coordination.model;

public record AgentMetrics(
    long actionsPerformed,
    double successRate,
    long avgResponseTimeMs
) {

  public static AgentMetrics empty() {
    return new AgentMetrics(0, 0.0, 0);
  }
}
