package com.opsdash.coordination.orchestrator;

import com.opsdash.coordination.model.AgentMetrics;

/** Running totals of the actions one agent finished. */
class ActionStats {

  private long completed;
  private long failed;
  private long totalResponseMs;

  synchronized void record(boolean success, long responseMs) {
    if (success) {
      completed++;
    } else {
      failed++;
    }
    totalResponseMs += Math.max(0, responseMs);
  }

  synchronized AgentMetrics snapshot() {
    long performed = completed + failed;
    if (performed == 0) {
      return AgentMetrics.empty();
    }
    double successRate = Math.round(completed * 1000.0 / performed) / 10.0;
    return new AgentMetrics(performed, successRate, totalResponseMs / performed);
  }
}
