package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.AgentHealth;
import com.opsdash.coordination.enums.AgentStatus;
import java.time.Duration;
import java.time.Instant;

/**
 * Registry entry for an agent. Owned by the orchestrator; status and heartbeat change
 * on heartbeats and health sweeps, which may run on different threads.
 */
public class Agent {

  static final Duration WARNING_AFTER = Duration.ofMinutes(2);
  static final Duration CRITICAL_AFTER = Duration.ofMinutes(5);

  private final String id;
  private final AgentConfig config;
  private AgentStatus status;
  private Instant lastHeartbeat;
  private AgentHealth reportedHealth;

  public Agent(AgentConfig config, Instant registeredAt) {
    this.id = config.id();
    this.config = config;
    this.status = AgentStatus.RUNNING;
    this.lastHeartbeat = registeredAt;
    this.reportedHealth = AgentHealth.HEALTHY;
  }

  public String getId() {
    return id;
  }

  public AgentConfig getConfig() {
    return config;
  }

  public synchronized AgentStatus getStatus() {
    return status;
  }

  public synchronized void setStatus(AgentStatus status) {
    this.status = status;
  }

  public synchronized Instant getLastHeartbeat() {
    return lastHeartbeat;
  }

  public synchronized boolean isRunning() {
    return status == AgentStatus.RUNNING;
  }

  /** Records a heartbeat and returns the status the agent had before it. */
  public synchronized AgentStatus heartbeat(Instant at) {
    AgentStatus previous = status;
    lastHeartbeat = at;
    status = AgentStatus.RUNNING;
    return previous;
  }

  public synchronized Duration sinceHeartbeat(Instant now) {
    return Duration.between(lastHeartbeat, now);
  }

  public synchronized AgentHealth healthAt(Instant now) {
    Duration silence = sinceHeartbeat(now);
    if (silence.compareTo(CRITICAL_AFTER) > 0) {
      return AgentHealth.CRITICAL;
    } else if (silence.compareTo(WARNING_AFTER) > 0) {
      return AgentHealth.WARNING;
    }
    return AgentHealth.HEALTHY;
  }

  public synchronized AgentHealth getReportedHealth() {
    return reportedHealth;
  }

  public synchronized void setReportedHealth(AgentHealth reportedHealth) {
    this.reportedHealth = reportedHealth;
  }
}
