package com.opsdash.coordination.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class AgentHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(AgentHealthMonitor.class);

  private final AgentOrchestrator orchestrator;

  public AgentHealthMonitor(AgentOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Scheduled(fixedDelayString = "${coordination.orchestrator.health-check-interval-ms:30000}")
  public void checkAgents() {
    if (!orchestrator.isRunning()) {
      return;
    }
    try {
      orchestrator.ensureListening();
    } catch (RuntimeException e) {
      log.warn("Event bus still unavailable, inbound events are not being received: {}", e.getMessage());
    }
    log.debug("Running scheduled agent health check");
    orchestrator.performHealthCheck();
  }
}
