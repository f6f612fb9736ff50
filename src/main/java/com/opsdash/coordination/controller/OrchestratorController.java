package com.opsdash.coordination.controller;

import com.opsdash.coordination.bus.EventBus;
import com.opsdash.coordination.enums.NoticeType;
import com.opsdash.coordination.notification.CoordinationNotice;
import com.opsdash.coordination.notification.NotificationBuffer;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Set;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/v1")
@Validated
public class OrchestratorController {

  private final AgentOrchestrator orchestrator;
  private final EventBus eventBus;
  private final NotificationBuffer buffer;

  public OrchestratorController(AgentOrchestrator orchestrator, EventBus eventBus, NotificationBuffer buffer) {
    this.orchestrator = orchestrator;
    this.eventBus = eventBus;
    this.buffer = buffer;
  }

  @GetMapping("/orchestrator/health")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = orchestrator.isHealthy();
    HealthResponse body = new HealthResponse(
        healthy,
        orchestrator.isRunning(),
        eventBus.isHealthy(),
        orchestrator.getAgents().size(),
        orchestrator.getActiveActions().size(),
        orchestrator.getPendingApprovals().size(),
        eventBus.getSubscriptionCount(null)
    );
    return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }

  @GetMapping("/notifications")
  public ResponseEntity<List<CoordinationNotice>> getRecent(
      @RequestParam(value = "type", required = false) Set<NoticeType> types,
      @RequestParam(value = "limit", defaultValue = "50") @Min(1) @Max(500) int limit) {
    return ResponseEntity.ok(buffer.getRecent(types, limit));
  }

  @GetMapping(value = "/notifications/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter stream(
      @RequestParam(value = "type", required = false) Set<NoticeType> types,
      @RequestParam(value = "backlog", defaultValue = "0") @Min(0) @Max(500) int backlog) {
    return buffer.subscribe(types, backlog);
  }

  public record HealthResponse(
      boolean healthy,
      boolean orchestratorRunning,
      boolean busHealthy,
      int agents,
      int activeActions,
      int pendingApprovals,
      int subscriptions
  ) {}
}
