package com.opsdash.coordination.controller;

import com.opsdash.coordination.model.HighRiskAction;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

  private final AgentOrchestrator orchestrator;

  public ApprovalController(AgentOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping("/pending")
  public ResponseEntity<List<HighRiskAction>> listPending() {
    return ResponseEntity.ok(orchestrator.getPendingApprovals());
  }

  @PostMapping("/{actionId}/approve")
  public ResponseEntity<DecisionResponse> approve(
      @PathVariable String actionId,
      @Valid @RequestBody DecisionRequest request) {
    orchestrator.approveAction(actionId, request.actor(), request.reason());
    return ResponseEntity.ok(new DecisionResponse(actionId, true, request.actor()));
  }

  @PostMapping("/{actionId}/reject")
  public ResponseEntity<DecisionResponse> reject(
      @PathVariable String actionId,
      @Valid @RequestBody DecisionRequest request) {
    orchestrator.rejectAction(actionId, request.actor(), request.reason());
    return ResponseEntity.ok(new DecisionResponse(actionId, false, request.actor()));
  }

  public record DecisionRequest(@NotBlank String actor, String reason) {}

  public record DecisionResponse(String actionId, boolean approved, String decidedBy) {}
}
