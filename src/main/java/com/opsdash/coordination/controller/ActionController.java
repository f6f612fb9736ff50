package com.opsdash.coordination.controller;

import com.opsdash.coordination.enums.ConflictStrategyType;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.ConflictResolutionStrategy;
import com.opsdash.coordination.model.PolicyDecision;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/actions")
public class ActionController {

  private final AgentOrchestrator orchestrator;

  public ActionController(AgentOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping("/enforce")
  public ResponseEntity<PolicyDecision> enforce(@Valid @RequestBody AgentAction action) {
    return ResponseEntity.ok(orchestrator.submitAction(action));
  }

  @PostMapping("/conflicts")
  public ResponseEntity<List<AgentAction>> resolveConflicts(@Valid @RequestBody ConflictRequest request) {
    List<AgentAction> resolved = request.strategy() != null
        ? orchestrator.resolveConflicts(request.actions(), ConflictResolutionStrategy.of(request.strategy()))
        : orchestrator.resolveConflicts(request.actions());
    return ResponseEntity.ok(resolved);
  }

  public record ConflictRequest(@NotNull List<@Valid AgentAction> actions, ConflictStrategyType strategy) {}
}
