package com.opsdash.coordination.controller;

import com.opsdash.coordination.exception.NotFoundException;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.AgentConfig;
import com.opsdash.coordination.model.AgentView;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

  private final AgentOrchestrator orchestrator;

  public AgentController(AgentOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  public ResponseEntity<List<AgentView>> listAgents() {
    return ResponseEntity.ok(orchestrator.getAgents());
  }

  @GetMapping("/{agentId}")
  public ResponseEntity<AgentView> getAgent(@PathVariable String agentId) {
    return orchestrator.getAgent(agentId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PostMapping
  public ResponseEntity<AgentView> registerAgent(@Valid @RequestBody AgentConfig config) {
    AgentView registered = orchestrator.registerAgent(config);
    return ResponseEntity
        .created(URI.create("/api/v1/agents/" + registered.id()))
        .body(registered);
  }

  @DeleteMapping("/{agentId}")
  public ResponseEntity<Void> unregisterAgent(@PathVariable String agentId) {
    orchestrator.unregisterAgent(agentId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/actions")
  public ResponseEntity<List<AgentAction>> listActiveActions() {
    return ResponseEntity.ok(orchestrator.getActiveActions());
  }

  @GetMapping("/{agentId}/actions")
  public ResponseEntity<List<AgentAction>> listAgentActions(@PathVariable String agentId) {
    if (orchestrator.getAgent(agentId).isEmpty()) {
      throw NotFoundException.agent(agentId);
    }
    return ResponseEntity.ok(orchestrator.getActiveActions(agentId));
  }
}
