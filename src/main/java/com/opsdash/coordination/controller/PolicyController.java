package com.opsdash.coordination.controller;

import com.opsdash.coordination.model.PolicyRule;
import com.opsdash.coordination.service.PolicyService;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/policies")
public class PolicyController {

  private final PolicyService policyService;

  public PolicyController(PolicyService policyService) {
    this.policyService = policyService;
  }

  @GetMapping
  public ResponseEntity<List<PolicyRule>> listPolicies() {
    return ResponseEntity.ok(policyService.listPolicies());
  }

  @PostMapping
  public ResponseEntity<PolicyRule> savePolicy(@Valid @RequestBody PolicyRule request) {
    PolicyRule saved = policyService.savePolicy(request);
    return ResponseEntity
        .created(URI.create("/api/v1/policies/" + saved.id()))
        .body(saved);
  }

  @DeleteMapping("/{policyId}")
  public ResponseEntity<Void> deletePolicy(@PathVariable String policyId) {
    boolean deleted = policyService.deletePolicy(policyId);
    return deleted ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PatchMapping("/{policyId}/enable")
  public ResponseEntity<PolicyRule> enablePolicy(@PathVariable String policyId) {
    return policyService.setPolicyEnabled(policyId, true)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  @PatchMapping("/{policyId}/disable")
  public ResponseEntity<PolicyRule> disablePolicy(@PathVariable String policyId) {
    return policyService.setPolicyEnabled(policyId, false)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }
}
