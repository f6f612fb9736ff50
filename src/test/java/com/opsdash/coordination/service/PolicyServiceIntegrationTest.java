package com.opsdash.coordination.service;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import com.opsdash.coordination.enums.PolicyConditionField;
import com.opsdash.coordination.enums.PolicyEffect;
import com.opsdash.coordination.enums.PolicyOutcome;
import com.opsdash.coordination.enums.RiskLevel;
import com.opsdash.coordination.enums.RuleOperator;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.ConditionDto;
import com.opsdash.coordination.model.ConditionGroupDto;
import com.opsdash.coordination.model.PolicyRule;
import com.opsdash.coordination.orchestrator.AgentOrchestrator;
import com.opsdash.coordination.repository.PolicyRuleEntity;
import com.opsdash.coordination.repository.PolicyRuleRepository;
import com.opsdash.coordination.ruleengine.DefaultPolicies;
import com.opsdash.coordination.ruleengine.PolicyEngine;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PolicyServiceIntegrationTest {

  @Autowired
  private PolicyService policyService;

  @Autowired
  private PolicyRuleRepository repository;

  @Autowired
  private PolicyEngine policyEngine;

  @Autowired
  private AgentOrchestrator orchestrator;

  @Test
  void builtInPoliciesAreLoadedAndOrchestratorIsRunning() {
    assertThat(policyService.listPolicies())
        .extracting(PolicyRule::id)
        .contains(
            DefaultPolicies.HIGH_RISK_APPROVAL,
            DefaultPolicies.PRODUCTION_PROTECTION,
            DefaultPolicies.DESTRUCTIVE_ACTIONS,
            DefaultPolicies.LOW_RISK_AUTO_APPROVE
        );
    assertThat(orchestrator.isRunning()).isTrue();
    assertThat(orchestrator.isHealthy()).isTrue();
  }

  @Test
  void savedPolicyIsPersistedAndEnforced() {
    PolicyRule saved = policyService.savePolicy(denyRule("deny-cache-flush", "flush-cache"));

    Optional<PolicyRuleEntity> stored = repository.findById("deny-cache-flush");
    assertThat(stored).isPresent();
    assertThat(stored.get().getConditionGroups())
        .singleElement()
        .satisfies(group -> assertThat(group.conditions())
            .extracting(ConditionDto::value)
            .containsExactly("flush-cache"));
    assertThat(stored.get().getCreatedAt()).isNotNull();

    assertThat(saved.effect()).isEqualTo(PolicyEffect.DENY);
    assertThat(orchestrator.decide(action("act-flush-1", "flush-cache")).outcome())
        .isEqualTo(PolicyOutcome.DENIED);
  }

  @Test
  void updateKeepsCreationTimeAndReplacesRule() {
    policyService.savePolicy(denyRule("deny-purge", "purge-queue"));
    Instant createdAt = repository.findById("deny-purge").orElseThrow().getCreatedAt();

    policyService.savePolicy(new PolicyRule("deny-purge", "Purges allowed", PolicyEffect.ALLOW, 900, true,
        ConditionGroupOperator.AND, denyRule("deny-purge", "purge-queue").conditionGroups()));

    PolicyRuleEntity stored = repository.findById("deny-purge").orElseThrow();
    assertThat(stored.getCreatedAt()).isEqualTo(createdAt);
    assertThat(stored.getEffect()).isEqualTo(PolicyEffect.ALLOW);
    assertThat(policyEngine.getRules()).filteredOn(rule -> rule.id().equals("deny-purge")).hasSize(1);
  }

  @Test
  void disablingPolicyPersistsNewState() {
    policyService.savePolicy(denyRule("deny-drain", "drain-node"));

    Optional<PolicyRule> disabled = policyService.setPolicyEnabled("deny-drain", false);

    assertThat(disabled).map(PolicyRule::enabled).contains(false);
    assertThat(repository.findById("deny-drain")).map(PolicyRuleEntity::isEnabled).contains(false);
    assertThat(orchestrator.decide(action("act-drain-1", "drain-node")).outcome())
        .isEqualTo(PolicyOutcome.ALLOWED);
    assertThat(policyService.setPolicyEnabled("no-such-policy", true)).isEmpty();
  }

  @Test
  void deleteRemovesPersistedAndLiveRule() {
    policyService.savePolicy(denyRule("deny-rotate", "rotate-keys"));

    assertThat(policyService.deletePolicy("deny-rotate")).isTrue();
    assertThat(repository.existsById("deny-rotate")).isFalse();
    assertThat(policyEngine.getRule("deny-rotate")).isEmpty();
    assertThat(policyService.deletePolicy("deny-rotate")).isFalse();
  }

  @Test
  void persistedPoliciesAreReplayedIntoEngine() {
    PolicyRuleEntity entity = new PolicyRuleEntity();
    entity.setId("deny-reboot");
    entity.setName("No reboots");
    entity.setEffect(PolicyEffect.DENY);
    entity.setPriority(700);
    entity.setEnabled(true);
    entity.setGroupOperator(ConditionGroupOperator.AND);
    entity.setConditionGroups(denyRule("deny-reboot", "reboot-host").conditionGroups());
    entity.setCreatedAt(Instant.parse("2026-03-01T10:00:00Z"));
    entity.setUpdatedAt(Instant.parse("2026-03-01T10:00:00Z"));
    repository.save(entity);

    policyService.loadPersistedPolicies();

    assertThat(policyEngine.getRule("deny-reboot")).map(PolicyRule::name).contains("No reboots");
    assertThat(orchestrator.decide(action("act-reboot-1", "reboot-host")).policyId()).isEqualTo("deny-reboot");
  }

  private PolicyRule denyRule(String id, String actionType) {
    ConditionGroupDto group = new ConditionGroupDto(ConditionGroupOperator.AND, List.of(
        new ConditionDto(PolicyConditionField.ACTION_TYPE, RuleOperator.EQUALS, actionType)));
    return new PolicyRule(id, "Deny " + actionType, PolicyEffect.DENY, 500, true, ConditionGroupOperator.AND,
        List.of(group));
  }

  private AgentAction action(String id, String type) {
    return new AgentAction(id, "ops-agent", type, "Maintenance", List.of("staging-cache"), RiskLevel.LOW,
        "minimal", null, null, null);
  }
}
