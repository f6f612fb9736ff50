package com.opsdash.coordination.service;

import com.opsdash.coordination.model.PolicyRule;
import com.opsdash.coordination.repository.PolicyRuleEntity;
import com.opsdash.coordination.repository.PolicyRuleRepository;
import com.opsdash.coordination.ruleengine.PolicyEngine;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Policy administration. Every change goes to the live {@link PolicyEngine} and to the
 * {@code policy_rules} table, which is replayed over the built-in rules on start-up.
 */
@Service
public class PolicyService {

  private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

  private final PolicyRuleRepository repository;
  private final PolicyEngine policyEngine;
  private final Clock clock;

  public PolicyService(PolicyRuleRepository repository, PolicyEngine policyEngine, Clock clock) {
    this.repository = repository;
    this.policyEngine = policyEngine;
    this.clock = clock;
  }

  @PostConstruct
  public void loadPersistedPolicies() {
    List<PolicyRuleEntity> stored = repository.findAllByOrderByCreatedAtAsc();
    stored.forEach(entity -> policyEngine.addRule(toRule(entity)));
    log.info("Loaded {} persisted policies", stored.size());
  }

  public List<PolicyRule> listPolicies() {
    return policyEngine.getRules();
  }

  @Transactional
  public PolicyRule savePolicy(PolicyRule rule) {
    Instant now = clock.instant();
    PolicyRuleEntity entity = repository.findById(rule.id()).orElseGet(() -> {
      PolicyRuleEntity created = new PolicyRuleEntity();
      created.setId(rule.id());
      created.setCreatedAt(now);
      return created;
    });
    apply(entity, rule);
    entity.setUpdatedAt(now);
    PolicyRule saved = toRule(repository.save(entity));
    policyEngine.addRule(saved);
    return saved;
  }

  @Transactional
  public boolean deletePolicy(String ruleId) {
    boolean persisted = repository.existsById(ruleId);
    if (persisted) {
      repository.deleteById(ruleId);
    }
    boolean live = policyEngine.removeRule(ruleId);
    return persisted || live;
  }

  /** Toggles a rule; the new state is persisted so it survives a restart. */
  @Transactional
  public Optional<PolicyRule> setPolicyEnabled(String ruleId, boolean enabled) {
    return policyEngine.getRule(ruleId).map(rule -> savePolicy(rule.withEnabled(enabled)));
  }

  private void apply(PolicyRuleEntity entity, PolicyRule rule) {
    entity.setName(rule.name());
    entity.setEffect(rule.effect());
    entity.setPriority(rule.priority());
    entity.setEnabled(rule.enabled());
    entity.setGroupOperator(rule.groupOperator());
    entity.setConditionGroups(rule.conditionGroups());
  }

  private PolicyRule toRule(PolicyRuleEntity entity) {
    return new PolicyRule(
        entity.getId(),
        entity.getName(),
        entity.getEffect(),
        entity.getPriority(),
        entity.isEnabled(),
        entity.getGroupOperator(),
        entity.getConditionGroups()
    );
  }
}
