package com.opsdash.coordination.ruleengine;

import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.PolicyRule;
import com.opsdash.coordination.ruleengine.evaluator.PolicyRuleEvaluator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of policy rules keyed by id. Evaluation picks the highest-priority enabled
 * rule matching an action; ties go to the rule registered first.
 */
public class PolicyEngine {

  private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

  private final PolicyRuleEvaluator evaluator;
  private final Map<String, PolicyRule> rules = new LinkedHashMap<>();

  public PolicyEngine(PolicyRuleEvaluator evaluator, List<PolicyRule> initialRules) {
    this.evaluator = evaluator;
    if (initialRules != null) {
      initialRules.forEach(this::addRule);
    }
  }

  public PolicyEngine(PolicyRuleEvaluator evaluator) {
    this(evaluator, List.of());
  }

  public Optional<PolicyRule> match(AgentAction action) {
    List<PolicyRule> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(rules.values());
    }
    // Stable sort: equal priorities keep registration order.
    return evaluator.matching(action, snapshot).stream()
        .sorted(Comparator.comparingInt(PolicyRule::priority).reversed())
        .findFirst();
  }

  /** Adds a rule, or replaces the one with the same id in place. */
  public synchronized void addRule(PolicyRule rule) {
    PolicyRule previous = rules.put(rule.id(), rule);
    if (previous != null) {
      log.info("Policy {} replaced", rule.id());
    } else {
      log.info("Policy {} added with priority {}", rule.id(), rule.priority());
    }
  }

  public synchronized boolean removeRule(String ruleId) {
    boolean removed = rules.remove(ruleId) != null;
    if (removed) {
      log.info("Policy {} removed", ruleId);
    }
    return removed;
  }

  public synchronized Optional<PolicyRule> setEnabled(String ruleId, boolean enabled) {
    PolicyRule current = rules.get(ruleId);
    if (current == null) {
      return Optional.empty();
    }
    PolicyRule updated = current.withEnabled(enabled);
    rules.put(ruleId, updated);
    log.info("Policy {} {}", ruleId, enabled ? "enabled" : "disabled");
    return Optional.of(updated);
  }

  public synchronized Optional<PolicyRule> getRule(String ruleId) {
    return Optional.ofNullable(rules.get(ruleId));
  }

  public synchronized List<PolicyRule> getRules() {
    return new ArrayList<>(rules.values());
  }
}
