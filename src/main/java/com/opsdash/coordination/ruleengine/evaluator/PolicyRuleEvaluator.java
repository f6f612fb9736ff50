package com.opsdash.coordination.ruleengine.evaluator;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import com.opsdash.coordination.model.AgentAction;
import com.opsdash.coordination.model.ConditionDto;
import com.opsdash.coordination.model.ConditionGroupDto;
import com.opsdash.coordination.model.PolicyRule;
import java.util.ArrayList;
import java.util.List;

public class PolicyRuleEvaluator {

  private final ActionFieldExtractor fieldExtractor;
  private final ConditionEvaluator conditionEvaluator;

  public PolicyRuleEvaluator(ActionFieldExtractor fieldExtractor,
                             ConditionEvaluator conditionEvaluator) {
    this.fieldExtractor = fieldExtractor;
    this.conditionEvaluator = conditionEvaluator;
  }

  public PolicyRuleEvaluator() {
    this(new ActionFieldExtractor(), new ConditionEvaluator());
  }

  /** Enabled rules matching the action, in the order given. */
  public List<PolicyRule> matching(AgentAction action, List<PolicyRule> rules) {
    if (rules == null || rules.isEmpty()) {
      return List.of();
    }
    List<PolicyRule> matched = new ArrayList<>();
    for (PolicyRule rule : rules) {
      if (rule == null || !rule.enabled()) {
        continue;
      }
      if (matches(action, rule)) {
        matched.add(rule);
      }
    }
    return matched;
  }

  public boolean matches(AgentAction action, PolicyRule rule) {
    List<ConditionGroupDto> groups = rule.conditionGroups();
    if (groups == null || groups.isEmpty()) {
      return false;
    }
    List<Boolean> groupResults = new ArrayList<>(groups.size());
    for (ConditionGroupDto group : groups) {
      groupResults.add(evaluateGroup(action, group));
    }
    return applyOperator(rule.groupOperator(), groupResults);
  }

  private boolean evaluateGroup(AgentAction action, ConditionGroupDto group) {
    List<ConditionDto> conditions = group.conditions();
    if (conditions == null || conditions.isEmpty()) {
      return false;
    }
    List<Boolean> results = new ArrayList<>(conditions.size());
    for (ConditionDto condition : conditions) {
      List<String> actual = fieldExtractor.extract(action, condition.field());
      results.add(conditionEvaluator.evaluate(condition, actual));
    }
    return applyOperator(group.operator(), results);
  }

  boolean applyOperator(ConditionGroupOperator op, List<Boolean> results) {
    ConditionGroupOperator effective = op == null ? ConditionGroupOperator.AND : op;
    return switch (effective) {
      case AND -> results.stream().allMatch(Boolean::booleanValue);
      case OR -> results.stream().anyMatch(Boolean::booleanValue);
    };
  }
}
