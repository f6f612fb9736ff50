package com.opsdash.coordination.ruleengine;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import com.opsdash.coordination.enums.PolicyConditionField;
import com.opsdash.coordination.enums.PolicyEffect;
import com.opsdash.coordination.enums.RuleOperator;
import com.opsdash.coordination.model.ConditionDto;
import com.opsdash.coordination.model.ConditionGroupDto;
import com.opsdash.coordination.model.PolicyRule;
import java.util.List;

/** Built-in rules every engine starts with. */
public final class DefaultPolicies {

  public static final String HIGH_RISK_APPROVAL = "high-risk-approval";
  public static final String PRODUCTION_PROTECTION = "production-protection";
  public static final String DESTRUCTIVE_ACTIONS = "destructive-actions";
  public static final String LOW_RISK_AUTO_APPROVE = "low-risk-auto-approve";

  private DefaultPolicies() {
  }

  public static List<PolicyRule> all() {
    return List.of(highRiskApproval(), productionProtection(), destructiveActions(), lowRiskAutoApprove());
  }

  static PolicyRule highRiskApproval() {
    return new PolicyRule(HIGH_RISK_APPROVAL, "High Risk Actions Require Approval",
        PolicyEffect.REQUIRE_APPROVAL, 100, true, ConditionGroupOperator.AND,
        List.of(group(ConditionGroupOperator.AND,
            condition(PolicyConditionField.RISK_LEVEL, RuleOperator.EQUALS, "high"))));
  }

  static PolicyRule productionProtection() {
    return new PolicyRule(PRODUCTION_PROTECTION, "Production Environment Protection",
        PolicyEffect.REQUIRE_APPROVAL, 90, true, ConditionGroupOperator.AND,
        List.of(group(ConditionGroupOperator.OR,
            condition(PolicyConditionField.TARGET_RESOURCE, RuleOperator.CONTAINS, "prod"),
            condition(PolicyConditionField.TARGET_RESOURCE, RuleOperator.CONTAINS, "production"))));
  }

  static PolicyRule destructiveActions() {
    return new PolicyRule(DESTRUCTIVE_ACTIONS, "Destructive Actions Require Approval",
        PolicyEffect.REQUIRE_APPROVAL, 80, true, ConditionGroupOperator.AND,
        List.of(group(ConditionGroupOperator.OR,
            condition(PolicyConditionField.ACTION_TYPE, RuleOperator.EQUALS, "restart-service"),
            condition(PolicyConditionField.DESCRIPTION, RuleOperator.CONTAINS, "delete"),
            condition(PolicyConditionField.DESCRIPTION, RuleOperator.CONTAINS, "destroy"))));
  }

  static PolicyRule lowRiskAutoApprove() {
    return new PolicyRule(LOW_RISK_AUTO_APPROVE, "Auto-approve Low Risk Actions",
        PolicyEffect.ALLOW, 10, true, ConditionGroupOperator.AND,
        List.of(group(ConditionGroupOperator.AND,
            condition(PolicyConditionField.RISK_LEVEL, RuleOperator.EQUALS, "low"))));
  }

  private static ConditionGroupDto group(ConditionGroupOperator operator, ConditionDto... conditions) {
    return new ConditionGroupDto(operator, List.of(conditions));
  }

  private static ConditionDto condition(PolicyConditionField field, RuleOperator operator, String value) {
    return new ConditionDto(field, operator, value);
  }
}
