package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import com.opsdash.coordination.enums.PolicyEffect;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record PolicyRule(
    @NotBlank String id,
    String name,
    @NotNull PolicyEffect effect,
    int priority,
    boolean enabled,
    ConditionGroupOperator groupOperator,
    List<ConditionGroupDto> conditionGroups
) {

  public PolicyRule {
    groupOperator = groupOperator == null ? ConditionGroupOperator.AND : groupOperator;
    conditionGroups = conditionGroups == null ? List.of() : List.copyOf(conditionGroups);
  }

  public PolicyRule withEnabled(boolean value) {
    return new PolicyRule(id, name, effect, priority, value, groupOperator, conditionGroups);
  }
}
