package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.PolicyConditionField;
import com.opsdash.coordination.enums.RuleOperator;

public record ConditionDto(
    PolicyConditionField field,
    RuleOperator operator,
    String value
) {}
