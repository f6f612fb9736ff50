package com.opsdash.coordination.model;

import com.opsdash.coordination.enums.ConditionGroupOperator;
import java.util.List;

public record ConditionGroupDto(
    ConditionGroupOperator operator,
    List<ConditionDto> conditions
) {}
