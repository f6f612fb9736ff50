package com.opsdash.coordination.enums;

public enum ConditionGroupOperator {
  AND,
  OR
}
