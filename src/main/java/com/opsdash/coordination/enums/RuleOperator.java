package com.opsdash.coordination.enums;

public enum RuleOperator {
  EQUALS,
  NOT_EQUALS,
  GREATER_THAN,
  GREATER_THAN_OR_EQUAL,
  LESS_THAN,
  LESS_THAN_OR_EQUAL,
  CONTAINS,
  NOT_CONTAINS,
  STARTS_WITH,
  ENDS_WITH,
  REGEX_MATCH;

  /**
   * Negated operators must hold for every value of a multi-valued field;
   * all others hold when any single value matches.
   */
  public boolean isNegated() {
    return this == NOT_EQUALS || this == NOT_CONTAINS;
  }
}
