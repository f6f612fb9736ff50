package com.opsdash.coordination.ruleengine.evaluator;

import com.opsdash.coordination.enums.RuleOperator;
import com.opsdash.coordination.model.ConditionDto;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class ConditionEvaluator {

  /**
   * Positive operators match when any value satisfies them; negated operators only when
   * every value does. No values never match.
   */
  public boolean evaluate(ConditionDto condition, List<String> actualValues) {
    if (condition == null || condition.operator() == null || condition.value() == null) {
      return false;
    }
    if (actualValues == null || actualValues.isEmpty()) {
      return false;
    }
    if (condition.operator().isNegated()) {
      return actualValues.stream().allMatch(actual -> evaluate(condition, actual));
    }
    return actualValues.stream().anyMatch(actual -> evaluate(condition, actual));
  }

  public boolean evaluate(ConditionDto condition, String actualValue) {
    if (condition == null || actualValue == null || condition.value() == null) {
      return false;
    }
    RuleOperator op = condition.operator();
    String actual = actualValue.toLowerCase(Locale.ROOT);
    String expected = condition.value().toLowerCase(Locale.ROOT);

    return switch (op) {
      case EQUALS -> actual.equals(expected);
      case NOT_EQUALS -> !actual.equals(expected);
      case GREATER_THAN -> compareNumericOrLex(actual, expected) > 0;
      case GREATER_THAN_OR_EQUAL -> compareNumericOrLex(actual, expected) >= 0;
      case LESS_THAN -> compareNumericOrLex(actual, expected) < 0;
      case LESS_THAN_OR_EQUAL -> compareNumericOrLex(actual, expected) <= 0;
      case CONTAINS -> actual.contains(expected);
      case NOT_CONTAINS -> !actual.contains(expected);
      case STARTS_WITH -> actual.startsWith(expected);
      case ENDS_WITH -> actual.endsWith(expected);
      case REGEX_MATCH -> matchesRegex(actualValue, condition.value());
    };
  }

  private int compareNumericOrLex(String actual, String expected) {
    try {
      return Double.compare(Double.parseDouble(actual), Double.parseDouble(expected));
    } catch (NumberFormatException ex) {
      return actual.compareTo(expected);
    }
  }

  private boolean matchesRegex(String actual, String pattern) {
    try {
      return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE).matcher(actual).find();
    } catch (PatternSyntaxException ex) {
      return false;
    }
  }
}
