package com.github.spud.sage.domain.loan;

import lombok.Builder;
import lombok.Value;

/**
 * 单条规则违规（仅由失败的检查产生）
 */
@Value
@Builder
public class RuleViolation {

  String ruleName;

  String ruleDescription;

  String actualValue;

  String requiredValue;

  /**
   * Guide reference, e.g. {@code Fannie Mae Selling Guide B5-6-02}
   */
  String citation;
}
