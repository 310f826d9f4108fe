package com.github.spud.sage.domain.loan;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 单个产品的资格结果，eligible 由违规列表派生
 */
@Value
@Builder
public class ProductResult {

  String productName;

  Gse gse;

  @Singular
  List<RuleViolation> violations;

  public boolean isEligible() {
    return violations.isEmpty();
  }

  public boolean hasViolation(String ruleName) {
    return violations.stream().anyMatch(v -> v.getRuleName().equals(ruleName));
  }
}
