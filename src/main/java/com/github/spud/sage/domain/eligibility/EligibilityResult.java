package com.github.spud.sage.domain.eligibility;

import com.github.spud.sage.domain.fixfinder.FixFinderResult;
import com.github.spud.sage.domain.loan.FixSuggestion;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.ProductResult;
import com.github.spud.sage.domain.loan.RuleViolation;
import com.github.spud.sage.domain.rag.GuideCitation;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 一次资格检查的完整结果
 * <p>
 * products / violations 只来自确定性规则引擎；fixFinderResult 仅作为补充信息，不改变资格判定
 */
@Value
@Builder(toBuilder = true)
public class EligibilityResult {

  LoanScenario scenario;

  double calculatedLtv;

  double calculatedDti;

  @Singular
  List<ProductResult> products;

  String recommendation;

  @Singular
  List<FixSuggestion> fixSuggestions;

  @Singular
  List<GuideCitation> supportingCitations;

  /**
   * Present only when fix finding ran
   */
  FixFinderResult fixFinderResult;

  public List<RuleViolation> allViolations() {
    return products.stream()
      .flatMap(p -> p.getViolations().stream())
      .collect(Collectors.toList());
  }

  public Optional<ProductResult> product(String productName) {
    return products.stream().filter(p -> p.getProductName().equals(productName)).findFirst();
  }
}
