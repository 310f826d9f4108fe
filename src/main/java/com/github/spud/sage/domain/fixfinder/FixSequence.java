package com.github.spud.sage.domain.fixfinder;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 多步修复路径，steps 非空
 */
@Value
@Builder
public class FixSequence {

  String sequenceName;

  String description;

  @Singular
  List<EnhancedFixSuggestion> steps;

  Effort totalEffort;

  /**
   * Always within [0,10]
   */
  double effortVsBenefitScore;

  @Singular("productUnlocked")
  List<String> productsUnlocked;

  String estimatedTotalTimeline;
}
