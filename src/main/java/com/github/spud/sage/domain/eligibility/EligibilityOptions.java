package com.github.spud.sage.domain.eligibility;

import lombok.Builder;
import lombok.Value;

/**
 * 资格检查选项
 */
@Value
@Builder
public class EligibilityOptions {

  public static final EligibilityOptions RULES_ONLY = EligibilityOptions.builder()
    .includeFixes(false)
    .includeCitations(false)
    .build();

  /**
   * 存在违规时运行 Fix Finder
   */
  @Builder.Default
  boolean includeFixes = true;

  /**
   * 结果中附带 ReAct trace
   */
  boolean demoMode;

  /**
   * 附带 guide 引用
   */
  @Builder.Default
  boolean includeCitations = true;

  public static EligibilityOptions defaults() {
    return EligibilityOptions.builder().build();
  }
}
