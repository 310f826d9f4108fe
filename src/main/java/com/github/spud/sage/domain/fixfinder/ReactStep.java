package com.github.spud.sage.domain.fixfinder;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 每次迭代一条，创建后不再修改
 */
@Value
@Builder
public class ReactStep {

  int stepNumber;

  String observation;

  String reasoning;

  /**
   * tool_calls | final_analysis | timeout | error_recovery
   */
  String action;

  @Singular
  List<ToolCall> toolCalls;

  @Singular
  List<String> findings;
}
