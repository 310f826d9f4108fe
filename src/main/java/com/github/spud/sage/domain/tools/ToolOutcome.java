package com.github.spud.sage.domain.tools;

import com.github.spud.sage.domain.rag.GuideCitation;
import com.github.spud.sage.domain.simulation.SimulationResult;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 工具执行产物：回传给模型的文本摘要，以及供最终结果收集的结构化数据
 */
@Value
@Builder
public class ToolOutcome {

  String summary;

  @Singular
  List<GuideCitation> citations;

  SimulationResult simulation;

  @Singular("comparisonEntry")
  Map<String, String> comparison;

  public static ToolOutcome of(String summary) {
    return ToolOutcome.builder().summary(summary).build();
  }
}
