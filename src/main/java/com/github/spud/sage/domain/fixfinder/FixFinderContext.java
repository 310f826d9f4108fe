package com.github.spud.sage.domain.fixfinder;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.ProductResult;
import com.github.spud.sage.domain.loan.RuleViolation;
import com.github.spud.sage.domain.rag.GuideCitation;
import com.github.spud.sage.domain.simulation.SimulationResult;
import com.github.spud.sage.domain.state.FixFinderState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/**
 * 一次 findFixes 调用的上下文，仅由该请求持有
 */
@Data
@Builder
public class FixFinderContext {

  /**
   * 追踪 ID（用于日志关联）
   */
  @Builder.Default
  private String traceId = UUID.randomUUID().toString();

  private LoanScenario scenario;

  @Builder.Default
  private List<RuleViolation> violations = new ArrayList<>();

  @Builder.Default
  private List<ProductResult> products = new ArrayList<>();

  private boolean demoMode;

  @Builder.Default
  private int maxIterations = 3;

  /**
   * 已开始的迭代数
   */
  @Builder.Default
  private int iteration = 0;

  /**
   * 已发出的模型调用数（含最终分析）
   */
  @Builder.Default
  private int modelCalls = 0;

  @Builder.Default
  private FixFinderState currentState = FixFinderState.INIT;

  private TerminationReason terminationReason;

  @Builder.Default
  private List<ReactStep> trace = new ArrayList<>();

  @Builder.Default
  private List<GuideCitation> citations = new ArrayList<>();

  @Builder.Default
  private List<SimulationResult> simulations = new ArrayList<>();

  /**
   * compare_products 返回的产品对比，最终载荷缺少 product_comparison 时使用
   */
  @Builder.Default
  private Map<String, String> toolComparison = new LinkedHashMap<>();

  @Builder.Default
  private long tokensIn = 0;

  @Builder.Default
  private long tokensOut = 0;

  /**
   * 最终分析解析结果，失败时为空对象
   */
  private JsonNode finalPayload;

  @Builder.Default
  private Instant startTime = Instant.now();

  public int incrementIteration() {
    return ++iteration;
  }

  public void addStep(ReactStep step) {
    trace.add(step);
  }

  public void addTokens(Integer in, Integer out) {
    tokensIn += in != null ? in : 0;
    tokensOut += out != null ? out : 0;
  }

  public long tokensUsed() {
    return tokensIn + tokensOut;
  }

  public long elapsedMs() {
    return System.currentTimeMillis() - startTime.toEpochMilli();
  }
}
