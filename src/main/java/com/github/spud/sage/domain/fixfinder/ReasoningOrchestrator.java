package com.github.spud.sage.domain.fixfinder;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.fixfinder.protocol.FinalPayloadParser;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.loan.ProductResult;
import com.github.spud.sage.domain.loan.RuleViolation;
import com.github.spud.sage.domain.rag.GuideExcerpt;
import com.github.spud.sage.domain.rag.RetrievalCoordinator;
import com.github.spud.sage.domain.rag.RetrievalProperties;
import com.github.spud.sage.domain.rag.RetrievalResult;
import com.github.spud.sage.domain.reasoning.FixFinderPrompts;
import com.github.spud.sage.domain.reasoning.ReasoningModel;
import com.github.spud.sage.domain.reasoning.ReasoningRequest;
import com.github.spud.sage.domain.reasoning.ReasoningResponse;
import com.github.spud.sage.domain.reasoning.ReasoningUnavailableException;
import com.github.spud.sage.domain.rules.RulesEngine;
import com.github.spud.sage.domain.state.FixFinderEvent;
import com.github.spud.sage.domain.state.FixFinderState;
import com.github.spud.sage.domain.state.StateMachineDriver;
import com.github.spud.sage.domain.tools.ToolExecutionService;
import com.github.spud.sage.domain.tools.ToolOutcome;
import com.github.spud.sage.domain.tools.ToolRegistry;
import com.github.spud.sage.domain.usage.LlmUsageTracker;
import com.github.spud.sage.util.JsonUtils;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Fix Finder 核心编排器 驱动状态机，协调 ReAct 迭代 / 工具执行 / 最终分析
 * <p>
 * 关键约束：<p> - 迭代严格串行，最多 maxIterations 次，模型调用总数不超过 maxIterations + 1<p> - 每次模型调用都有超时，不重试；
 * 迭代超时直接结束，迭代异常跳出循环后仍做最终分析<p> - 工具失败写入工具结果文本，循环继续<p> - 每次 findFixes 恰好写一条用量记录<p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReasoningOrchestrator {

  static final String SERVICE_NAME = "fix_finder";
  static final String REQUEST_TYPE = "fix_finding";

  static final int TRACE_SUMMARY_LIMIT = 500;
  static final int FINDING_LIMIT = 200;
  static final int REASONING_LIMIT = 500;

  private final ReasoningModel reasoningModel;
  private final ToolRegistry toolRegistry;
  private final ToolExecutionService toolExecutionService;
  private final RetrievalCoordinator retrievalCoordinator;
  private final RetrievalProperties retrievalProperties;
  private final RulesEngine rulesEngine;
  private final StateMachineDriver stateMachineDriver;
  private final FinalPayloadParser finalPayloadParser;
  private final ResultNormalizer resultNormalizer;
  private final LlmUsageTracker usageTracker;
  private final FixFinderProperties properties;

  public FixFinderResult findFixes(LoanScenario scenario, List<RuleViolation> violations,
    List<ProductResult> products, boolean demoMode) {
    return findFixes(scenario, violations, products, demoMode, null);
  }

  /**
   * 执行 Fix Finder
   *
   * @param seed scenario retrieval already performed by the caller, or null to retrieve here
   * @throws ReasoningUnavailableException when no reasoning model is configured
   */
  public FixFinderResult findFixes(LoanScenario scenario, List<RuleViolation> violations,
    List<ProductResult> products, boolean demoMode, RetrievalResult seed) {
    FixFinderContext ctx = FixFinderContext.builder()
      .scenario(scenario)
      .violations(new ArrayList<>(violations))
      .products(new ArrayList<>(products))
      .demoMode(demoMode)
      .maxIterations(Math.max(properties.getMaxIterations(), 0))
      .build();

    log.info("Starting fix finder: traceId={}, violations={}, demoMode={}",
      ctx.getTraceId(), violations.size(), demoMode);

    try {
      runLoop(ctx, seed);

      FixFinderResult normalized = resultNormalizer.normalize(ctx.getFinalPayload(),
        ctx.getCitations());
      long elapsed = ctx.elapsedMs();

      FixFinderResult.FixFinderResultBuilder builder = normalized.toBuilder();
      if (normalized.getProductComparison().isEmpty()) {
        builder.productComparison(ctx.getToolComparison());
      }
      FixFinderResult result = builder
        .simulations(ctx.getSimulations())
        .reactTrace(demoMode ? ctx.getTrace() : List.of())
        .totalIterations(ctx.getTrace().size())
        .totalTimeMs(elapsed)
        .tokensUsed(ctx.tokensUsed())
        .terminationReason(ctx.getTerminationReason())
        .citations(ctx.getCitations())
        .build();

      recordUsage(ctx, elapsed, true, null);
      log.info("Fix finder finished: traceId={}, reason={}, iterations={}, modelCalls={}, "
          + "fixes={}, {}ms", ctx.getTraceId(), ctx.getTerminationReason(),
        result.getTotalIterations(), ctx.getModelCalls(), result.getEnhancedFixes().size(),
        elapsed);
      return result;

    } catch (ReasoningUnavailableException e) {
      log.warn("Reasoning model unavailable: {}", e.getMessage());
      recordUsage(ctx, ctx.elapsedMs(), false, e.getMessage());
      throw e;

    } catch (Exception e) {
      log.error("Fix finder failed: traceId={}, {}", ctx.getTraceId(), e.getMessage(), e);
      long elapsed = ctx.elapsedMs();
      recordUsage(ctx, elapsed, false, e.getMessage());
      return FixFinderResult.failed(elapsed);
    }
  }

  private void runLoop(FixFinderContext ctx, RetrievalResult seed) {
    StateMachine<FixFinderState, FixFinderEvent> sm = stateMachineDriver.create(ctx.getTraceId());
    try {
      List<Message> messages = new ArrayList<>();
      messages.add(new UserMessage(buildInitialPrompt(ctx, seed)));

      transition(ctx, sm, FixFinderEvent.START);

      while (ctx.getCurrentState() == FixFinderState.ITERATING) {
        if (ctx.getIteration() >= ctx.getMaxIterations()) {
          log.debug("Iteration cap {} reached", ctx.getMaxIterations());
          ctx.setTerminationReason(TerminationReason.MAX_ITERATIONS);
          transition(ctx, sm, FixFinderEvent.MAX_ITERATIONS);
          break;
        }
        executeIteration(ctx, sm, messages);
      }

      if (ctx.getCurrentState() == FixFinderState.TERMINAL) {
        transition(ctx, sm, FixFinderEvent.FINALIZE);
        executeFinalAnalysis(ctx, messages);
      }
      if (ctx.getFinalPayload() == null) {
        ctx.setFinalPayload(JsonUtils.objectMapper().createObjectNode());
      }
      transition(ctx, sm, FixFinderEvent.FINISHED);

    } finally {
      stateMachineDriver.stop(sm);
    }
  }

  /**
   * 单次迭代：调用模型，按需执行工具并记录一条 ReactStep
   */
  private void executeIteration(FixFinderContext ctx,
    StateMachine<FixFinderState, FixFinderEvent> sm, List<Message> messages) {
    int stepNumber = ctx.incrementIteration();
    log.debug("Iteration {}: calling reasoning model", stepNumber);

    ReasoningRequest request = ReasoningRequest.builder()
      .systemPrompt(FixFinderPrompts.systemPrompt(ctx.getMaxIterations()))
      .messages(messages)
      .tools(toolRegistry.getNoOpCallbacks())
      .maxTokens(properties.getMaxTokens())
      .build();

    ReasoningResponse response;
    try {
      response = callModel(ctx, request, properties.getIterationTimeout());
    } catch (ReasoningUnavailableException e) {
      throw e;
    } catch (Exception e) {
      if (isTimeout(e)) {
        log.warn("Iteration {} timed out after {}s", stepNumber,
          properties.getIterationTimeout().toSeconds());
        ctx.addStep(ReactStep.builder()
          .stepNumber(stepNumber)
          .observation("Iteration timed out")
          .reasoning("Reasoning call exceeded " + properties.getIterationTimeout().toSeconds()
            + " second timeout")
          .action("timeout")
          .build());
        ctx.setTerminationReason(TerminationReason.TIMEOUT);
        transition(ctx, sm, FixFinderEvent.TIMEOUT);
      } else {
        log.error("Iteration {} failed: {}", stepNumber, e.getMessage(), e);
        ctx.addStep(ReactStep.builder()
          .stepNumber(stepNumber)
          .observation("Error in iteration: " + e.getMessage())
          .reasoning("Falling back to basic analysis")
          .action("error_recovery")
          .build());
        ctx.setTerminationReason(TerminationReason.ERROR);
        transition(ctx, sm, FixFinderEvent.FAIL);
      }
      return;
    }

    String text = response.getText() == null ? "" : response.getText();
    ReactStep.ReactStepBuilder step = ReactStep.builder()
      .stepNumber(stepNumber)
      .observation("Iteration " + stepNumber
        + ": Analyzing violations and determining next action")
      .reasoning(text.isBlank() ? "Processing tool calls..." : truncate(text, REASONING_LIMIT))
      .action(response.hasToolCalls() ? "tool_calls" : "final_analysis");

    messages.add(response.assistantMessage());

    if (!response.hasToolCalls()) {
      ctx.addStep(step.build());
      ctx.setTerminationReason(TerminationReason.COMPLETED);
      transition(ctx, sm, FixFinderEvent.COMPLETE);
      return;
    }

    transition(ctx, sm, FixFinderEvent.TOOLS_REQUESTED);
    messages.add(executeTools(ctx, response.getToolCalls(), step));
    ctx.addStep(step.build());

    if (response.signalsCompletion()) {
      ctx.setTerminationReason(TerminationReason.COMPLETED);
      transition(ctx, sm, FixFinderEvent.COMPLETE);
    } else {
      transition(ctx, sm, FixFinderEvent.TOOLS_DONE);
    }
  }

  /**
   * 按顺序执行工具调用，收集引用与模拟结果，返回回传给模型的工具消息
   */
  private ToolResponseMessage executeTools(FixFinderContext ctx,
    List<AssistantMessage.ToolCall> toolCalls, ReactStep.ReactStepBuilder step) {
    List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();

    for (AssistantMessage.ToolCall call : toolCalls) {
      ToolExecutionService.ToolExecutionResult result =
        toolExecutionService.execute(call.name(), call.arguments(), ctx);
      String summary = result.summary();

      ToolOutcome outcome = result.getOutcome();
      if (outcome != null) {
        ctx.getCitations().addAll(outcome.getCitations());
        if (outcome.getSimulation() != null) {
          ctx.getSimulations().add(outcome.getSimulation());
        }
        ctx.getToolComparison().putAll(outcome.getComparison());
      }

      step.toolCall(ToolCall.builder()
        .toolName(call.name())
        .arguments(result.getArguments())
        .resultSummary(truncate(summary, TRACE_SUMMARY_LIMIT))
        .success(result.isSuccess())
        .build());
      step.finding(truncate(summary, FINDING_LIMIT));

      responses.add(new ToolResponseMessage.ToolResponse(call.id(), call.name(), summary));
    }
    return new ToolResponseMessage(responses);
  }

  /**
   * 最终分析：超时或失败时载荷为空对象，不追加 trace
   */
  private void executeFinalAnalysis(FixFinderContext ctx, List<Message> messages) {
    messages.add(new UserMessage(FixFinderPrompts.FINAL_ANALYSIS_PROMPT));

    ReasoningRequest request = ReasoningRequest.builder()
      .systemPrompt(FixFinderPrompts.systemPrompt(ctx.getMaxIterations()))
      .messages(messages)
      .maxTokens(properties.getMaxTokens())
      .build();

    try {
      ReasoningResponse response = callModel(ctx, request, properties.getFinalAnalysisTimeout());
      JsonNode payload = finalPayloadParser.parse(response.getText());
      ctx.setFinalPayload(payload);
    } catch (ReasoningUnavailableException e) {
      throw e;
    } catch (Exception e) {
      if (isTimeout(e)) {
        log.warn("Final analysis timed out after {}s",
          properties.getFinalAnalysisTimeout().toSeconds());
        ctx.setTerminationReason(TerminationReason.TIMEOUT);
      } else {
        log.error("Final analysis failed: {}", e.getMessage(), e);
        ctx.setTerminationReason(TerminationReason.ERROR);
      }
      ctx.setFinalPayload(JsonUtils.objectMapper().createObjectNode());
    }
  }

  private ReasoningResponse callModel(FixFinderContext ctx, ReasoningRequest request,
    Duration timeout) {
    ctx.setModelCalls(ctx.getModelCalls() + 1);
    ReasoningResponse response = Mono.fromCallable(() -> reasoningModel.call(request))
      .subscribeOn(Schedulers.boundedElastic())
      .timeout(timeout)
      .block();
    if (response == null) {
      response = ReasoningResponse.builder().build();
    }
    ctx.addTokens(response.getPromptTokens(), response.getCompletionTokens());
    return response;
  }

  private String buildInitialPrompt(FixFinderContext ctx, RetrievalResult seed) {
    LoanScenario scenario = ctx.getScenario();
    double ltv = rulesEngine.calculateLtv(scenario.getLoanAmount(), scenario.getPropertyValue());
    double dti = rulesEngine.calculateDti(scenario);

    List<GuideExcerpt> excerpts = null;
    if (properties.isSeedGuideExcerpts()) {
      RetrievalResult retrieval = seed != null ? seed : retrieveSeed(scenario);
      excerpts = retrieval.getExcerpts();
      if (retrieval.isDataUnavailable()) {
        log.info("No guide excerpts available for fix finder seed: traceId={}",
          ctx.getTraceId());
      }
      ctx.getCitations().addAll(retrieval.citations(retrievalProperties.getSnippetLength()));
    }

    return FixFinderPrompts.initialPrompt(scenario, ltv, dti, ctx.getViolations(),
      ctx.getProducts(), excerpts);
  }

  private RetrievalResult retrieveSeed(LoanScenario scenario) {
    try {
      return retrievalCoordinator.retrieveForScenario(scenario);
    } catch (RuntimeException e) {
      log.warn("Scenario retrieval failed, continuing without guide excerpts: {}",
        e.getMessage());
      return RetrievalResult.builder().build();
    }
  }

  private void transition(FixFinderContext ctx, StateMachine<FixFinderState, FixFinderEvent> sm,
    FixFinderEvent event) {
    stateMachineDriver.sendEvent(sm, event);
    ctx.setCurrentState(stateMachineDriver.getCurrentState(sm));
  }

  private void recordUsage(FixFinderContext ctx, long durationMs, boolean success,
    String errorMessage) {
    usageTracker.recordUsage(SERVICE_NAME, reasoningModel.modelName(), reasoningModel.provider(),
      REQUEST_TYPE, ctx.getTokensIn(), ctx.getTokensOut(), durationMs, success, errorMessage);
  }

  static boolean isTimeout(Throwable e) {
    return Exceptions.unwrap(e) instanceof TimeoutException || e instanceof TimeoutException;
  }

  private static String truncate(String s, int max) {
    if (s == null) {
      return "";
    }
    return s.length() > max ? s.substring(0, max) : s;
  }
}
