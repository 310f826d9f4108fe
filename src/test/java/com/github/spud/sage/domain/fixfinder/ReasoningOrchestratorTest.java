package com.github.spud.sage.domain.fixfinder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sage.domain.eligibility.EligibilityResult;
import com.github.spud.sage.domain.fixfinder.protocol.FinalPayloadParser;
import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.rag.GuideExcerpt;
import com.github.spud.sage.domain.rag.RetrievalCoordinator;
import com.github.spud.sage.domain.rag.RetrievalProperties;
import com.github.spud.sage.domain.rag.RetrievalResult;
import com.github.spud.sage.domain.reasoning.ReasoningModel;
import com.github.spud.sage.domain.reasoning.ReasoningRequest;
import com.github.spud.sage.domain.reasoning.ReasoningResponse;
import com.github.spud.sage.domain.reasoning.ReasoningUnavailableException;
import com.github.spud.sage.domain.rules.RulesEngine;
import com.github.spud.sage.domain.rules.RulesProperties;
import com.github.spud.sage.domain.simulation.ScenarioSimulator;
import com.github.spud.sage.domain.state.StateMachineDriver;
import com.github.spud.sage.domain.tools.CompareProductsTool;
import com.github.spud.sage.domain.tools.QueryGuidesTool;
import com.github.spud.sage.domain.tools.SimulateScenarioTool;
import com.github.spud.sage.domain.tools.ToolExecutionService;
import com.github.spud.sage.domain.tools.ToolRegistry;
import com.github.spud.sage.domain.usage.LlmUsageTracker;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;

/**
 * ReasoningOrchestrator 流程测试：脚本化模型驱动真实状态机与工具
 */
@ExtendWith(MockitoExtension.class)
class ReasoningOrchestratorTest {

  private static final String FINAL_JSON = """
    {
      "enhanced_fixes": [
        {"description": "Improve credit score to 660", "confidence": 0.8,
         "difficulty": "moderate", "unlocks_products": ["Home Possible"]}
      ],
      "fix_sequences": [
        {"sequence_name": "Credit first", "steps": [{"description": "Pay down cards"}]}
      ],
      "recommended_path": {"primary_recommendation": "Raise credit score, then apply"},
      "product_comparison": {"homeready": "eligible"}
    }
    """;

  @Mock
  private RetrievalCoordinator retrievalCoordinator;

  @Mock
  private LlmUsageTracker usageTracker;

  private ScriptedModel model;
  private FixFinderProperties properties;
  private RulesEngine rulesEngine;
  private ReasoningOrchestrator orchestrator;

  private LoanScenario scenario;
  private EligibilityResult eligibility;

  @BeforeEach
  void setUp() {
    rulesEngine = new RulesEngine(new RulesProperties());
    RetrievalProperties retrievalProperties = new RetrievalProperties();
    ToolRegistry registry = new ToolRegistry(List.of(
      new QueryGuidesTool(retrievalCoordinator, retrievalProperties),
      new SimulateScenarioTool(new ScenarioSimulator(rulesEngine)),
      new CompareProductsTool(retrievalCoordinator, retrievalProperties)));

    properties = new FixFinderProperties();
    properties.setIterationTimeout(Duration.ofSeconds(5));
    properties.setFinalAnalysisTimeout(Duration.ofSeconds(5));

    model = new ScriptedModel();
    orchestrator = new ReasoningOrchestrator(model, registry, new ToolExecutionService(registry),
      retrievalCoordinator, retrievalProperties, rulesEngine, new StateMachineDriver(),
      new FinalPayloadParser(), new ResultNormalizer(), usageTracker, properties);

    lenient().when(retrievalCoordinator.retrieveForScenario(any())).thenReturn(
      RetrievalResult.builder()
        .excerpt(GuideExcerpt.builder()
          .id("chunk-1").gse("freddie_mac").sectionId("4501.5")
          .text("Home Possible requires a minimum credit score of 660").score(0.9)
          .build())
        .queriesIssued(12)
        .build());

    scenario = LoanScenario.builder()
      .creditScore(640)
      .annualIncome(85_000)
      .loanAmount(350_000)
      .propertyValue(400_000)
      .monthlyDebtPayments(400)
      .build();
    eligibility = rulesEngine.checkEligibility(scenario);
  }

  private FixFinderResult run(boolean demoMode) {
    return orchestrator.findFixes(scenario, eligibility.allViolations(),
      eligibility.getProducts(), demoMode);
  }

  private static ReasoningResponse text(String text) {
    return ReasoningResponse.builder()
      .text(text).finishReason("stop").promptTokens(100).completionTokens(50).build();
  }

  private static ReasoningResponse toolCall(String name, String arguments) {
    return ReasoningResponse.builder()
      .text("Let me check.")
      .toolCall(new AssistantMessage.ToolCall("call-" + name, "function", name, arguments))
      .finishReason("tool_calls")
      .promptTokens(200)
      .completionTokens(20)
      .build();
  }

  @Test
  void shouldFinishWhenModelStopsCallingTools() {
    model.script(r -> text("I have enough information."), r -> text(FINAL_JSON));

    FixFinderResult result = run(false);

    assertThat(model.calls()).isEqualTo(2);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
    assertThat(result.getTotalIterations()).isEqualTo(1);
    assertThat(result.getReactTrace()).isEmpty();
    assertThat(result.getTokensUsed()).isEqualTo(300);
    assertThat(result.getEnhancedFixes()).singleElement()
      .satisfies(fix -> assertThat(fix.getCitations())
        .extracting(c -> c.getSectionId()).containsExactly("4501.5"));
    assertThat(result.getFixSequences()).hasSize(1);
    assertThat(result.getRecommendedPath()).isEqualTo("Raise credit score, then apply");
    assertThat(result.getProductComparison()).containsEntry("homeready", "eligible");

    ReasoningRequest finalRequest = model.requests().get(1);
    assertThat(finalRequest.getTools()).isEmpty();
  }

  @Test
  void shouldStopAtIterationCapWithOneFinalCall() {
    model.script(r -> r.getTools().isEmpty()
      ? text(FINAL_JSON)
      : toolCall(SimulateScenarioTool.NAME,
        "{\"changes\": {\"credit_score\": 665}, \"description\": \"Raise score\"}"));

    FixFinderResult result = run(true);

    assertThat(model.calls()).isEqualTo(properties.getMaxIterations() + 1);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
    assertThat(result.getReactTrace()).hasSize(properties.getMaxIterations());
    assertThat(result.getSimulations()).hasSize(3)
      .allMatch(s -> s.isHomePossibleEligible());
    assertThat(result.getReactTrace().get(0).getAction()).isEqualTo("tool_calls");
    assertThat(result.getReactTrace().get(0).getToolCalls()).singleElement()
      .satisfies(call -> {
        assertThat(call.isSuccess()).isTrue();
        assertThat(call.getResultSummary()).contains("Home Possible: Eligible");
      });
    assertThat(result.getEnhancedFixes()).hasSize(1);
  }

  @Test
  void shouldFeedToolResultsBackToModel() {
    model.script(
      r -> toolCall(SimulateScenarioTool.NAME, "{\"changes\": {\"credit_score\": 665}}"),
      r -> text("Done."),
      r -> text(FINAL_JSON));

    run(false);

    List<Message> secondTurn = model.requests().get(1).getMessages();
    assertThat(secondTurn).hasSize(3);
    assertThat(secondTurn.get(1)).isInstanceOfSatisfying(AssistantMessage.class,
      m -> assertThat(m.getToolCalls()).hasSize(1));
    assertThat(secondTurn.get(2)).isInstanceOfSatisfying(ToolResponseMessage.class,
      m -> assertThat(m.getResponses()).singleElement().satisfies(response -> {
        assertThat(response.id()).isEqualTo("call-simulate_scenario");
        assertThat(response.responseData()).startsWith("Simulation:");
      }));
  }

  @Test
  void shouldEndEarlyOnIterationTimeout() {
    properties.setIterationTimeout(Duration.ofMillis(100));
    model.script(r -> {
      sleep(2_000);
      return text("too late");
    });

    FixFinderResult result = run(true);

    assertThat(model.calls()).isEqualTo(1);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.TIMEOUT);
    assertThat(result.getReactTrace()).singleElement()
      .satisfies(step -> assertThat(step.getAction()).isEqualTo("timeout"));
    assertThat(result.getEnhancedFixes()).isEmpty();
    assertThat(result.getRecommendedPath()).isEmpty();
  }

  @Test
  void shouldRunFinalAnalysisAfterModelError() {
    model.script(
      r -> {
        throw new IllegalStateException("rate limited");
      },
      r -> text(FINAL_JSON));

    FixFinderResult result = run(true);

    assertThat(model.calls()).isEqualTo(2);
    assertThat(model.requests().get(1).getTools()).isEmpty();
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.ERROR);
    assertThat(result.getReactTrace()).singleElement().satisfies(step -> {
      assertThat(step.getAction()).isEqualTo("error_recovery");
      assertThat(step.getObservation()).contains("rate limited");
    });
    assertThat(result.getEnhancedFixes()).hasSize(1);
    verify(usageTracker, times(1)).recordUsage(eq("fix_finder"), anyString(), anyString(),
      eq("fix_finding"), anyLong(), anyLong(), anyLong(), eq(true), isNull());
  }

  @Test
  void shouldKeepToolResultsWhenLaterIterationFails() {
    model.script(
      r -> toolCall(SimulateScenarioTool.NAME,
        "{\"changes\": {\"credit_score\": 665}, \"description\": \"Raise score\"}"),
      r -> {
        throw new IllegalStateException("service unavailable");
      },
      r -> text(FINAL_JSON));

    FixFinderResult result = run(true);

    assertThat(model.calls()).isEqualTo(3);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.ERROR);
    assertThat(result.getSimulations()).singleElement()
      .satisfies(s -> assertThat(s.isHomePossibleEligible()).isTrue());
    assertThat(result.getReactTrace()).extracting(ReactStep::getAction)
      .containsExactly("tool_calls", "error_recovery");
    assertThat(result.getEnhancedFixes()).singleElement()
      .satisfies(fix -> assertThat(fix.getDescription()).isEqualTo("Improve credit score to 660"));
    assertThat(result.getRecommendedPath()).isEqualTo("Raise credit score, then apply");

    List<Message> finalTurn = model.requests().get(2).getMessages();
    assertThat(finalTurn).anySatisfy(m -> assertThat(m).isInstanceOf(ToolResponseMessage.class));
  }

  @Test
  void shouldStayWithinCallBudgetWhenFinalAnalysisAlsoFails() {
    model.script(r -> {
      throw new IllegalStateException("down");
    });

    FixFinderResult result = run(false);

    assertThat(model.calls()).isEqualTo(2);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.ERROR);
    assertThat(result.getEnhancedFixes()).isEmpty();
  }

  @Test
  void shouldUseToolComparisonWhenPayloadHasNone() {
    stubComparisonSearch();
    model.script(
      r -> toolCall(CompareProductsTool.NAME, "{\"requirement_area\": \"dti\"}"),
      r -> text("Done."),
      r -> text("{\"enhanced_fixes\": []}"));

    FixFinderResult result = run(false);

    assertThat(result.getProductComparison())
      .containsEntry("homeready", "HomeReady allows DTI up to 50%")
      .containsEntry("home_possible", "Home Possible allows DTI up to 45%");
  }

  @Test
  void shouldPreferPayloadComparisonOverToolComparison() {
    stubComparisonSearch();
    model.script(
      r -> toolCall(CompareProductsTool.NAME, "{\"requirement_area\": \"dti\"}"),
      r -> text("Done."),
      r -> text(FINAL_JSON));

    FixFinderResult result = run(false);

    assertThat(result.getProductComparison()).containsOnly(entry("homeready", "eligible"));
  }

  private void stubComparisonSearch() {
    when(retrievalCoordinator.search(anyString(), eq(Gse.FANNIE_MAE), anyInt())).thenReturn(
      List.of(GuideExcerpt.builder().id("fm-1").gse("fannie_mae")
        .text("HomeReady allows DTI up to 50%").score(0.8).build()));
    when(retrievalCoordinator.search(anyString(), eq(Gse.FREDDIE_MAC), anyInt())).thenReturn(
      List.of(GuideExcerpt.builder().id("fr-1").gse("freddie_mac")
        .text("Home Possible allows DTI up to 45%").score(0.8).build()));
  }

  @Test
  void shouldFoldUnknownToolIntoToolResult() {
    model.script(
      r -> toolCall("does_not_exist", "{}"),
      r -> text("Moving on."),
      r -> text(FINAL_JSON));

    FixFinderResult result = run(true);

    assertThat(model.calls()).isEqualTo(3);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
    assertThat(result.getReactTrace().get(0).getToolCalls()).singleElement().satisfies(call -> {
      assertThat(call.isSuccess()).isFalse();
      assertThat(call.getResultSummary()).isEqualTo("Tool not found: does_not_exist");
    });
  }

  @Test
  void shouldRethrowUnavailableModelAfterRecordingUsage() {
    model.script(r -> {
      throw new ReasoningUnavailableException("no chat model");
    });

    assertThatThrownBy(() -> run(false)).isInstanceOf(ReasoningUnavailableException.class);

    verify(usageTracker, times(1)).recordUsage(eq("fix_finder"), anyString(), anyString(),
      eq("fix_finding"), anyLong(), anyLong(), anyLong(), eq(false), eq("no chat model"));
  }

  @Test
  void shouldTellModelWhenGuideExcerptsAreUnavailable() {
    lenient().when(retrievalCoordinator.retrieveForScenario(any()))
      .thenThrow(new IllegalStateException("store down"));
    model.script(r -> text("ok"), r -> text("{}"));

    FixFinderResult result = run(false);

    String firstPrompt = model.requests().get(0).getMessages().get(0).getText();
    assertThat(firstPrompt).contains("GUIDE EXCERPTS: unavailable");
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.COMPLETED);
    assertThat(result.getEnhancedFixes()).isEmpty();
  }

  @Test
  void shouldRespectZeroIterationCap() {
    properties.setMaxIterations(0);
    model.script(r -> text(FINAL_JSON));

    FixFinderResult result = run(false);

    assertThat(model.calls()).isEqualTo(1);
    assertThat(result.getTerminationReason()).isEqualTo(TerminationReason.MAX_ITERATIONS);
    assertThat(result.getTotalIterations()).isZero();
    verify(usageTracker, times(1)).recordUsage(anyString(), anyString(), anyString(),
      anyString(), anyLong(), anyLong(), anyLong(), eq(true), isNull());
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * 按顺序回放预设响应，最后一个响应重复使用
   */
  private static class ScriptedModel implements ReasoningModel {

    private final List<Function<ReasoningRequest, ReasoningResponse>> script = new ArrayList<>();
    private final List<ReasoningRequest> requests = new ArrayList<>();

    @SafeVarargs
    final void script(Function<ReasoningRequest, ReasoningResponse>... steps) {
      script.addAll(List.of(steps));
    }

    @Override
    public synchronized ReasoningResponse call(ReasoningRequest request) {
      requests.add(request);
      int index = Math.min(requests.size(), script.size()) - 1;
      return script.get(index).apply(request);
    }

    synchronized int calls() {
      return requests.size();
    }

    synchronized List<ReasoningRequest> requests() {
      return new ArrayList<>(requests);
    }

    @Override
    public String modelName() {
      return "scripted";
    }

    @Override
    public String provider() {
      return "test";
    }
  }
}
