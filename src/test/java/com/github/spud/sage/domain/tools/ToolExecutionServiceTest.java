package com.github.spud.sage.domain.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sage.domain.fixfinder.FixFinderContext;
import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.loan.LoanScenario;
import com.github.spud.sage.domain.rag.GuideExcerpt;
import com.github.spud.sage.domain.rag.RetrievalCoordinator;
import com.github.spud.sage.domain.rag.RetrievalProperties;
import com.github.spud.sage.domain.rules.RulesEngine;
import com.github.spud.sage.domain.rules.RulesProperties;
import com.github.spud.sage.domain.simulation.ScenarioSimulator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.tool.ToolCallback;

/**
 * 工具分发与执行测试：失败折叠进工具结果，不向外抛出
 */
@ExtendWith(MockitoExtension.class)
class ToolExecutionServiceTest {

  @Mock
  private RetrievalCoordinator retrievalCoordinator;

  private ToolRegistry registry;
  private ToolExecutionService service;
  private FixFinderContext ctx;

  @BeforeEach
  void setUp() {
    RetrievalProperties properties = new RetrievalProperties();
    registry = new ToolRegistry(List.of(
      new QueryGuidesTool(retrievalCoordinator, properties),
      new SimulateScenarioTool(new ScenarioSimulator(new RulesEngine(new RulesProperties()))),
      new CompareProductsTool(retrievalCoordinator, properties)));
    service = new ToolExecutionService(registry);

    ctx = FixFinderContext.builder()
      .scenario(LoanScenario.builder()
        .creditScore(640)
        .annualIncome(85_000)
        .loanAmount(350_000)
        .propertyValue(400_000)
        .monthlyDebtPayments(400)
        .build())
      .build();
  }

  private static GuideExcerpt excerpt(String section, String gse, String text) {
    return GuideExcerpt.builder().id(section).sectionId(section).gse(gse).title("Title")
      .text(text).score(0.7).build();
  }

  @Test
  void shouldExposeOneNoOpCallbackPerTool() {
    List<ToolCallback> callbacks = registry.getNoOpCallbacks();

    assertThat(callbacks).extracting(c -> c.getToolDefinition().name())
      .containsExactly("query_guides", "simulate_scenario", "compare_products");
    assertThat(callbacks.get(0).call("{}")).isEqualTo("[PENDING_EXECUTION]");
  }

  @Test
  void shouldRejectDuplicateToolNames() {
    QueryGuidesTool tool = new QueryGuidesTool(retrievalCoordinator, new RetrievalProperties());

    assertThatThrownBy(() -> new ToolRegistry(List.of(tool, tool)))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("query_guides");
  }

  @Test
  void shouldQueryGuidesWithFocusAndCollectCitations() {
    when(retrievalCoordinator.search(eq("reserve requirements compensating factors"),
      isNull(), eq(4)))
      .thenReturn(List.of(excerpt("B3-4.1-01", "fannie_mae", "Reserves may offset DTI")));

    ToolExecutionService.ToolExecutionResult result = service.execute(QueryGuidesTool.NAME,
      "{\"query\": \"reserve requirements\", \"gse_filter\": \"both\", "
        + "\"focus_area\": \"compensating_factors\"}", ctx);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.summary()).startsWith("[Fannie Mae B3-4.1-01] Title")
      .contains("Reserves may offset DTI");
    assertThat(result.getOutcome().getCitations()).singleElement()
      .satisfies(c -> assertThat(c.getSectionId()).isEqualTo("B3-4.1-01"));
    assertThat(result.getArguments()).containsEntry("gse_filter", "both");
  }

  @Test
  void shouldReportNoResults() {
    when(retrievalCoordinator.search(anyString(), eq(Gse.FREDDIE_MAC), anyInt()))
      .thenReturn(List.of());

    ToolExecutionService.ToolExecutionResult result = service.execute(QueryGuidesTool.NAME,
      "{\"query\": \"gift funds\", \"gse_filter\": \"freddie_mac\"}", ctx);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.summary()).isEqualTo(QueryGuidesTool.NO_RESULTS);
  }

  @Test
  void shouldFoldRetrievalFailureIntoResult() {
    when(retrievalCoordinator.search(anyString(), isNull(), anyInt()))
      .thenThrow(new IllegalStateException("store down"));

    ToolExecutionService.ToolExecutionResult result = service.execute(QueryGuidesTool.NAME,
      "{\"query\": \"reserves\"}", ctx);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.summary()).isEqualTo("query_guides failed: store down");
    assertThat(result.getError()).isEqualTo(result.summary());
  }

  @Test
  void shouldReportUnknownTool() {
    ToolExecutionService.ToolExecutionResult result = service.execute("launch_rocket", "{}", ctx);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.summary()).isEqualTo("Tool not found: launch_rocket");
  }

  @Test
  void shouldFoldMalformedArguments() {
    ToolExecutionService.ToolExecutionResult result = service.execute(
      SimulateScenarioTool.NAME, "{changes: ", ctx);

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.summary()).startsWith("simulate_scenario failed:");
    assertThat(result.getArguments()).isEmpty();
  }

  @Test
  void shouldSimulateWithNumericStrings() {
    ToolExecutionService.ToolExecutionResult result = service.execute(SimulateScenarioTool.NAME,
      "{\"changes\": {\"credit_score\": \"665\", \"monthly_debt_payments\": \"n/a\"}, "
        + "\"description\": \"Raise score\"}", ctx);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getOutcome().getSimulation()).isNotNull();
    assertThat(result.getOutcome().getSimulation().getParameterChanges())
      .containsOnlyKeys("credit_score");
    assertThat(result.summary()).contains("Home Possible: Eligible");
    assertThat(ctx.getScenario().getCreditScore()).isEqualTo(640);
  }

  @Test
  void shouldCompareBothProducts() {
    String query = "dti requirements eligibility HomeReady Home Possible comparison";
    when(retrievalCoordinator.search(query, Gse.FANNIE_MAE, 2))
      .thenReturn(List.of(excerpt("B5-6-02", "fannie_mae", "HomeReady allows 50% DTI")));
    when(retrievalCoordinator.search(query, Gse.FREDDIE_MAC, 2))
      .thenReturn(List.of());

    ToolExecutionService.ToolExecutionResult result = service.execute(CompareProductsTool.NAME,
      "{\"requirement_area\": \"dti\"}", ctx);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getOutcome().getComparison())
      .containsOnlyKeys("homeready")
      .containsEntry("homeready", "HomeReady allows 50% DTI");
    assertThat(result.summary()).startsWith("HomeReady (dti):");
    verify(retrievalCoordinator).search(query, Gse.FREDDIE_MAC, 2);
  }
}
