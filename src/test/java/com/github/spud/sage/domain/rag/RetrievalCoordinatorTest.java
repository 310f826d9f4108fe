package com.github.spud.sage.domain.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.loan.LoanScenario;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

/**
 * RetrievalCoordinator 单元测试：查询构建 / 并发合并 / 失败降级
 */
@ExtendWith(MockitoExtension.class)
class RetrievalCoordinatorTest {

  @Mock
  private VectorStore vectorStore;

  private RetrievalProperties properties;
  private RetrievalCoordinator coordinator;

  private final LoanScenario scenario = LoanScenario.builder()
    .creditScore(700)
    .annualIncome(90_000)
    .loanAmount(300_000)
    .propertyValue(320_000)
    .propertyType("condo")
    .build();

  @BeforeEach
  void setUp() {
    properties = new RetrievalProperties();
    coordinator = new RetrievalCoordinator(vectorStore, new RetrievalCache(false, 1), properties);
  }

  private static Document doc(String id, String gse, double score) {
    return Document.builder()
      .id(id)
      .text("Guide text for " + id)
      .metadata(Map.of("gse", gse, "section", "S-" + id, "title", "Title " + id))
      .score(score)
      .build();
  }

  @Test
  void shouldBuildTwelveQueriesInCategoryOrder() {
    List<RetrievalQuery> queries = coordinator.buildQueries(scenario);

    assertThat(queries).hasSize(12);
    assertThat(queries.get(0).category()).isEqualTo(RuleCategory.CREDIT_SCORE);
    assertThat(queries.get(0).gse()).isEqualTo(Gse.FANNIE_MAE);
    assertThat(queries.get(1).gse()).isEqualTo(Gse.FREDDIE_MAC);
    assertThat(queries.get(2).query())
      .isEqualTo("HomeReady maximum LTV loan-to-value ratio requirements condo");
    assertThat(queries.get(11).category()).isEqualTo(RuleCategory.INCOME_LIMIT);
  }

  @Test
  void shouldDeduplicateSortAndCap() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenAnswer(invocation -> {
      SearchRequest request = invocation.getArgument(0);
      String id = Integer.toHexString(request.getQuery().hashCode());
      return List.of(doc("shared", "fannie_mae", 0.5), doc(id, "freddie_mac", 0.6));
    });

    RetrievalResult result = coordinator.retrieveForScenario(scenario);

    assertThat(result.getQueriesIssued()).isEqualTo(12);
    assertThat(result.getQueriesFailed()).isZero();
    assertThat(result.getExcerpts()).hasSize(properties.getMaxResults());
    assertThat(result.getExcerpts()).extracting(GuideExcerpt::getId).doesNotHaveDuplicates();
    assertThat(result.getExcerpts()).extracting(GuideExcerpt::getScore)
      .isSortedAccordingTo((a, b) -> Double.compare(b, a));
    assertThat(result.getExcerpts()).extracting(GuideExcerpt::getId).doesNotContain("shared");
  }

  @Test
  void shouldTreatFailedQueriesAsEmpty() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenAnswer(invocation -> {
      SearchRequest request = invocation.getArgument(0);
      if (request.getQuery().contains("DTI")) {
        throw new IllegalStateException("connection reset");
      }
      return List.of(doc(Integer.toHexString(request.getQuery().hashCode()), "fannie_mae", 0.8));
    });

    RetrievalResult result = coordinator.retrieveForScenario(scenario);

    assertThat(result.getQueriesFailed()).isEqualTo(2);
    assertThat(result.getExcerpts()).hasSize(10);
    assertThat(result.isDataUnavailable()).isFalse();
  }

  @Test
  void shouldReportUnavailableWhenEveryQueryFails() {
    when(vectorStore.similaritySearch(any(SearchRequest.class)))
      .thenThrow(new IllegalStateException("store down"));

    RetrievalResult result = coordinator.retrieveForScenario(scenario);

    assertThat(result.getQueriesFailed()).isEqualTo(12);
    assertThat(result.isDataUnavailable()).isTrue();
    assertThat(result.citations(100)).isEmpty();
  }

  @Test
  void shouldFilterByGseOnlyWhenRequested() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());
    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);

    coordinator.search("reserves", Gse.FREDDIE_MAC, 4);
    coordinator.search("reserves", null, 4);

    verify(vectorStore, times(2)).similaritySearch(captor.capture());
    assertThat(captor.getAllValues().get(0).getFilterExpression()).isNotNull();
    assertThat(captor.getAllValues().get(0).getTopK()).isEqualTo(4);
    assertThat(captor.getAllValues().get(1).getFilterExpression()).isNull();
  }

  @Test
  void shouldPropagateDirectSearchFailures() {
    when(vectorStore.similaritySearch(any(SearchRequest.class)))
      .thenThrow(new IllegalStateException("store down"));

    assertThatThrownBy(() -> coordinator.search("reserves", Gse.FANNIE_MAE, 4))
      .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldServeRepeatedQueriesFromCache() {
    coordinator = new RetrievalCoordinator(vectorStore, new RetrievalCache(true, 64), properties);
    when(vectorStore.similaritySearch(any(SearchRequest.class)))
      .thenReturn(List.of(doc("a", "fannie_mae", 0.9)));

    coordinator.retrieveForScenario(scenario);
    RetrievalResult second = coordinator.retrieveForScenario(scenario);

    verify(vectorStore, times(12)).similaritySearch(any(SearchRequest.class));
    assertThat(second.getExcerpts()).singleElement()
      .extracting(GuideExcerpt::getSectionId).isEqualTo("S-a");
  }

  @Test
  void shouldFallBackToDocumentFieldsWhenMetadataMissing() {
    Document bare = Document.builder().id("chunk-9").text("Body").metadata(Map.of()).build();

    GuideExcerpt excerpt = RetrievalCoordinator.toExcerpt(bare, null, "q", Gse.FREDDIE_MAC);

    assertThat(excerpt.getText()).isEqualTo("Body");
    assertThat(excerpt.getGse()).isEqualTo("freddie_mac");
    assertThat(excerpt.getSectionId()).isEqualTo("chunk-9");
    assertThat(excerpt.getScore()).isZero();
  }
}
