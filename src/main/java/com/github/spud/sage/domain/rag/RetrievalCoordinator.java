package com.github.spud.sage.domain.rag;

import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.loan.LoanScenario;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 指南检索协调器
 * <p>
 * 按规则类别 × 产品生成查询，并发检索（按 GSE 过滤），单条失败视为空结果；合并后按 chunk id 去重（先到先得）、 按分数降序、截断
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetrievalCoordinator {

  static final String GSE_METADATA_KEY = "gse";

  private final VectorStore vectorStore;
  private final RetrievalCache retrievalCache;
  private final RetrievalProperties properties;

  /**
   * 构建场景的完整查询列表（类别顺序 × HomeReady/Home Possible）
   */
  public List<RetrievalQuery> buildQueries(LoanScenario scenario) {
    String propertyTypeLabel = scenario.propertyTypeLabel();
    List<RetrievalQuery> queries = new ArrayList<>();
    for (RuleCategory category : RuleCategory.values()) {
      for (Gse gse : Gse.values()) {
        queries.add(new RetrievalQuery(category, category.queryFor(gse, propertyTypeLabel), gse));
      }
    }
    return queries;
  }

  /**
   * 并发执行场景的全部查询，不在内部重试
   */
  public RetrievalResult retrieveForScenario(LoanScenario scenario) {
    long startTime = System.currentTimeMillis();
    List<RetrievalQuery> queries = buildQueries(scenario);
    AtomicInteger failures = new AtomicInteger();
    int topK = properties.getTopKPerQuery();

    List<List<GuideExcerpt>> perQuery = Flux.fromIterable(queries)
      .flatMapSequential(q -> Mono.fromCallable(() -> runQuery(q, topK))
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorResume(e -> {
          failures.incrementAndGet();
          log.warn("Guide query failed for {}/{}: {}", q.category().tag(), q.gse().tag(),
            e.getMessage());
          return Mono.just(List.of());
        }), Math.max(properties.getMaxConcurrency(), 1))
      .collectList()
      .block();

    Map<String, GuideExcerpt> unique = new LinkedHashMap<>();
    if (perQuery != null) {
      perQuery.forEach(list -> list.forEach(e -> unique.putIfAbsent(e.getId(), e)));
    }

    List<GuideExcerpt> ranked = unique.values().stream()
      .sorted(Comparator.comparingDouble(GuideExcerpt::getScore).reversed())
      .limit(properties.getMaxResults())
      .collect(Collectors.toList());

    long duration = System.currentTimeMillis() - startTime;
    log.info("Scenario retrieval finished: queries={}, failed={}, unique={}, kept={}, {}ms",
      queries.size(), failures.get(), unique.size(), ranked.size(), duration);

    return RetrievalResult.builder()
      .excerpts(ranked)
      .queriesIssued(queries.size())
      .queriesFailed(failures.get())
      .durationMs(duration)
      .build();
  }

  /**
   * 单次检索；gse 为 null 时不做过滤。失败直接抛出，由调用方决定降级方式
   */
  public List<GuideExcerpt> search(String query, Gse gse, int topK) {
    return search(null, query, gse, topK);
  }

  private List<GuideExcerpt> runQuery(RetrievalQuery q, int topK) {
    return search(q.category(), q.query(), q.gse(), topK);
  }

  private List<GuideExcerpt> search(RuleCategory category, String query, Gse gse, int topK) {
    String filter = gse != null ? GSE_METADATA_KEY + " == '" + gse.tag() + "'" : null;

    var cached = retrievalCache.get(query, topK, filter);
    if (cached.isPresent()) {
      return cached.get();
    }

    SearchRequest.Builder request = SearchRequest.builder()
      .query(query)
      .topK(topK);
    if (filter != null) {
      request.filterExpression(filter);
    }

    log.debug("Guide search: query='{}', topK={}, filter={}", query, topK, filter);
    List<Document> documents = vectorStore.similaritySearch(request.build());

    List<GuideExcerpt> excerpts = documents == null ? List.of() : documents.stream()
      .map(doc -> toExcerpt(doc, category, query, gse))
      .collect(Collectors.toList());

    retrievalCache.put(query, topK, filter, excerpts);
    return excerpts;
  }

  static GuideExcerpt toExcerpt(Document doc, RuleCategory category, String query, Gse gse) {
    Map<String, Object> metadata = doc.getMetadata();
    String text = stringValue(metadata.get("text"));
    if (text.isEmpty() && doc.getText() != null) {
      text = doc.getText();
    }
    String docGse = stringValue(metadata.get(GSE_METADATA_KEY));
    if (docGse.isEmpty()) {
      docGse = gse != null ? gse.tag() : "unknown";
    }
    String section = stringValue(metadata.get("section"));

    return GuideExcerpt.builder()
      .id(doc.getId())
      .category(category)
      .query(query)
      .gse(docGse)
      .sectionId(section.isEmpty() ? doc.getId() : section)
      .title(stringValue(metadata.get("title")))
      .text(text)
      .score(doc.getScore() != null ? doc.getScore() : 0.0)
      .build();
  }

  private static String stringValue(Object value) {
    return value == null ? "" : value.toString();
  }
}
