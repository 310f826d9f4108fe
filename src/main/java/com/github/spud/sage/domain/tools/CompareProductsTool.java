package com.github.spud.sage.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.fixfinder.FixFinderContext;
import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.rag.GuideExcerpt;
import com.github.spud.sage.domain.rag.RetrievalCoordinator;
import com.github.spud.sage.domain.rag.RetrievalProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;

/**
 * compare_products：按要求领域分别检索两个 GSE，各取最相关的一条
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompareProductsTool implements FixFinderTool {

  public static final String NAME = "compare_products";

  static final String HOME_READY_KEY = "homeready";
  static final String HOME_POSSIBLE_KEY = "home_possible";
  static final String NO_RESULTS = "No comparison data found.";

  private static final int COMPARISON_TEXT_LIMIT = 400;

  private static final ToolDefinition DEFINITION = DefaultToolDefinition.builder()
    .name(NAME)
    .description("Compare the requirements between HomeReady (Fannie Mae) and Home Possible "
      + "(Freddie Mac) for a specific rule or requirement area. Use this to identify which "
      + "product might be easier to qualify for given specific violations.")
    .inputSchema("""
      {
          "type": "object",
          "properties": {
              "requirement_area": {
                  "type": "string",
                  "enum": ["credit_score", "ltv", "dti", "income_limits", "property_type", "occupancy", "reserves"],
                  "description": "Which requirement area to compare between the two products."
              }
          },
          "required": ["requirement_area"]
      }
      """)
    .build();

  private final RetrievalCoordinator retrievalCoordinator;
  private final RetrievalProperties properties;

  @Override
  public ToolDefinition definition() {
    return DEFINITION;
  }

  @Override
  public ToolOutcome execute(JsonNode arguments, FixFinderContext ctx) {
    String area = arguments.path("requirement_area").asText("");
    String query = area + " requirements eligibility HomeReady Home Possible comparison";
    int topK = properties.getCompareTopK();

    Tuple2<List<GuideExcerpt>, List<GuideExcerpt>> results = Mono.zip(
        searchAsync(query, Gse.FANNIE_MAE, topK),
        searchAsync(query, Gse.FREDDIE_MAC, topK))
      .block();

    ToolOutcome.ToolOutcomeBuilder outcome = ToolOutcome.builder();
    List<String> parts = new ArrayList<>();
    if (results != null) {
      topText(results.getT1()).ifPresent(text -> {
        outcome.comparisonEntry(HOME_READY_KEY, text);
        parts.add("HomeReady (" + area + "):\n" + text);
      });
      topText(results.getT2()).ifPresent(text -> {
        outcome.comparisonEntry(HOME_POSSIBLE_KEY, text);
        parts.add("Home Possible (" + area + "):\n" + text);
      });
    }
    return outcome
      .summary(parts.isEmpty() ? NO_RESULTS : String.join("\n\n", parts))
      .build();
  }

  private Mono<List<GuideExcerpt>> searchAsync(String query, Gse gse, int topK) {
    return Mono.fromCallable(() -> retrievalCoordinator.search(query, gse, topK))
      .subscribeOn(Schedulers.boundedElastic());
  }

  private static Optional<String> topText(List<GuideExcerpt> excerpts) {
    if (excerpts == null || excerpts.isEmpty()) {
      return Optional.empty();
    }
    String text = excerpts.get(0).getText() == null ? "" : excerpts.get(0).getText();
    return Optional.of(text.length() > COMPARISON_TEXT_LIMIT
      ? text.substring(0, COMPARISON_TEXT_LIMIT) : text);
  }
}
