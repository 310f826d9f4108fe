package com.github.spud.sage.domain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sage.domain.fixfinder.FixFinderContext;
import com.github.spud.sage.domain.loan.Gse;
import com.github.spud.sage.domain.rag.GuideExcerpt;
import com.github.spud.sage.domain.rag.RetrievalCoordinator;
import com.github.spud.sage.domain.rag.RetrievalProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * query_guides：检索 GSE 指南中的补偿因素、例外与替代要求
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryGuidesTool implements FixFinderTool {

  public static final String NAME = "query_guides";

  static final String NO_RESULTS = "No relevant sections found.";

  private static final ToolDefinition DEFINITION = DefaultToolDefinition.builder()
    .name(NAME)
    .description("Search the GSE guides for information about compensating factors, exceptions, "
      + "or alternative requirements that could help resolve a loan eligibility violation. Use "
      + "this to find official guidance on how to work around specific rule failures.")
    .inputSchema("""
      {
          "type": "object",
          "properties": {
              "query": {
                  "type": "string",
                  "description": "The search query to find relevant guide sections. Be specific about the violation type and what compensating factors or exceptions you're looking for."
              },
              "gse_filter": {
                  "type": "string",
                  "enum": ["fannie_mae", "freddie_mac", "both"],
                  "description": "Which GSE's guides to search. Use 'fannie_mae' for HomeReady, 'freddie_mac' for Home Possible, or 'both' for general guidance."
              },
              "focus_area": {
                  "type": "string",
                  "enum": ["compensating_factors", "exceptions", "alternative_requirements", "general"],
                  "description": "What aspect to focus the search on."
              }
          },
          "required": ["query", "gse_filter"]
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
    String query = arguments.path("query").asText("");
    Gse gse = Gse.fromTag(arguments.path("gse_filter").asText("both")).orElse(null);
    String focusArea = arguments.path("focus_area").asText("general");

    String effectiveQuery = withFocus(query, focusArea);
    log.debug("query_guides: query='{}', gse={}, focus={}", effectiveQuery, gse, focusArea);

    List<GuideExcerpt> excerpts = retrievalCoordinator.search(effectiveQuery, gse,
      properties.getQueryGuidesTopK());

    ToolOutcome.ToolOutcomeBuilder outcome = ToolOutcome.builder();
    List<String> parts = new ArrayList<>();
    for (GuideExcerpt excerpt : excerpts) {
      var citation = excerpt.toCitation(properties.getSnippetLength());
      outcome.citation(citation);
      parts.add("[" + excerpt.gseLabel() + " " + citation.getSectionId() + "] "
        + (excerpt.getTitle() == null ? "" : excerpt.getTitle()) + "\n" + citation.getSnippet());
    }
    return outcome
      .summary(parts.isEmpty() ? NO_RESULTS : String.join("\n---\n", parts))
      .build();
  }

  static String withFocus(String query, String focusArea) {
    if (focusArea == null || focusArea.isBlank() || "general".equalsIgnoreCase(focusArea)) {
      return query;
    }
    return query + " " + focusArea.replace('_', ' ');
  }
}
