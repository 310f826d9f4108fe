package com.github.spud.sage.domain.rag;

import com.github.spud.sage.domain.loan.Gse;
import lombok.Builder;
import lombok.Value;

/**
 * 检索得到的指南片段，引用（{@link GuideCitation}）由它派生
 */
@Value
@Builder
public class GuideExcerpt {

  /**
   * Chunk identity in the vector store, used for deduplication
   */
  String id;

  /**
   * Rule category that issued the query, null for free-form searches
   */
  RuleCategory category;

  String query;

  String gse;

  String sectionId;

  String title;

  String text;

  double score;

  public GuideCitation toCitation(int snippetLength) {
    String body = text == null ? "" : text;
    return GuideCitation.builder()
      .sectionId(sectionId != null && !sectionId.isBlank() ? sectionId : id)
      .gse(gse)
      .snippet(body.length() > snippetLength ? body.substring(0, snippetLength) : body)
      .relevanceScore(score)
      .build();
  }

  public String gseLabel() {
    return Gse.fromTag(gse).map(Gse::label).orElse("Freddie Mac");
  }
}
