package com.github.spud.sage.domain.rag;

import lombok.Builder;
import lombok.Value;

/**
 * GSE 指南引用，relevanceScore 始终位于 [0,1]
 */
@Value
public class GuideCitation {

  String sectionId;

  String gse;

  String snippet;

  double relevanceScore;

  @Builder
  private GuideCitation(String sectionId, String gse, String snippet, double relevanceScore) {
    this.sectionId = sectionId != null ? sectionId : "";
    this.gse = gse != null ? gse : "";
    this.snippet = snippet != null ? snippet : "";
    this.relevanceScore = clamp(relevanceScore);
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.min(Math.max(score, 0.0), 1.0);
  }
}
