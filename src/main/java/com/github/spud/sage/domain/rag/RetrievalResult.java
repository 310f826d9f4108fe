package com.github.spud.sage.domain.rag;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 场景检索的合并结果：已去重、按分数降序、截断
 */
@Value
@Builder
public class RetrievalResult {

  @Singular
  List<GuideExcerpt> excerpts;

  int queriesIssued;

  int queriesFailed;

  long durationMs;

  /**
   * Nothing came back; the caller picks its own fallback
   */
  public boolean isDataUnavailable() {
    return excerpts.isEmpty();
  }

  public List<GuideCitation> citations(int snippetLength) {
    return excerpts.stream()
      .map(e -> e.toCitation(snippetLength))
      .collect(Collectors.toList());
  }
}
