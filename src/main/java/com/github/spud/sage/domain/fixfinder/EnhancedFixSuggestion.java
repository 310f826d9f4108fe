package com.github.spud.sage.domain.fixfinder;

import com.github.spud.sage.domain.loan.Difficulty;
import com.github.spud.sage.domain.rag.GuideCitation;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class EnhancedFixSuggestion {

  String description;

  String impact;

  Difficulty difficulty;

  /**
   * Always within [0,1]
   */
  double confidence;

  /**
   * Always at least 1
   */
  int priorityOrder;

  String estimatedTimeline;

  @Singular("unlocksProduct")
  List<String> unlocksProducts;

  @Singular
  List<GuideCitation> citations;

  @Singular
  List<String> tradeOffs;
}
