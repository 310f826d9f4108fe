package com.github.spud.sage.domain.fixfinder;

import com.github.spud.sage.domain.rag.GuideCitation;
import com.github.spud.sage.domain.simulation.SimulationResult;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Fix Finder 的最终产物
 */
@Value
@Builder(toBuilder = true)
public class FixFinderResult {

  public static final String FAILED_PATH = "Analysis failed. Please review basic fix suggestions.";

  @Singular
  List<EnhancedFixSuggestion> enhancedFixes;

  @Singular
  List<FixSequence> fixSequences;

  @Singular
  List<SimulationResult> simulations;

  @Builder.Default
  String recommendedPath = "";

  @Singular("comparisonEntry")
  Map<String, String> productComparison;

  /**
   * Empty unless demo mode was requested
   */
  @Singular("reactStep")
  List<ReactStep> reactTrace;

  int totalIterations;

  long totalTimeMs;

  long tokensUsed;

  TerminationReason terminationReason;

  @Singular
  List<GuideCitation> citations;

  public static FixFinderResult failed(long totalTimeMs) {
    return FixFinderResult.builder()
      .recommendedPath(FAILED_PATH)
      .totalTimeMs(totalTimeMs)
      .terminationReason(TerminationReason.ERROR)
      .build();
  }
}
