package com.github.spud.sage.domain.simulation;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What-if 模拟结果
 */
@Value
@Builder
public class SimulationResult {

  String description;

  /**
   * Override name to formatted new value
   */
  @Singular
  Map<String, String> parameterChanges;

  boolean homeReadyEligible;

  boolean homePossibleEligible;

  @Singular
  List<String> homeReadyViolations;

  @Singular
  List<String> homePossibleViolations;

  /**
   * Rules violated by the unmodified scenario that no longer fail
   */
  @Singular("violationResolved")
  List<String> violationsResolved;

  @Singular
  List<String> remainingViolations;

  double modifiedLtv;

  double modifiedDti;

  Feasibility feasibility;
}
