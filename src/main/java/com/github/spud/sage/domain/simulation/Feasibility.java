package com.github.spud.sage.domain.simulation;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 模拟变更的可行性分档，按覆盖值绝对值之和划分
 */
public enum Feasibility {
  EASY(5_000),
  MODERATE(20_000),
  HARD(50_000),
  VERY_HARD(Double.POSITIVE_INFINITY);

  private final double upperBound;

  Feasibility(double upperBound) {
    this.upperBound = upperBound;
  }

  public static Feasibility classify(double totalChangeMagnitude) {
    for (Feasibility feasibility : values()) {
      if (totalChangeMagnitude < feasibility.upperBound) {
        return feasibility;
      }
    }
    return VERY_HARD;
  }

  @JsonValue
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
