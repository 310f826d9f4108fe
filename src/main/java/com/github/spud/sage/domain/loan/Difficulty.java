package com.github.spud.sage.domain.loan;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * 修复难度，声明顺序即排序顺序（easy &lt; moderate &lt; hard）
 */
public enum Difficulty {
  EASY,
  MODERATE,
  HARD;

  @JsonValue
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Difficulty> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    for (Difficulty d : values()) {
      if (d.tag().equalsIgnoreCase(tag.trim())) {
        return Optional.of(d);
      }
    }
    return Optional.empty();
  }
}
