package com.github.spud.sage.domain.fixfinder;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * 修复路径的总投入
 */
public enum Effort {
  LOW,
  MEDIUM,
  HIGH,
  VERY_HIGH;

  @JsonValue
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Effort> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    for (Effort effort : values()) {
      if (effort.tag().equalsIgnoreCase(tag.trim())) {
        return Optional.of(effort);
      }
    }
    return Optional.empty();
  }
}
