package com.github.spud.sage.domain.loan;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * 贷款产品所属的 GSE
 */
public enum Gse {

  FANNIE_MAE("fannie_mae", "Fannie Mae"),

  FREDDIE_MAC("freddie_mac", "Freddie Mac");

  private final String tag;
  private final String label;

  Gse(String tag, String label) {
    this.tag = tag;
    this.label = label;
  }

  /**
   * Metadata tag stored with every guide chunk, e.g. {@code fannie_mae}
   */
  @JsonValue
  public String tag() {
    return tag;
  }

  public String label() {
    return label;
  }

  /**
   * Resolve a tag; {@code both}, blanks and unknown values resolve to empty
   */
  public static Optional<Gse> fromTag(String tag) {
    if (tag == null || tag.isBlank()) {
      return Optional.empty();
    }
    for (Gse gse : values()) {
      if (gse.tag.equalsIgnoreCase(tag.trim())) {
        return Optional.of(gse);
      }
    }
    return Optional.empty();
  }
}
