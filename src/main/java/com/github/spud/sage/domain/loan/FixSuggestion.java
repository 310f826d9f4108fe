package com.github.spud.sage.domain.loan;

import lombok.Value;

/**
 * 规则引擎生成的量化修复建议
 */
@Value
public class FixSuggestion {

  String description;

  String impact;

  Difficulty difficulty;
}
