package com.github.spud.sage.domain.usage;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * 一次 LLM 调用（或一次完整 findFixes 操作）的用量记录
 */
@Value
@Builder
public class UsageRecord {

  String serviceName;

  String modelName;

  String modelProvider;

  String requestType;

  long tokensInput;

  long tokensOutput;

  long durationMs;

  boolean success;

  String errorMessage;

  /**
   * USD, rounded to 6 places
   */
  double costUsd;

  @Builder.Default
  Instant recordedAt = Instant.now();

  public long tokensTotal() {
    return tokensInput + tokensOutput;
  }
}
