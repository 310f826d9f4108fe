package com.github.spud.sage.domain.reasoning;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.ai.chat.messages.AssistantMessage;

/**
 * 模型返回：文本、工具调用请求、结束原因与 token 统计
 */
@Value
@Builder
public class ReasoningResponse {

  private static final Set<String> COMPLETION_REASONS = Set.of("stop", "end_turn");

  @Builder.Default
  String text = "";

  @Singular
  List<AssistantMessage.ToolCall> toolCalls;

  String finishReason;

  Integer promptTokens;

  Integer completionTokens;

  /**
   * Assistant turn to append to the conversation
   */
  AssistantMessage message;

  public boolean hasToolCalls() {
    return !toolCalls.isEmpty();
  }

  public boolean signalsCompletion() {
    return finishReason != null
      && COMPLETION_REASONS.contains(finishReason.toLowerCase(Locale.ROOT));
  }

  public AssistantMessage assistantMessage() {
    if (message != null) {
      return message;
    }
    return new AssistantMessage(text == null ? "" : text, Map.of(), toolCalls);
  }
}
