package com.github.spud.sage.domain.reasoning;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.tool.ToolCallback;

/**
 * 一次模型调用的输入；tools 仅暴露定义，不在模型内部执行
 */
@Value
@Builder
public class ReasoningRequest {

  String systemPrompt;

  @Singular
  List<Message> messages;

  @Singular
  List<ToolCallback> tools;

  int maxTokens;
}
