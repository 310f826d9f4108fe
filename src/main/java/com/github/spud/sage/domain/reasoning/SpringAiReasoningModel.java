package com.github.spud.sage.domain.reasoning;

import com.github.spud.sage.domain.fixfinder.FixFinderProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 基于 Spring AI {@link ChatModel} 的推理模型
 * <p>
 * 工具只暴露定义（internalToolExecutionEnabled=false），由编排器自行执行；ChatModel 在首次调用时解析， 未配置时抛出
 * {@link ReasoningUnavailableException}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringAiReasoningModel implements ReasoningModel {

  private final ObjectProvider<ChatModel> chatModelProvider;
  private final FixFinderProperties properties;

  @Override
  public ReasoningResponse call(ReasoningRequest request) {
    ChatModel chatModel = chatModelProvider.getIfAvailable();
    if (chatModel == null) {
      throw new ReasoningUnavailableException(
        "No chat model configured for provider '" + properties.getModelProvider() + "'");
    }

    List<Message> promptMessages = new ArrayList<>();
    if (StringUtils.hasText(request.getSystemPrompt())) {
      promptMessages.add(new SystemMessage(request.getSystemPrompt()));
    }
    promptMessages.addAll(request.getMessages());

    ToolCallingChatOptions.Builder options = ToolCallingChatOptions.builder()
      .toolCallbacks(request.getTools())
      .internalToolExecutionEnabled(false)
      .maxTokens(request.getMaxTokens());
    if (StringUtils.hasText(properties.getModelName())) {
      options.model(properties.getModelName());
    }

    log.debug("Calling chat model with {} messages and {} tools",
      promptMessages.size(), request.getTools().size());
    ChatResponse chatResponse = chatModel.call(new Prompt(promptMessages, options.build()));
    return toResponse(chatResponse);
  }

  static ReasoningResponse toResponse(ChatResponse chatResponse) {
    if (chatResponse == null || chatResponse.getResult() == null) {
      log.warn("No chat response received");
      return ReasoningResponse.builder().build();
    }

    Generation generation = chatResponse.getResult();
    AssistantMessage output = generation.getOutput();
    String finishReason = generation.getMetadata() != null
      ? generation.getMetadata().getFinishReason() : null;

    Integer promptTokens = null;
    Integer completionTokens = null;
    if (chatResponse.getMetadata() != null) {
      Usage usage = chatResponse.getMetadata().getUsage();
      if (usage != null) {
        promptTokens = usage.getPromptTokens();
        completionTokens = usage.getCompletionTokens();
      }
    }

    return ReasoningResponse.builder()
      .text(output.getText() != null ? output.getText() : "")
      .toolCalls(output.getToolCalls() != null ? output.getToolCalls() : List.of())
      .finishReason(finishReason)
      .promptTokens(promptTokens)
      .completionTokens(completionTokens)
      .message(output)
      .build();
  }

  @Override
  public String modelName() {
    return StringUtils.hasText(properties.getModelName()) ? properties.getModelName() : "default";
  }

  @Override
  public String provider() {
    return properties.getModelProvider();
  }
}
