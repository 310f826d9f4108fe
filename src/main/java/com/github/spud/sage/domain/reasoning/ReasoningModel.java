package com.github.spud.sage.domain.reasoning;

/**
 * 生成式推理协作者，每次调用无状态
 */
public interface ReasoningModel {

  /**
   * @throws ReasoningUnavailableException when no model is configured
   */
  ReasoningResponse call(ReasoningRequest request);

  String modelName();

  String provider();
}
