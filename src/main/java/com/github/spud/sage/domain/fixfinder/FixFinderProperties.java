package com.github.spud.sage.domain.fixfinder;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Fix Finder 配置属性
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.fix-finder")
public class FixFinderProperties {

  /**
   * 是否启用 AI 修复查找
   */
  private boolean enabled = true;

  /**
   * ReAct 最大迭代次数
   */
  @Min(0)
  private int maxIterations = 3;

  /**
   * 单次迭代调用超时
   */
  @NotNull
  private Duration iterationTimeout = Duration.ofSeconds(30);

  /**
   * 最终分析调用超时
   */
  @NotNull
  private Duration finalAnalysisTimeout = Duration.ofSeconds(45);

  /**
   * 单次调用输出 token 上限
   */
  @Min(1)
  private int maxTokens = 2048;

  /**
   * 为空时使用模型 starter 的默认模型
   */
  private String modelName = "";

  private String modelProvider = "openai";

  /**
   * 是否在初始对话中附带场景检索到的指南片段
   */
  private boolean seedGuideExcerpts = true;
}
