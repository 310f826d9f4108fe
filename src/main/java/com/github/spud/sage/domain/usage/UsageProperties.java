package com.github.spud.sage.domain.usage;

import jakarta.validation.constraints.Min;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * LLM 用量统计配置属性
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.usage")
public class UsageProperties {

  /**
   * 内存积压队列容量，满时丢弃最旧记录
   */
  @Min(1)
  private int backlogCapacity = 1000;

  /**
   * 单次 flush 最多写出的记录数
   */
  @Min(1)
  private int flushBatchSize = 100;

  /**
   * 定时 flush 间隔（毫秒）
   */
  private long flushIntervalMs = 30_000;

  /**
   * 未知模型使用的价格（每百万 token，USD）
   */
  private ModelPricing defaultPricing = new ModelPricing(3.00, 15.00);

  /**
   * 模型名 → 价格（每百万 token，USD）
   */
  private Map<String, ModelPricing> pricing = defaultPricingTable();

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ModelPricing {

    private double input;

    private double output;
  }

  private static Map<String, ModelPricing> defaultPricingTable() {
    Map<String, ModelPricing> table = new LinkedHashMap<>();
    table.put("claude-sonnet-4-20250514", new ModelPricing(3.00, 15.00));
    table.put("claude-3-5-sonnet-20241022", new ModelPricing(3.00, 15.00));
    table.put("gpt-4o", new ModelPricing(2.50, 10.00));
    table.put("gpt-4o-mini", new ModelPricing(0.15, 0.60));
    table.put("text-embedding-3-small", new ModelPricing(0.02, 0.00));
    return table;
  }
}
