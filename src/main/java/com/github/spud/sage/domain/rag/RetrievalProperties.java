package com.github.spud.sage.domain.rag;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * 指南检索配置属性
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.rag")
public class RetrievalProperties {

  /**
   * 场景检索时每条查询返回的片段数
   */
  @Min(1)
  private int topKPerQuery = 3;

  /**
   * 合并后保留的最大片段数
   */
  @Min(1)
  private int maxResults = 12;

  /**
   * query_guides 工具的 topK
   */
  @Min(1)
  private int queryGuidesTopK = 4;

  /**
   * compare_products 工具每个 GSE 的 topK
   */
  @Min(1)
  private int compareTopK = 2;

  /**
   * 并发检索上限
   */
  @Min(1)
  private int maxConcurrency = 8;

  /**
   * 引用片段截断长度
   */
  private int snippetLength = 600;

  /**
   * 缓存配置
   */
  @Valid
  private CacheConfig cache = new CacheConfig();

  @Data
  public static class CacheConfig {

    private boolean enabled = true;

    /**
     * 最大条目数，超出后按 LRU 淘汰
     */
    @Min(1)
    private int capacity = 256;
  }
}
