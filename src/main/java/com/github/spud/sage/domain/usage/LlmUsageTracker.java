package com.github.spud.sage.domain.usage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * LLM 用量统计
 * <p>
 * recordUsage 只入队不阻塞调用方；积压队列有上限，满时丢弃最旧记录。flush 尽力而为，出口失败时记录回到队列
 */
@Slf4j
@Component
public class LlmUsageTracker {

  private final UsageSink sink;
  private final UsageProperties properties;
  private final BlockingQueue<UsageRecord> backlog;

  public LlmUsageTracker(UsageSink sink, UsageProperties properties) {
    this.sink = sink;
    this.properties = properties;
    this.backlog = new ArrayBlockingQueue<>(Math.max(properties.getBacklogCapacity(), 1));
  }

  /**
   * 记录一次用量，从不抛出
   */
  public void recordUsage(String serviceName, String modelName, String modelProvider,
    String requestType, long tokensInput, long tokensOutput, long durationMs, boolean success,
    String errorMessage) {
    UsageRecord record = UsageRecord.builder()
      .serviceName(serviceName)
      .modelName(modelName)
      .modelProvider(modelProvider)
      .requestType(requestType)
      .tokensInput(tokensInput)
      .tokensOutput(tokensOutput)
      .durationMs(durationMs)
      .success(success)
      .errorMessage(errorMessage)
      .costUsd(calculateCost(modelName, tokensInput, tokensOutput))
      .build();
    enqueue(record);
    log.debug("Recorded LLM usage: {}/{} - {} tokens, ${}", serviceName, requestType,
      record.tokensTotal(), record.getCostUsd());
  }

  /**
   * 按价格表估算成本（USD，保留 6 位小数）
   */
  public double calculateCost(String modelName, long tokensInput, long tokensOutput) {
    UsageProperties.ModelPricing pricing = modelName != null
      ? properties.getPricing().get(modelName) : null;
    if (pricing == null) {
      log.debug("Unknown model '{}', using default pricing", modelName);
      pricing = properties.getDefaultPricing();
    }
    double cost = tokensInput / 1_000_000d * pricing.getInput()
      + tokensOutput / 1_000_000d * pricing.getOutput();
    return Math.round(cost * 1_000_000d) / 1_000_000d;
  }

  /**
   * 将积压记录写出，返回成功写出的条数
   */
  @Scheduled(fixedDelayString = "${app.usage.flush-interval-ms:30000}")
  public int flush() {
    int flushed = 0;
    List<UsageRecord> batch = new ArrayList<>();
    while (backlog.drainTo(batch, Math.max(properties.getFlushBatchSize(), 1)) > 0) {
      try {
        sink.persist(batch);
        flushed += batch.size();
      } catch (RuntimeException e) {
        log.warn("Failed to persist {} LLM usage records, keeping them buffered: {}",
          batch.size(), e.getMessage());
        batch.forEach(this::enqueue);
        break;
      }
      batch = new ArrayList<>();
    }
    if (flushed > 0) {
      log.info("Flushed {} LLM usage records", flushed);
    }
    return flushed;
  }

  public int pending() {
    return backlog.size();
  }

  public List<UsageRecord> pendingRecords() {
    return List.copyOf(backlog);
  }

  private void enqueue(UsageRecord record) {
    while (!backlog.offer(record)) {
      UsageRecord dropped = backlog.poll();
      if (dropped != null) {
        log.warn("LLM usage backlog full, dropping oldest record from {}",
          dropped.getServiceName());
      }
    }
  }
}
