package com.github.spud.sage.domain.usage;

import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 默认出口：写日志，由外部日志采集负责落库
 */
@Slf4j
@Component
public class LoggingUsageSink implements UsageSink {

  @Override
  public void persist(List<UsageRecord> batch) {
    for (UsageRecord record : batch) {
      log.info("LLM usage: service={}, type={}, model={}/{}, tokens={}+{}, cost=${}, {}ms, "
          + "success={}{}",
        record.getServiceName(), record.getRequestType(), record.getModelProvider(),
        record.getModelName(), record.getTokensInput(), record.getTokensOutput(),
        String.format(Locale.US, "%.6f", record.getCostUsd()), record.getDurationMs(),
        record.isSuccess(),
        record.getErrorMessage() != null ? ", error=" + record.getErrorMessage() : "");
    }
  }
}
