package com.github.spud.sage.domain.usage;

import java.util.List;

/**
 * 用量记录的持久化出口
 */
public interface UsageSink {

  /**
   * Persist a batch; throwing leaves the batch in the tracker's backlog
   */
  void persist(List<UsageRecord> batch);
}
