package com.github.spud.sage.domain.rag;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * 检索结果缓存 缓存相同查询的检索结果
 * <p>
 * 容量有上限，按最近最少使用淘汰；所有操作在实例锁内完成
 */
@Slf4j
@Component
public class RetrievalCache {

  private static final String KEY_PREFIX = "rag:";

  private final boolean enabled;
  private final int capacity;
  private final Map<String, List<GuideExcerpt>> entries;

  public RetrievalCache(RetrievalProperties properties) {
    this(properties.getCache().isEnabled(), properties.getCache().getCapacity());
  }

  RetrievalCache(boolean enabled, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Retrieval cache capacity must be positive: " + capacity);
    }
    this.enabled = enabled;
    this.capacity = capacity;
    this.entries = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, List<GuideExcerpt>> eldest) {
        return size() > RetrievalCache.this.capacity;
      }
    };
  }

  /**
   * 获取缓存的检索结果
   */
  public synchronized Optional<List<GuideExcerpt>> get(String query, int topK, String filter) {
    if (!enabled) {
      return Optional.empty();
    }
    String key = buildKey(query, topK, filter);
    List<GuideExcerpt> cached = entries.get(key);
    if (cached != null) {
      log.debug("Retrieval cache hit for key: {}", key);
    }
    return Optional.ofNullable(cached);
  }

  /**
   * 缓存检索结果
   */
  public synchronized void put(String query, int topK, String filter, List<GuideExcerpt> excerpts) {
    if (!enabled) {
      return;
    }
    String key = buildKey(query, topK, filter);
    entries.put(key, List.copyOf(excerpts));
    log.debug("Cached retrieval for key: {} (size={})", key, entries.size());
  }

  public synchronized int size() {
    return entries.size();
  }

  private String buildKey(String query, int topK, String filter) {
    String raw = query + "|" + topK + "|" + (filter != null ? filter : "");
    String hash = DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    return KEY_PREFIX + hash;
  }
}
