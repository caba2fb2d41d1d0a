package io.crmconnect.backend.cache;

import io.crmconnect.backend.metrics.IntegrationMetrics;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Redis first, local map second. Each call makes one Redis attempt; when that attempt fails the
 * same operation runs against {@link InMemoryKeyValueStore} and the caller never sees the error.
 */
@Service
public class FallbackKeyValueCache implements KeyValueCache {
  private static final Logger log = LoggerFactory.getLogger(FallbackKeyValueCache.class);

  private final RedisKeyValueStore redis;
  private final InMemoryKeyValueStore local;
  private final IntegrationMetrics metrics;

  public FallbackKeyValueCache(
      RedisKeyValueStore redis, InMemoryKeyValueStore local, IntegrationMetrics metrics) {
    this.redis = redis;
    this.local = local;
    this.metrics = metrics;
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    if (key == null || value == null) return;
    StoreResult<Void> result = redis.set(key, value, ttl);
    if (result.isFailure()) {
      onFallback("put", key, result.failure());
      local.put(key, value, ttl);
      return;
    }
    // Redis now holds the current value; an older outage copy must not resurface later
    local.delete(key);
  }

  @Override
  public Optional<String> get(String key) {
    if (key == null) return Optional.empty();
    StoreResult<String> result = redis.get(key);
    if (result.isFailure()) {
      onFallback("get", key, result.failure());
      return local.get(key);
    }
    return result.value();
  }

  @Override
  public Optional<String> take(String key) {
    if (key == null) return Optional.empty();
    StoreResult<String> result = redis.take(key);
    if (result.isFailure()) {
      onFallback("take", key, result.failure());
      return local.take(key);
    }
    local.delete(key);
    return result.value();
  }

  @Override
  public void delete(String key) {
    if (key == null) return;
    StoreResult<Void> result = redis.delete(key);
    if (result.isFailure()) {
      onFallback("delete", key, result.failure());
    }
    // an entry written during an outage must not outlive a delete
    local.delete(key);
  }

  private void onFallback(String op, String key, Exception failure) {
    metrics.cacheFallback(op);
    log.warn("redis {} failed, using in-memory store: key={} error={}", op, key, failure.toString());
  }
}
