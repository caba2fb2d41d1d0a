package io.crmconnect.backend.cache;

import java.time.Duration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyValueStore {
  private final StringRedisTemplate redis;

  public RedisKeyValueStore(StringRedisTemplate redis) {
    this.redis = redis;
  }

  public StoreResult<Void> set(String key, String value, Duration ttl) {
    try {
      if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
        redis.opsForValue().set(key, value, ttl);
      } else {
        redis.opsForValue().set(key, value);
      }
      return StoreResult.done();
    } catch (Exception e) {
      return StoreResult.failed(e);
    }
  }

  public StoreResult<String> get(String key) {
    try {
      return StoreResult.ok(redis.opsForValue().get(key));
    } catch (Exception e) {
      return StoreResult.failed(e);
    }
  }

  /** GETDEL: read and remove as a single Redis command. */
  public StoreResult<String> take(String key) {
    try {
      return StoreResult.ok(redis.opsForValue().getAndDelete(key));
    } catch (Exception e) {
      return StoreResult.failed(e);
    }
  }

  public StoreResult<Void> delete(String key) {
    try {
      redis.delete(key);
      return StoreResult.done();
    } catch (Exception e) {
      return StoreResult.failed(e);
    }
  }
}
