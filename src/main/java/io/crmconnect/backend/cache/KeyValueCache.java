package io.crmconnect.backend.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived secret storage used by the connect flow.
 *
 * <p>Implementations never propagate store failures to callers: a missing entry and an
 * unreachable store look the same from the outside apart from the fallback behavior.
 */
public interface KeyValueCache {

  /**
   * Stores {@code value} under {@code key}, replacing any previous value.
   *
   * @param ttl time to live; {@code null}, zero or negative means no expiry
   */
  void put(String key, String value, Duration ttl);

  Optional<String> get(String key);

  /**
   * Returns the value under {@code key} and removes it in one step. Of any number of concurrent
   * callers at most one receives the value.
   */
  Optional<String> take(String key);

  /** Removes {@code key}. A no-op when the key is absent. */
  void delete(String key);
}
