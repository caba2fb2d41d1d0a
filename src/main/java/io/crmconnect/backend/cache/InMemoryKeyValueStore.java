package io.crmconnect.backend.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

/**
 * Process-local stand-in for Redis. Entries expire lazily on read; nothing sweeps the map in the
 * background.
 */
@Component
public class InMemoryKeyValueStore {
  private final Map<String, CacheEntry> entries = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;

  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
  }

  public void put(String key, String value, Duration ttl) {
    Instant expiresAt = null;
    if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
      expiresAt = clock.instant().plus(ttl);
    }
    CacheEntry entry = new CacheEntry(value, expiresAt);
    lock.lock();
    try {
      entries.put(key, entry);
    } finally {
      lock.unlock();
    }
  }

  public Optional<String> get(String key) {
    Instant now = clock.instant();
    lock.lock();
    try {
      CacheEntry entry = entries.get(key);
      if (entry == null) return Optional.empty();
      if (entry.isExpired(now)) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry.value());
    } finally {
      lock.unlock();
    }
  }

  public Optional<String> take(String key) {
    Instant now = clock.instant();
    lock.lock();
    try {
      CacheEntry entry = entries.remove(key);
      if (entry == null || entry.isExpired(now)) return Optional.empty();
      return Optional.of(entry.value());
    } finally {
      lock.unlock();
    }
  }

  public void delete(String key) {
    lock.lock();
    try {
      entries.remove(key);
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  record CacheEntry(String value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return expiresAt != null && now.isAfter(expiresAt);
    }
  }
}
