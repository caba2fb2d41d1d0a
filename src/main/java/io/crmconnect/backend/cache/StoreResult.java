package io.crmconnect.backend.cache;

import java.util.Optional;

/**
 * Outcome of a single call against the external store: either a value (possibly absent) or the
 * failure that prevented the call from completing.
 */
public record StoreResult<T>(Optional<T> value, Exception failure) {

  public static <T> StoreResult<T> ok(T value) {
    return new StoreResult<>(Optional.ofNullable(value), null);
  }

  public static StoreResult<Void> done() {
    return new StoreResult<>(Optional.empty(), null);
  }

  public static <T> StoreResult<T> failed(Exception failure) {
    return new StoreResult<>(Optional.empty(), failure);
  }

  public boolean isFailure() {
    return failure != null;
  }
}
