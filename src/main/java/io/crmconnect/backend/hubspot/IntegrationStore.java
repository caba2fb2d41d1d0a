package io.crmconnect.backend.hubspot;

import io.crmconnect.backend.cache.KeyValueCache;
import io.crmconnect.backend.hubspot.model.OAuthState;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class IntegrationStore {
  private static final String PREFIX_STATE = "state:";
  private static final String PREFIX_CREDENTIALS = "credentials:";

  private final KeyValueCache cache;
  private final OAuthStateCodec codec;

  public IntegrationStore(KeyValueCache cache, OAuthStateCodec codec) {
    this.cache = cache;
    this.codec = codec;
  }

  public static String stateKey(String orgId, String userId) {
    return PREFIX_STATE + orgId + ":" + userId;
  }

  public static String credentialsKey(String orgId, String userId) {
    return PREFIX_CREDENTIALS + orgId + ":" + userId;
  }

  public void putState(OAuthState state, long ttlSeconds) {
    cache.put(
        stateKey(state.orgId(), state.userId()),
        codec.toJson(state),
        Duration.ofSeconds(Math.max(1, ttlSeconds)));
  }

  /**
   * Removes the saved state and returns it. Concurrent callbacks for the same user and org race
   * on a single take, so only one of them sees the state.
   */
  public Optional<OAuthState> consumeState(String orgId, String userId) {
    return cache.take(stateKey(orgId, userId)).flatMap(codec::fromJson);
  }

  public void putCredentials(String orgId, String userId, String credentialsJson, long ttlSeconds) {
    cache.put(
        credentialsKey(orgId, userId),
        credentialsJson,
        Duration.ofSeconds(Math.max(1, ttlSeconds)));
  }

  public Optional<String> consumeCredentials(String orgId, String userId) {
    return cache.take(credentialsKey(orgId, userId)).filter(v -> !v.isBlank());
  }
}
