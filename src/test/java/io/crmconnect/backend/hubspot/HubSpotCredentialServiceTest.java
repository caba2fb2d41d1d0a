package io.crmconnect.backend.hubspot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crmconnect.backend.cache.FallbackKeyValueCache;
import io.crmconnect.backend.cache.InMemoryKeyValueStore;
import io.crmconnect.backend.cache.MutableClock;
import io.crmconnect.backend.cache.RedisKeyValueStore;
import io.crmconnect.backend.cache.StoreResult;
import io.crmconnect.backend.metrics.IntegrationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.springframework.data.redis.RedisConnectionFailureException;

class HubSpotCredentialServiceTest {
  private MutableClock clock;
  private HubSpotOAuthClient oauthClient;
  private HubSpotCredentialService service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    IntegrationMetrics metrics = new IntegrationMetrics(new SimpleMeterRegistry(), true);
    RedisKeyValueStore redis = mock(RedisKeyValueStore.class);
    RedisConnectionFailureException down = new RedisConnectionFailureException("redis down");
    given(redis.set(ArgumentMatchers.anyString(), ArgumentMatchers.anyString(), ArgumentMatchers.any()))
        .willReturn(StoreResult.failed(down));
    given(redis.get(ArgumentMatchers.anyString())).willReturn(StoreResult.failed(down));
    given(redis.take(ArgumentMatchers.anyString())).willReturn(StoreResult.failed(down));
    given(redis.delete(ArgumentMatchers.anyString())).willReturn(StoreResult.failed(down));
    FallbackKeyValueCache cache =
        new FallbackKeyValueCache(redis, new InMemoryKeyValueStore(clock), metrics);

    oauthClient = mock(HubSpotOAuthClient.class);
    service =
        new HubSpotCredentialService(
            new HubSpotProperties(),
            new IntegrationStore(cache, new OAuthStateCodec(new ObjectMapper())),
            oauthClient,
            metrics);
  }

  @Test
  void credentialsAreHandedOutOnce() {
    given(oauthClient.exchangeCode("abc")).willReturn("{\"access_token\":\"at-1\"}");
    service.exchangeAndStore("abc", "u1", "o1");

    assertEquals("{\"access_token\":\"at-1\"}", service.consumeCredentials("u1", "o1"));
    IntegrationException e =
        assertThrows(IntegrationException.class, () -> service.consumeCredentials("u1", "o1"));
    assertEquals(IntegrationErrorCode.CREDENTIALS_NOT_FOUND, e.getCode());
  }

  @Test
  void laterCompletionOverwritesUnconsumedCredentials() {
    given(oauthClient.exchangeCode("first")).willReturn("{\"access_token\":\"at-1\"}");
    given(oauthClient.exchangeCode("second")).willReturn("{\"access_token\":\"at-2\"}");
    service.exchangeAndStore("first", "u1", "o1");
    service.exchangeAndStore("second", "u1", "o1");

    assertEquals("{\"access_token\":\"at-2\"}", service.consumeCredentials("u1", "o1"));
  }

  @Test
  void credentialsAreScopedToOrgAndUser() {
    given(oauthClient.exchangeCode("abc")).willReturn("{\"access_token\":\"at-1\"}");
    service.exchangeAndStore("abc", "u1", "o1");

    assertThrows(IntegrationException.class, () -> service.consumeCredentials("u1", "o2"));
    assertThrows(IntegrationException.class, () -> service.consumeCredentials("u2", "o1"));
    assertEquals("{\"access_token\":\"at-1\"}", service.consumeCredentials("u1", "o1"));
  }

  @Test
  void credentialsExpireAfterTtl() {
    given(oauthClient.exchangeCode("abc")).willReturn("{\"access_token\":\"at-1\"}");
    service.exchangeAndStore("abc", "u1", "o1");
    clock.advance(Duration.ofSeconds(601));

    IntegrationException e =
        assertThrows(IntegrationException.class, () -> service.consumeCredentials("u1", "o1"));
    assertEquals(IntegrationErrorCode.CREDENTIALS_NOT_FOUND, e.getCode());
  }

  @Test
  void concurrentConsumersReceiveCredentialsOnce() throws Exception {
    given(oauthClient.exchangeCode("abc")).willReturn("{\"access_token\":\"at-1\"}");
    service.exchangeAndStore("abc", "u1", "o1");

    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      results.add(
          pool.submit(
              () -> {
                start.await();
                try {
                  service.consumeCredentials("u1", "o1");
                  return true;
                } catch (IntegrationException e) {
                  return false;
                }
              }));
    }
    start.countDown();
    int handedOut = 0;
    for (Future<Boolean> f : results) {
      if (f.get(10, TimeUnit.SECONDS)) handedOut++;
    }
    pool.shutdown();

    assertEquals(1, handedOut);
  }
}
