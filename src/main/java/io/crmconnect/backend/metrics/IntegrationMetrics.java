package io.crmconnect.backend.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class IntegrationMetrics {
  private final MeterRegistry meterRegistry;
  private final boolean enabled;

  public IntegrationMetrics(
      MeterRegistry meterRegistry, @Value("${app.metrics.enabled:true}") boolean enabled) {
    this.meterRegistry = meterRegistry;
    this.enabled = enabled;
  }

  public void cacheFallback(String op) {
    if (!enabled) return;
    meterRegistry.counter("integration.cache.fallback", "op", op).increment();
  }

  public void authorizationStarted(String provider) {
    if (!enabled) return;
    meterRegistry.counter("integration.oauth.started", "provider", provider).increment();
  }

  public void callbackSuccess(String provider) {
    if (!enabled) return;
    meterRegistry.counter("integration.oauth.callback.success", "provider", provider).increment();
  }

  public void callbackFailure(String provider, String reason) {
    if (!enabled) return;
    meterRegistry
        .counter("integration.oauth.callback.failure", "provider", provider, "reason", reason)
        .increment();
  }

  public void providerUnavailable(String provider) {
    if (!enabled) return;
    meterRegistry.counter("integration.provider.unavailable", "provider", provider).increment();
  }

  public void credentialsConsumed(String provider) {
    if (!enabled) return;
    meterRegistry.counter("integration.credentials.consumed", "provider", provider).increment();
  }

  public void pageSkipped(String provider, String objectType) {
    if (!enabled) return;
    meterRegistry
        .counter("integration.items.page.skipped", "provider", provider, "object", objectType)
        .increment();
  }
}
