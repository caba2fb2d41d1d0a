package io.crmconnect.backend.hubspot;

import io.crmconnect.backend.hubspot.dto.IntegrationDtos;
import io.crmconnect.backend.hubspot.model.OAuthState;
import io.crmconnect.backend.metrics.IntegrationMetrics;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Connect flow for HubSpot: issues the authorize URL and validates the redirect that comes back.
 *
 * <p>The encoded state carries the nonce, user id and org id, so the callback needs no server
 * session. The cached copy under {@code state:{org}:{user}} is single use and is removed on the
 * first callback that reads it, whether or not the nonce matches.
 */
@Service
public class HubSpotAuthorizationService {
  private static final Logger log = LoggerFactory.getLogger(HubSpotAuthorizationService.class);
  private static final String PROVIDER = "hubspot";

  public static final String CLOSE_WINDOW_HTML =
      """
      <html>
          <script>
              window.close();
          </script>
      </html>
      """;

  private final HubSpotProperties properties;
  private final IntegrationStore store;
  private final OAuthStateCodec codec;
  private final HubSpotOAuthClient oauthClient;
  private final HubSpotCredentialService credentialService;
  private final IntegrationMetrics metrics;

  public HubSpotAuthorizationService(
      HubSpotProperties properties,
      IntegrationStore store,
      OAuthStateCodec codec,
      HubSpotOAuthClient oauthClient,
      HubSpotCredentialService credentialService,
      IntegrationMetrics metrics) {
    this.properties = properties;
    this.store = store;
    this.codec = codec;
    this.oauthClient = oauthClient;
    this.credentialService = credentialService;
    this.metrics = metrics;
  }

  public IntegrationDtos.AuthorizeResponse beginAuthorization(String userId, String orgId) {
    validateConfig();
    requireText(userId, "user_id required");
    requireText(orgId, "org_id required");

    OAuthState state = new OAuthState(IntegrationUtils.randomBase64Url(32), userId, orgId);
    store.putState(state, properties.getStateTtlSeconds());
    metrics.authorizationStarted(PROVIDER);
    log.debug("hubspot authorization started: orgId={} userId={}", orgId, userId);
    return new IntegrationDtos.AuthorizeResponse(
        oauthClient.buildAuthorizeUrl(codec.encode(state)), properties.getStateTtlSeconds());
  }

  /**
   * Validates a provider redirect and, when it checks out, exchanges the code and parks the token
   * response for {@link HubSpotCredentialService#consumeCredentials}.
   *
   * @return the page that closes the popup
   */
  public String handleCallback(String code, String state, String error, String errorDescription) {
    if (StringUtils.hasText(error)) {
      metrics.callbackFailure(PROVIDER, "provider_denied");
      String reason = StringUtils.hasText(errorDescription) ? errorDescription : error;
      throw new IntegrationException(
          IntegrationErrorCode.PROVIDER_DENIED,
          "hubspot authorization denied: " + reason,
          400,
          Map.of("error", error));
    }

    OAuthState received;
    try {
      received = codec.decode(state);
    } catch (IntegrationException e) {
      metrics.callbackFailure(PROVIDER, "malformed_state");
      throw e;
    }

    OAuthState saved =
        store
            .consumeState(received.orgId(), received.userId())
            .orElseThrow(
                () -> {
                  metrics.callbackFailure(PROVIDER, "state_expired");
                  return new IntegrationException(
                      IntegrationErrorCode.STATE_EXPIRED,
                      "State not found (expired). Please retry Connect.");
                });
    if (!IntegrationUtils.constantTimeEquals(received.nonce(), saved.nonce())) {
      metrics.callbackFailure(PROVIDER, "state_mismatch");
      log.warn(
          "hubspot state mismatch: orgId={} userId={}", received.orgId(), received.userId());
      throw new IntegrationException(
          IntegrationErrorCode.STATE_MISMATCH,
          "State mismatch. Please retry Connect and complete in the most recent popup.");
    }
    if (!StringUtils.hasText(code)) {
      metrics.callbackFailure(PROVIDER, "missing_code");
      throw new IntegrationException(IntegrationErrorCode.BAD_REQUEST, "hubspot oauth code missing");
    }

    try {
      credentialService.exchangeAndStore(code, received.userId(), received.orgId());
    } catch (IntegrationException e) {
      metrics.callbackFailure(PROVIDER, "token_exchange_failed");
      throw e;
    }
    metrics.callbackSuccess(PROVIDER);
    log.info(
        "hubspot connected: orgId={} userId={}", received.orgId(), received.userId());
    return CLOSE_WINDOW_HTML;
  }

  private void validateConfig() {
    if (!StringUtils.hasText(properties.getClientId())
        || !StringUtils.hasText(properties.getRedirectUri())
        || !StringUtils.hasText(properties.getAuthorizeEndpoint())
        || !StringUtils.hasText(properties.getTokenEndpoint())) {
      throw new IntegrationException(
          IntegrationErrorCode.PROVIDER_UNAVAILABLE, "hubspot oauth not configured", 503);
    }
  }

  private static void requireText(String value, String message) {
    if (!StringUtils.hasText(value)) {
      throw new IntegrationException(IntegrationErrorCode.BAD_REQUEST, message);
    }
  }
}
