package io.crmconnect.backend.hubspot;

import io.crmconnect.backend.metrics.IntegrationMetrics;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Hands the token response from the OAuth redirect to whichever request asks for it next. The
 * handoff is at most once: reading the credentials deletes them, and a second completion before
 * the first is read replaces it.
 */
@Service
public class HubSpotCredentialService {
  private final HubSpotProperties properties;
  private final IntegrationStore store;
  private final HubSpotOAuthClient oauthClient;
  private final IntegrationMetrics metrics;

  public HubSpotCredentialService(
      HubSpotProperties properties,
      IntegrationStore store,
      HubSpotOAuthClient oauthClient,
      IntegrationMetrics metrics) {
    this.properties = properties;
    this.store = store;
    this.oauthClient = oauthClient;
    this.metrics = metrics;
  }

  public String exchangeAndStore(String code, String userId, String orgId) {
    String credentials = oauthClient.exchangeCode(code);
    store.putCredentials(orgId, userId, credentials, properties.getCredentialsTtlSeconds());
    return credentials;
  }

  public String consumeCredentials(String userId, String orgId) {
    if (!StringUtils.hasText(userId) || !StringUtils.hasText(orgId)) {
      throw new IntegrationException(IntegrationErrorCode.BAD_REQUEST, "user_id and org_id required");
    }
    String credentials =
        store
            .consumeCredentials(orgId, userId)
            .orElseThrow(
                () ->
                    new IntegrationException(
                        IntegrationErrorCode.CREDENTIALS_NOT_FOUND, "No credentials found."));
    metrics.credentialsConsumed("hubspot");
    return credentials;
  }
}
