package io.crmconnect.backend.hubspot;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.hubspot")
public class HubSpotProperties {
  private String clientId = "";
  private String clientSecret = "";
  private String redirectUri = "http://localhost:8000/integrations/hubspot/oauth2callback";
  private String scopes =
      "crm.objects.contacts.read crm.schemas.contacts.read "
          + "crm.objects.companies.read crm.schemas.companies.read oauth";
  private String authorizeEndpoint = "https://app.hubspot.com/oauth/authorize";
  private String tokenEndpoint = "https://api.hubapi.com/oauth/v1/token";
  private String apiBaseUrl = "https://api.hubapi.com";
  private long stateTtlSeconds = 600;
  private long credentialsTtlSeconds = 600;
  private int pageLimit = 20;
  private long httpTimeoutSeconds = 10;

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public void setClientSecret(String clientSecret) {
    this.clientSecret = clientSecret;
  }

  public String getRedirectUri() {
    return redirectUri;
  }

  public void setRedirectUri(String redirectUri) {
    this.redirectUri = redirectUri;
  }

  public String getScopes() {
    return scopes;
  }

  public void setScopes(String scopes) {
    this.scopes = scopes;
  }

  public String getAuthorizeEndpoint() {
    return authorizeEndpoint;
  }

  public void setAuthorizeEndpoint(String authorizeEndpoint) {
    this.authorizeEndpoint = authorizeEndpoint;
  }

  public String getTokenEndpoint() {
    return tokenEndpoint;
  }

  public void setTokenEndpoint(String tokenEndpoint) {
    this.tokenEndpoint = tokenEndpoint;
  }

  public String getApiBaseUrl() {
    return apiBaseUrl;
  }

  public void setApiBaseUrl(String apiBaseUrl) {
    this.apiBaseUrl = apiBaseUrl;
  }

  public long getStateTtlSeconds() {
    return stateTtlSeconds;
  }

  public void setStateTtlSeconds(long stateTtlSeconds) {
    this.stateTtlSeconds = stateTtlSeconds;
  }

  public long getCredentialsTtlSeconds() {
    return credentialsTtlSeconds;
  }

  public void setCredentialsTtlSeconds(long credentialsTtlSeconds) {
    this.credentialsTtlSeconds = credentialsTtlSeconds;
  }

  public int getPageLimit() {
    return pageLimit;
  }

  public void setPageLimit(int pageLimit) {
    this.pageLimit = pageLimit;
  }

  public long getHttpTimeoutSeconds() {
    return httpTimeoutSeconds;
  }

  public void setHttpTimeoutSeconds(long httpTimeoutSeconds) {
    this.httpTimeoutSeconds = httpTimeoutSeconds;
  }

  public Duration httpTimeout() {
    return Duration.ofSeconds(Math.max(1, httpTimeoutSeconds));
  }

  public List<String> scopeList() {
    if (scopes == null || scopes.isBlank()) return List.of();
    return Arrays.stream(scopes.split("[\\s,]+"))
        .map(String::trim)
        .filter(v -> !v.isEmpty())
        .collect(Collectors.toList());
  }
}
