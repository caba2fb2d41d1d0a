package io.crmconnect.backend.hubspot;

import io.crmconnect.backend.metrics.IntegrationMetrics;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class HubSpotOAuthClient {
  private static final Logger log = LoggerFactory.getLogger(HubSpotOAuthClient.class);

  private final WebClient webClient;
  private final HubSpotProperties properties;
  private final IntegrationMetrics metrics;

  public HubSpotOAuthClient(
      WebClient webClient, HubSpotProperties properties, IntegrationMetrics metrics) {
    this.webClient = webClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  public String buildAuthorizeUrl(String encodedState) {
    return UriComponentsBuilder.fromUriString(properties.getAuthorizeEndpoint())
        .queryParam("client_id", properties.getClientId())
        .queryParam("redirect_uri", properties.getRedirectUri())
        .queryParam("response_type", "code")
        .queryParam("scope", String.join(" ", properties.scopeList()))
        .queryParam("state", encodedState)
        .build()
        .encode(StandardCharsets.UTF_8)
        .toUriString();
  }

  /**
   * Trades an authorization code for HubSpot's token response. Codes are single use, so a failure
   * here is final for the callback that carried it.
   *
   * @return the token response body, unparsed
   */
  public String exchangeCode(String code) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", properties.getRedirectUri());
    form.add("client_id", properties.getClientId());
    form.add("client_secret", properties.getClientSecret());

    TokenResponse response;
    try {
      response =
          webClient
              .post()
              .uri(properties.getTokenEndpoint())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .header(
                  HttpHeaders.AUTHORIZATION,
                  IntegrationUtils.basicAuthorization(
                      properties.getClientId(), properties.getClientSecret()))
              .body(BodyInserters.fromFormData(form))
              .exchangeToMono(
                  r ->
                      r.bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(body -> new TokenResponse(r.statusCode().value(), body)))
              .timeout(properties.httpTimeout())
              .block();
    } catch (Exception e) {
      metrics.providerUnavailable("hubspot");
      log.warn("hubspot token endpoint unreachable: {}", e.toString());
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED,
          "hubspot token exchange failed: provider unavailable",
          400,
          Map.of("reason", "provider_unavailable"));
    }
    if (response == null) {
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED, "hubspot token exchange returned no response");
    }
    if (response.status() < 200 || response.status() >= 300) {
      log.warn("hubspot token exchange rejected: status={}", response.status());
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED,
          "hubspot token exchange failed: " + response.body(),
          400,
          Map.of("status", response.status(), "body", response.body()));
    }
    if (response.body().isBlank()) {
      throw new IntegrationException(
          IntegrationErrorCode.TOKEN_EXCHANGE_FAILED,
          "hubspot token exchange returned an empty body",
          400,
          Map.of("status", response.status(), "body", ""));
    }
    return response.body();
  }

  private record TokenResponse(int status, String body) {}
}
