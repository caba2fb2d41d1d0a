package io.crmconnect.backend.hubspot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.crmconnect.backend.hubspot.model.IntegrationItem;
import io.crmconnect.backend.metrics.IntegrationMetrics;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class HubSpotItemService {
  private static final Logger log = LoggerFactory.getLogger(HubSpotItemService.class);

  private static final List<ObjectQuery> QUERIES =
      List.of(
          new ObjectQuery("contacts", "firstname,lastname,email", IntegrationItemMapper::fromContact),
          new ObjectQuery("companies", "name,domain", IntegrationItemMapper::fromCompany));

  private final WebClient webClient;
  private final HubSpotProperties properties;
  private final ObjectMapper objectMapper;
  private final IntegrationMetrics metrics;

  public HubSpotItemService(
      WebClient webClient,
      HubSpotProperties properties,
      ObjectMapper objectMapper,
      IntegrationMetrics metrics) {
    this.webClient = webClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
  }

  /**
   * Loads one page of contacts and one page of companies.
   *
   * <p>A page that fails or comes back with anything but 200 is left out of the result without
   * an error. Callers cannot tell a skipped page from an empty one.
   *
   * @param credentialsJson the token response handed out by {@link HubSpotCredentialService}
   */
  public List<IntegrationItem> loadItems(String credentialsJson) {
    String accessToken = accessToken(credentialsJson);
    List<IntegrationItem> items = new ArrayList<>();
    for (ObjectQuery query : QUERIES) {
      fetchPage(query, accessToken)
          .ifPresent(root -> root.path("results").forEach(r -> items.add(query.mapper().apply(r))));
    }
    log.info("hubspot items loaded: count={}", items.size());
    return items;
  }

  private Optional<JsonNode> fetchPage(ObjectQuery query, String accessToken) {
    URI uri =
        UriComponentsBuilder.fromUriString(properties.getApiBaseUrl())
            .path("/crm/v3/objects/")
            .path(query.objectType())
            .queryParam("limit", properties.getPageLimit())
            .queryParam("properties", query.properties())
            .build()
            .encode()
            .toUri();
    try {
      Page page =
          webClient
              .get()
              .uri(uri)
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
              .exchangeToMono(
                  r ->
                      r.bodyToMono(JsonNode.class)
                          .map(body -> new Page(r.statusCode().value(), body))
                          .defaultIfEmpty(new Page(r.statusCode().value(), null)))
              .timeout(properties.httpTimeout())
              .block();
      if (page == null || page.status() != 200 || page.body() == null) {
        metrics.pageSkipped("hubspot", query.objectType());
        log.warn(
            "hubspot {} page skipped: status={}",
            query.objectType(),
            page == null ? "none" : page.status());
        return Optional.empty();
      }
      return Optional.of(page.body());
    } catch (Exception e) {
      metrics.pageSkipped("hubspot", query.objectType());
      log.warn("hubspot {} page request failed: uri={}", query.objectType(), uri, e);
      return Optional.empty();
    }
  }

  private String accessToken(String credentialsJson) {
    JsonNode credentials;
    try {
      credentials = credentialsJson == null ? null : objectMapper.readTree(credentialsJson);
    } catch (Exception e) {
      credentials = null;
    }
    String token = credentials == null ? "" : credentials.path("access_token").asText("");
    if (token.isBlank()) {
      throw new IntegrationException(IntegrationErrorCode.MISSING_ACCESS_TOKEN, "Missing access token.");
    }
    return token;
  }

  private record ObjectQuery(
      String objectType, String properties, Function<JsonNode, IntegrationItem> mapper) {}

  private record Page(int status, JsonNode body) {}
}
