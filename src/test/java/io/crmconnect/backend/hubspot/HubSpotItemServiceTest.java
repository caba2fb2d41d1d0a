package io.crmconnect.backend.hubspot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crmconnect.backend.hubspot.model.IntegrationItem;
import io.crmconnect.backend.hubspot.model.IntegrationItemType;
import io.crmconnect.backend.metrics.IntegrationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class HubSpotItemServiceTest {
  private static final String CREDENTIALS = "{\"access_token\":\"at-1\",\"token_type\":\"bearer\"}";
  private static final String CONTACTS =
      "{\"results\":[{\"id\":\"1\",\"properties\":{\"firstname\":\"Ada\",\"lastname\":\"Lovelace\"}},"
          + "{\"id\":\"2\",\"properties\":{\"email\":\"grace@example.com\"}}]}";
  private static final String COMPANIES =
      "{\"results\":[{\"id\":\"9\",\"properties\":{\"name\":null,\"domain\":\"acme.io\"}}]}";

  private HubSpotProperties properties;
  private SimpleMeterRegistry registry;
  private List<ClientRequest> requests;

  @BeforeEach
  void setUp() {
    properties = new HubSpotProperties();
    properties.setHttpTimeoutSeconds(1);
    registry = new SimpleMeterRegistry();
    requests = new CopyOnWriteArrayList<>();
  }

  @Test
  void loadsContactsThenCompaniesWithBearerToken() {
    HubSpotItemService service = service(HttpStatus.OK, CONTACTS, HttpStatus.OK, COMPANIES);

    List<IntegrationItem> items = service.loadItems(CREDENTIALS);

    assertThat(items)
        .containsExactly(
            new IntegrationItem("1_contact", IntegrationItemType.CONTACT, "Ada Lovelace", null),
            new IntegrationItem("2_contact", IntegrationItemType.CONTACT, "grace@example.com", null),
            new IntegrationItem("9_company", IntegrationItemType.COMPANY, "acme.io", null));
    assertEquals(2, requests.size());
    assertThat(requests)
        .allSatisfy(
            r -> assertEquals("Bearer at-1", r.headers().getFirst(HttpHeaders.AUTHORIZATION)));
    assertThat(requests.get(0).url().toString())
        .isEqualTo(
            "https://api.hubapi.com/crm/v3/objects/contacts?limit=20&properties=firstname,lastname,email");
    assertThat(requests.get(1).url().toString())
        .isEqualTo("https://api.hubapi.com/crm/v3/objects/companies?limit=20&properties=name,domain");
  }

  @Test
  void failedPageIsSkippedSilently() {
    HubSpotItemService service =
        service(HttpStatus.OK, CONTACTS, HttpStatus.INTERNAL_SERVER_ERROR, "{\"message\":\"boom\"}");

    List<IntegrationItem> items = service.loadItems(CREDENTIALS);

    assertThat(items).extracting(IntegrationItem::type).containsOnly(IntegrationItemType.CONTACT);
    assertEquals(
        1.0,
        registry
            .get("integration.items.page.skipped")
            .tag("object", "companies")
            .counter()
            .count());
  }

  @Test
  void transportErrorOnPageIsSkippedSilently() {
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(
                request ->
                    request.url().getPath().endsWith("/contacts")
                        ? Mono.error(new IOException("connection reset"))
                        : json(HttpStatus.OK, COMPANIES))
            .build();
    HubSpotItemService service =
        new HubSpotItemService(
            webClient, properties, new ObjectMapper(), new IntegrationMetrics(registry, true));

    assertThat(service.loadItems(CREDENTIALS)).extracting(IntegrationItem::id).containsExactly("9_company");
  }

  @Test
  void credentialsWithoutAccessTokenAreRejected() {
    HubSpotItemService service = service(HttpStatus.OK, CONTACTS, HttpStatus.OK, COMPANIES);

    IntegrationException e =
        assertThrows(IntegrationException.class, () -> service.loadItems("{\"token_type\":\"bearer\"}"));
    assertEquals(IntegrationErrorCode.MISSING_ACCESS_TOKEN, e.getCode());
    assertThrows(IntegrationException.class, () -> service.loadItems("not json"));
    assertThrows(IntegrationException.class, () -> service.loadItems(null));
    assertEquals(0, requests.size());
  }

  private HubSpotItemService service(
      HttpStatus contactsStatus, String contacts, HttpStatus companiesStatus, String companies) {
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  requests.add(request);
                  return request.url().getPath().endsWith("/contacts")
                      ? json(contactsStatus, contacts)
                      : json(companiesStatus, companies);
                })
            .build();
    return new HubSpotItemService(
        webClient, properties, new ObjectMapper(), new IntegrationMetrics(registry, true));
  }

  private static Mono<ClientResponse> json(HttpStatus status, String body) {
    return Mono.just(
        ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
  }
}
