package io.crmconnect.backend.hubspot;

import io.crmconnect.backend.hubspot.dto.IntegrationDtos;
import io.crmconnect.backend.hubspot.model.IntegrationItem;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/integrations/hubspot")
@Validated
public class HubSpotController {
  private final HubSpotAuthorizationService authorizationService;
  private final HubSpotCredentialService credentialService;
  private final HubSpotItemService itemService;

  public HubSpotController(
      HubSpotAuthorizationService authorizationService,
      HubSpotCredentialService credentialService,
      HubSpotItemService itemService) {
    this.authorizationService = authorizationService;
    this.credentialService = credentialService;
    this.itemService = itemService;
  }

  @PostMapping(
      path = "/authorize",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<IntegrationDtos.AuthorizeResponse> authorize(ServerWebExchange exchange) {
    return exchange
        .getFormData()
        .flatMap(
            form ->
                Mono.fromCallable(
                        () ->
                            authorizationService.beginAuthorization(
                                form.getFirst("user_id"), form.getFirst("org_id")))
                    .subscribeOn(Schedulers.boundedElastic()));
  }

  @GetMapping(path = "/oauth2callback")
  public Mono<ResponseEntity<String>> oauth2Callback(
      @RequestParam(value = "code", required = false) String code,
      @RequestParam(value = "state", required = false) String state,
      @RequestParam(value = "error", required = false) String error,
      @RequestParam(value = "error_description", required = false) String errorDescription) {
    return Mono.fromCallable(
            () ->
                ResponseEntity.ok()
                    .contentType(MediaType.TEXT_HTML)
                    .body(authorizationService.handleCallback(code, state, error, errorDescription)))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(
      path = "/credentials",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ResponseEntity<String>> credentials(ServerWebExchange exchange) {
    return exchange
        .getFormData()
        .flatMap(
            form ->
                Mono.fromCallable(
                        () ->
                            ResponseEntity.ok()
                                .contentType(MediaType.APPLICATION_JSON)
                                .body(
                                    credentialService.consumeCredentials(
                                        form.getFirst("user_id"), form.getFirst("org_id"))))
                    .subscribeOn(Schedulers.boundedElastic()));
  }

  @PostMapping(
      path = "/load",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<List<IntegrationItem>> load(ServerWebExchange exchange) {
    return exchange
        .getFormData()
        .flatMap(
            form ->
                Mono.fromCallable(() -> itemService.loadItems(form.getFirst("credentials")))
                    .subscribeOn(Schedulers.boundedElastic()));
  }
}
