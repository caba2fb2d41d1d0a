package io.crmconnect.backend.hubspot.dto;

public final class IntegrationDtos {
  private IntegrationDtos() {}

  public record AuthorizeResponse(String authorizeUrl, long expiresInSeconds) {}
}
