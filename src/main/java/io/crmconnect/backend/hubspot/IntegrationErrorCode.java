package io.crmconnect.backend.hubspot;

public enum IntegrationErrorCode {
  BAD_REQUEST,
  PROVIDER_DENIED,
  MALFORMED_STATE,
  STATE_EXPIRED,
  STATE_MISMATCH,
  TOKEN_EXCHANGE_FAILED,
  CREDENTIALS_NOT_FOUND,
  MISSING_ACCESS_TOKEN,
  PROVIDER_UNAVAILABLE
}
