package io.crmconnect.backend.hubspot;

import java.util.Map;

/**
 * A failure of the connect flow the user can act on. Every code except
 * {@link IntegrationErrorCode#PROVIDER_UNAVAILABLE} resolves the same way: start Connect again.
 */
public class IntegrationException extends RuntimeException {
  private final IntegrationErrorCode code;
  private final int httpStatus;
  private final Map<String, Object> details;

  public IntegrationException(IntegrationErrorCode code, String message) {
    this(code, message, 400, Map.of());
  }

  public IntegrationException(IntegrationErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, Map.of());
  }

  public IntegrationException(
      IntegrationErrorCode code, String message, int httpStatus, Map<String, Object> details) {
    super(message);
    this.code = code;
    this.httpStatus = httpStatus;
    this.details = details == null ? Map.of() : details;
  }

  public IntegrationErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}
