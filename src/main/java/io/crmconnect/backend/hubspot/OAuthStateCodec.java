package io.crmconnect.backend.hubspot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.crmconnect.backend.hubspot.model.OAuthState;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Converts {@link OAuthState} to and from its JSON form (kept in the cache) and its URL-safe
 * base64 form (carried through the provider redirect).
 */
@Component
public class OAuthStateCodec {
  private final ObjectMapper objectMapper;

  public OAuthStateCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String toJson(OAuthState state) {
    try {
      return objectMapper.writeValueAsString(state);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("oauth state serialization error", e);
    }
  }

  public Optional<OAuthState> fromJson(String json) {
    if (!StringUtils.hasText(json)) return Optional.empty();
    try {
      return Optional.of(objectMapper.readValue(json, OAuthState.class));
    } catch (Exception e) {
      return Optional.empty();
    }
  }

  public String encode(OAuthState state) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(toJson(state).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * @throws IntegrationException {@link IntegrationErrorCode#MALFORMED_STATE} when the value is not
   *     base64url JSON or lacks any of nonce, user id and org id
   */
  public OAuthState decode(String encoded) {
    if (!StringUtils.hasText(encoded)) {
      throw malformed("oauth state missing");
    }
    String json;
    try {
      json = new String(Base64.getUrlDecoder().decode(encoded.trim()), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw malformed("oauth state is not valid base64url");
    }
    OAuthState state = fromJson(json).orElseThrow(() -> malformed("oauth state is not valid json"));
    if (!StringUtils.hasText(state.nonce())
        || !StringUtils.hasText(state.userId())
        || !StringUtils.hasText(state.orgId())) {
      throw malformed("oauth state incomplete");
    }
    return state;
  }

  private static IntegrationException malformed(String message) {
    return new IntegrationException(IntegrationErrorCode.MALFORMED_STATE, message);
  }
}
