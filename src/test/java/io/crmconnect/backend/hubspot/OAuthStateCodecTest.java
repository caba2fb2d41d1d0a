package io.crmconnect.backend.hubspot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crmconnect.backend.hubspot.model.OAuthState;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class OAuthStateCodecTest {
  private final OAuthStateCodec codec = new OAuthStateCodec(new ObjectMapper());

  @Test
  void encodedStateIsUrlSafeJsonWithWireFieldNames() {
    String encoded = codec.encode(new OAuthState("n0nce", "u1", "o1"));

    assertThat(encoded).matches("[A-Za-z0-9_-]+");
    String json = new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
    assertThat(json).contains("\"state\":\"n0nce\"", "\"user_id\":\"u1\"", "\"org_id\":\"o1\"");
    assertEquals(new OAuthState("n0nce", "u1", "o1"), codec.decode(encoded));
  }

  @Test
  void paddedInputIsAccepted() {
    String json = "{\"state\":\"abc\",\"user_id\":\"u1\",\"org_id\":\"o1\"}";
    String padded = Base64.getUrlEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));

    assertEquals("abc", codec.decode(padded).nonce());
  }

  @Test
  void missingStateIsMalformed() {
    IntegrationException e = assertThrows(IntegrationException.class, () -> codec.decode(" "));
    assertEquals(IntegrationErrorCode.MALFORMED_STATE, e.getCode());
  }

  @Test
  void nonBase64StateIsMalformed() {
    IntegrationException e = assertThrows(IntegrationException.class, () -> codec.decode("%%not*base64"));
    assertEquals(IntegrationErrorCode.MALFORMED_STATE, e.getCode());
  }

  @Test
  void nonJsonStateIsMalformed() {
    String encoded =
        Base64.getUrlEncoder().encodeToString("hello".getBytes(StandardCharsets.UTF_8));
    IntegrationException e = assertThrows(IntegrationException.class, () -> codec.decode(encoded));
    assertEquals(IntegrationErrorCode.MALFORMED_STATE, e.getCode());
  }

  @Test
  void stateWithoutOrgIsMalformed() {
    String encoded =
        Base64.getUrlEncoder()
            .encodeToString("{\"state\":\"abc\",\"user_id\":\"u1\"}".getBytes(StandardCharsets.UTF_8));
    IntegrationException e = assertThrows(IntegrationException.class, () -> codec.decode(encoded));
    assertEquals(IntegrationErrorCode.MALFORMED_STATE, e.getCode());
  }
}
