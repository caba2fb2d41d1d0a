package io.crmconnect.backend.hubspot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

public final class IntegrationUtils {
  private static final SecureRandom RANDOM = new SecureRandom();

  private IntegrationUtils() {}

  public static String randomBase64Url(int bytesLength) {
    byte[] bytes = new byte[Math.max(32, bytesLength)];
    RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  public static String basicAuthorization(String clientId, String clientSecret) {
    String raw = (clientId == null ? "" : clientId) + ":" + (clientSecret == null ? "" : clientSecret);
    return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  /** Comparison time does not depend on where the inputs first differ. */
  public static boolean constantTimeEquals(String a, String b) {
    if (a == null || b == null) return false;
    return MessageDigest.isEqual(
        a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
  }
}
