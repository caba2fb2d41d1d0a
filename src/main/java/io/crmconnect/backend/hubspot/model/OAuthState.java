package io.crmconnect.backend.hubspot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Anti-forgery state bound to one user of one org. Serialized the same way in Redis and on the wire. */
public record OAuthState(
    @JsonProperty("state") String nonce,
    @JsonProperty("user_id") String userId,
    @JsonProperty("org_id") String orgId) {}
