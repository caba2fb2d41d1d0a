package io.crmconnect.backend.hubspot.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IntegrationItemType {
  CONTACT("contact"),
  COMPANY("company");

  private final String code;

  IntegrationItemType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
