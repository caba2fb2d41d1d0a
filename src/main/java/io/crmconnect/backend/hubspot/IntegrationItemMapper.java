package io.crmconnect.backend.hubspot;

import com.fasterxml.jackson.databind.JsonNode;
import io.crmconnect.backend.hubspot.model.IntegrationItem;
import io.crmconnect.backend.hubspot.model.IntegrationItemType;

public final class IntegrationItemMapper {
  private IntegrationItemMapper() {}

  /** Name order: "first last", then email, then the HubSpot id. */
  public static IntegrationItem fromContact(JsonNode contact) {
    String id = contact.path("id").asText("");
    JsonNode properties = contact.path("properties");
    String fullName =
        (text(properties, "firstname") + " " + text(properties, "lastname")).trim();
    String name = firstNonBlank(fullName, text(properties, "email"), id);
    return new IntegrationItem(id + "_contact", IntegrationItemType.CONTACT, name, null);
  }

  /** Name order: company name, then domain, then the HubSpot id. */
  public static IntegrationItem fromCompany(JsonNode company) {
    String id = company.path("id").asText("");
    JsonNode properties = company.path("properties");
    String name = firstNonBlank(text(properties, "name"), text(properties, "domain"), id);
    return new IntegrationItem(id + "_company", IntegrationItemType.COMPANY, name, null);
  }

  private static String text(JsonNode properties, String field) {
    JsonNode node = properties.path(field);
    return node.isNull() || node.isMissingNode() ? "" : node.asText("");
  }

  private static String firstNonBlank(String... values) {
    for (String v : values) {
      if (v != null && !v.isBlank()) return v;
    }
    return "";
  }
}
