package io.crmconnect.backend.hubspot.model;

public record IntegrationItem(String id, IntegrationItemType type, String name, String url) {}
