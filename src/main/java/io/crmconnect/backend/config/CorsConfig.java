package io.crmconnect.backend.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

/**
 * Cross-origin access for the frontend that starts the connect popup and later collects the
 * credentials. The OAuth callback itself is a top-level navigation from HubSpot and needs none.
 */
@Configuration
public class CorsConfig {

  @Bean
  public CorsWebFilter corsWebFilter(
      @Value("${app.cors.allowed-origins:http://localhost:3000}") String allowedOrigins) {
    CorsConfiguration config = new CorsConfiguration();
    config.setAllowCredentials(false);
    parseOrigins(allowedOrigins).forEach(config::addAllowedOrigin);
    config.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.POST.name()));
    config.setAllowedHeaders(List.of(HttpHeaders.CONTENT_TYPE, HttpHeaders.ACCEPT));
    config.setMaxAge(Duration.ofHours(1));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/integrations/**", config);
    return new CorsWebFilter(source);
  }

  static List<String> parseOrigins(String allowedOrigins) {
    if (allowedOrigins == null || allowedOrigins.isBlank()) return List.of();
    return Arrays.stream(allowedOrigins.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
