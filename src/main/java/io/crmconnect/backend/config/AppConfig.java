package io.crmconnect.backend.config;

import io.crmconnect.backend.hubspot.HubSpotProperties;
import io.netty.channel.ChannelOption;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class AppConfig {

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
    return new StringRedisTemplate(cf);
  }

  /** Drives TTL arithmetic in the fallback store; tests swap in a controllable clock. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Client for the HubSpot token and CRM endpoints. Connect and response timeouts follow
   * {@code app.hubspot.http-timeout-seconds} so a hung socket fails before the per-call timeout.
   */
  @Bean
  public WebClient webClient(HubSpotProperties hubspot) {
    int connectMillis = (int) Math.min(Integer.MAX_VALUE, hubspot.httpTimeout().toMillis());
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectMillis)
            .responseTimeout(hubspot.httpTimeout());

    // Token responses and CRM list pages of page-limit rows stay well under this.
    ExchangeStrategies strategies =
        ExchangeStrategies.builder()
            .codecs(c -> c.defaultCodecs().maxInMemorySize(512 * 1024))
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .exchangeStrategies(strategies)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
