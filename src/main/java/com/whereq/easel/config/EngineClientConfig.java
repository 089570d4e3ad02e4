package com.whereq.easel.config;

import com.whereq.easel.client.MonotonicClock;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.netty.http.client.HttpClient;

/**
 * Transport beans for the execution engine: HTTP client and event channel client
 */
@Slf4j
@Configuration
public class EngineClientConfig {

    @Bean
    public WebClient engineWebClient(EaselProperties properties) {
        EaselProperties.EngineConfig engine = properties.getEngine();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis(properties))
            .responseTimeout(properties.getTimeouts().getWs());

        WebClient.Builder builder = WebClient.builder()
            .baseUrl(stripTrailingSlash(engine.getBaseUrl()))
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(engine.getMaxInMemorySize()));

        if (engine.getApiKey() != null && !engine.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + engine.getApiKey());
        }

        log.info("Engine client configured: baseUrl={}, auth={}",
            engine.getBaseUrl(), engine.getApiKey() != null && !engine.getApiKey().isBlank());
        return builder.build();
    }

    @Bean
    public WebSocketClient engineWebSocketClient(EaselProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis(properties));
        return new ReactorNettyWebSocketClient(httpClient);
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.SYSTEM;
    }

    static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static int connectTimeoutMillis(EaselProperties properties) {
        return (int) Math.min(Integer.MAX_VALUE, properties.getTimeouts().getWs().toMillis());
    }
}
