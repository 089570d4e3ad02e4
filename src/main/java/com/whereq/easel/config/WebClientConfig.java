package com.whereq.easel.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * WebClient for requester callbacks. Payloads carry base64 media, hence the large buffer.
 */
@Configuration
public class WebClientConfig {

    private static final int CALLBACK_CONNECT_TIMEOUT_MILLIS = 5_000;

    @Bean
    public WebClient.Builder webClientBuilder(EaselProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CALLBACK_CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(Duration.ofSeconds(10));

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(properties.getEngine().getMaxInMemorySize()));
    }
}
