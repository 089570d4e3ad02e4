package com.whereq.easel.client;

import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.exception.EngineProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Event channel over the engine's WebSocket endpoint ({@code /ws?clientId=...})
 */
@Slf4j
@Component
public class WebSocketEventSource implements ExecutionEventSource {

    private final WebSocketClient client;
    private final ExecutionEventParser parser;
    private final String baseUrl;
    private final String apiKey;

    public WebSocketEventSource(@Qualifier("engineWebSocketClient") WebSocketClient client,
                                ExecutionEventParser parser,
                                EaselProperties properties) {
        this.client = client;
        this.parser = parser;
        this.baseUrl = properties.getEngine().getBaseUrl();
        this.apiKey = properties.getEngine().getApiKey();
    }

    @Override
    public <T> Mono<T> open(String clientId, Function<Flux<ExecutionEvent>, Mono<T>> session) {
        URI uri = eventChannelUri(baseUrl, clientId);
        HttpHeaders headers = new HttpHeaders();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        AtomicReference<T> result = new AtomicReference<>();
        return client.execute(uri, headers, ws -> {
                log.debug("Event channel open: clientId={}", clientId);
                // autoConnect(0) starts reading at once so frames are buffered until the session subscribes
                Flux<ExecutionEvent> events = ws.receive()
                    .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                    .map(WebSocketMessage::getPayloadAsText)
                    .map(parser::parse)
                    .replay()
                    .autoConnect(0);
                return session.apply(events)
                    .doOnNext(result::set)
                    .then(ws.close());
            })
            .onErrorMap(e -> !(e instanceof RuntimeException) || isTransportError(e),
                e -> new EngineProtocolException("Event channel failed: " + e.getMessage(), e))
            .then(Mono.fromSupplier(result::get))
            .doFinally(signal -> log.debug("Event channel closed: clientId={}, signal={}", clientId, signal));
    }

    static URI eventChannelUri(String baseUrl, String clientId) {
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String wsBase;
        if (trimmed.startsWith("https://")) {
            wsBase = "wss://" + trimmed.substring("https://".length());
        } else if (trimmed.startsWith("http://")) {
            wsBase = "ws://" + trimmed.substring("http://".length());
        } else {
            wsBase = trimmed;
        }
        return UriComponentsBuilder.fromUriString(wsBase + "/ws")
            .queryParam("clientId", clientId)
            .encode()
            .build()
            .toUri();
    }

    private static boolean isTransportError(Throwable e) {
        String name = e.getClass().getName();
        return name.startsWith("io.netty.") || name.startsWith("reactor.netty.");
    }
}
