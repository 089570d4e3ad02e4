package com.whereq.easel.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.exception.EngineProtocolException;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebSocketEventSourceTest {

    private final CountDownLatch connected = new CountDownLatch(1);

    private final CountDownLatch closed = new CountDownLatch(1);

    private DisposableServer engine;

    @BeforeEach
    void startEngine() {
        // the engine pushes frames right after the handshake and keeps the channel open until the client leaves
        engine = HttpServer.create()
            .host("127.0.0.1")
            .port(0)
            .route(routes -> routes.ws("/ws", (in, out) -> {
                in.withConnection(connection -> connection.onDispose(closed::countDown));
                connected.countDown();
                return out.sendObject(Flux.just(
                        new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[] {1, 2, 3})),
                        new TextWebSocketFrame(executing("\"3\"")),
                        new TextWebSocketFrame(executing("null"))))
                    .then()
                    .then(in.receive().then());
            }))
            .bindNow();
    }

    @AfterEach
    void stopEngine() {
        if (!engine.isDisposed()) {
            engine.disposeNow();
        }
    }

    private static String executing(String node) {
        return "{\"type\":\"executing\",\"data\":{\"node\":" + node + ",\"prompt_id\":\"p-1\"}}";
    }

    private WebSocketEventSource eventSource() {
        EaselProperties properties = new EaselProperties();
        properties.getEngine().setBaseUrl("http://127.0.0.1:" + engine.port());
        return new WebSocketEventSource(new ReactorNettyWebSocketClient(),
            new ExecutionEventParser(new ObjectMapper()), properties);
    }

    @Test
    void open_buffersFramesUntilSessionSubscribes() throws Exception {
        List<ExecutionEvent> events = eventSource()
            .open("client-1", flux -> Mono.delay(Duration.ofMillis(300)).thenMany(flux.take(2)).collectList())
            .block(Duration.ofSeconds(5));

        assertEquals(List.of(ExecutionEvent.executing("p-1", "3"), ExecutionEvent.executing("p-1", null)), events);
        assertTrue(closed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void open_sessionFailure_closesChannel() throws Exception {
        StepVerifier.create(eventSource().<String>open("client-2",
                flux -> flux.take(1).then(Mono.error(new IllegalStateException("session failed")))))
            .expectErrorMessage("session failed")
            .verify(Duration.ofSeconds(5));

        assertTrue(closed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void open_cancelled_closesChannel() throws Exception {
        Disposable subscription = eventSource().open("client-3", flux -> Mono.never()).subscribe();

        assertTrue(connected.await(5, TimeUnit.SECONDS));
        subscription.dispose();

        assertTrue(closed.await(5, TimeUnit.SECONDS));
    }

    @Test
    void open_engineDown_isProtocolError() {
        WebSocketEventSource eventSource = eventSource();
        engine.disposeNow();

        StepVerifier.create(eventSource.open("client-4", flux -> flux.then(Mono.just("done"))))
            .expectError(EngineProtocolException.class)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void eventChannelUri_followsHttpScheme() {
        assertEquals("ws://engine:8188/ws?clientId=abc",
            WebSocketEventSource.eventChannelUri("http://engine:8188", "abc").toString());
        assertEquals("wss://comfy.example.com/ws?clientId=abc",
            WebSocketEventSource.eventChannelUri("https://comfy.example.com/", "abc").toString());
    }

    @Test
    void eventChannelUri_keepsPathPrefix() {
        assertEquals("ws://gateway/engine/ws?clientId=c-1",
            WebSocketEventSource.eventChannelUri(" http://gateway/engine// ", "c-1").toString());
    }
}
