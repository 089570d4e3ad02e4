package com.whereq.easel.client;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Opens the engine's event channel for one client id.
 *
 * The channel stays open for the lifetime of the Mono returned by {@code session} and is
 * closed on every exit path. Events received before the session subscribes to the flux
 * are retained, so a submission made inside the session cannot miss its own events.
 */
public interface ExecutionEventSource {

    <T> Mono<T> open(String clientId, Function<Flux<ExecutionEvent>, Mono<T>> session);
}
