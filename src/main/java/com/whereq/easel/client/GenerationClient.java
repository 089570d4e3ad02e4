package com.whereq.easel.client;

import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.model.GenerationResult;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Client for a node-graph execution engine
 */
public interface GenerationClient {

    /**
     * Submit a rendered graph and follow it to completion.
     *
     * Fails with {@link com.whereq.easel.exception.EngineExecutionException} when the engine
     * reports an execution error, {@link com.whereq.easel.exception.GenerationTimeoutException}
     * when {@code runTimeout} elapses first, and
     * {@link com.whereq.easel.exception.EngineProtocolException} for transport or format problems.
     */
    Mono<GenerationResult> submitAndTrack(NodeGraph graph, Duration runTimeout);

    /**
     * Upload an input image; emits the filename the engine stored it under
     */
    Mono<String> uploadInputAsset(byte[] content, String filename);

    Mono<byte[]> fetchArtifactBytes(String url);

    /**
     * Whether the engine currently answers
     */
    Mono<Boolean> healthCheck();
}
