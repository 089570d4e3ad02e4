package com.whereq.easel.client;

import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.model.GenerationResult;
import com.whereq.easel.model.MediaArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * {@link GenerationClient} for ComfyUI-compatible engines.
 *
 * Every submission uses a fresh client id and its own event channel, opened before the
 * prompt is posted.
 */
@Slf4j
@Service
public class ComfyGenerationClient implements GenerationClient {

    private final ComfyHttpApi httpApi;
    private final ExecutionEventSource eventSource;
    private final ExecutionMonitor monitor;
    private final HistoryArtifactExtractor extractor;
    private final MonotonicClock clock;

    public ComfyGenerationClient(ComfyHttpApi httpApi,
                                 ExecutionEventSource eventSource,
                                 ExecutionMonitor monitor,
                                 HistoryArtifactExtractor extractor,
                                 MonotonicClock clock) {
        this.httpApi = httpApi;
        this.eventSource = eventSource;
        this.monitor = monitor;
        this.extractor = extractor;
        this.clock = clock;
    }

    @Override
    public Mono<GenerationResult> submitAndTrack(NodeGraph graph, Duration runTimeout) {
        String clientId = UUID.randomUUID().toString();
        return eventSource.open(clientId, events -> httpApi.queuePrompt(graph, clientId)
            .flatMap(promptId -> {
                long submittedAt = clock.nanoTime();
                return monitor.await(promptId, events, submittedAt, runTimeout)
                    .flatMap(timings -> httpApi.history(promptId)
                        .map(entry -> {
                            List<MediaArtifact> artifacts = extractor.extract(entry, graph);
                            log.info("Prompt {} finished: artifacts={}, queue={}s, exec={}s", promptId,
                                artifacts.size(), format(timings.getQueueSeconds()), format(timings.getExecSeconds()));
                            return GenerationResult.builder()
                                .promptId(promptId)
                                .artifacts(artifacts)
                                .queueDurationSeconds(timings.getQueueSeconds())
                                .execDurationSeconds(timings.getExecSeconds())
                                .build();
                        }));
            }));
    }

    @Override
    public Mono<String> uploadInputAsset(byte[] content, String filename) {
        return httpApi.uploadImage(content, filename);
    }

    @Override
    public Mono<byte[]> fetchArtifactBytes(String url) {
        return httpApi.download(url);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return httpApi.probe();
    }

    private static String format(double seconds) {
        return String.format("%.2f", seconds);
    }
}
