package com.whereq.easel.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.easel.exception.AssetUploadException;
import com.whereq.easel.exception.EngineProtocolException;
import com.whereq.easel.graph.NodeGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP endpoints of the execution engine.
 *
 * Base URL, bearer token and response timeout are configured on the injected {@link WebClient}.
 */
@Slf4j
@Component
public class ComfyHttpApi {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final WebClient webClient;

    public ComfyHttpApi(@Qualifier("engineWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * POST /prompt
     *
     * @return engine prompt id
     */
    public Mono<String> queuePrompt(NodeGraph graph, String clientId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", graph);
        body.put("client_id", clientId);

        return webClient.post()
            .uri("/prompt")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(text -> new EngineProtocolException(
                    "Prompt rejected by engine: HTTP " + response.statusCode().value() + " " + text)))
            .bodyToMono(JsonNode.class)
            .flatMap(json -> {
                String promptId = json.path("prompt_id").asText("");
                if (promptId.isEmpty()) {
                    return Mono.error(new EngineProtocolException("Engine response has no prompt_id: " + json));
                }
                log.info("Prompt queued: promptId={}, nodes={}", promptId, graph.size());
                return Mono.just(promptId);
            });
    }

    /**
     * GET /history/{promptId}
     *
     * @return the history entry keyed by the prompt id
     */
    public Mono<JsonNode> history(String promptId) {
        return webClient.get()
            .uri("/history/{promptId}", promptId)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> Mono.just(new EngineProtocolException(
                "History request failed for prompt " + promptId + ": HTTP " + response.statusCode().value())))
            .bodyToMono(JsonNode.class)
            .flatMap(json -> {
                JsonNode entry = json.path(promptId);
                if (entry.isMissingNode() || entry.isNull()) {
                    return Mono.error(new EngineProtocolException("No history entry for prompt " + promptId));
                }
                return Mono.just(entry);
            });
    }

    /**
     * Download an artifact, typically a /view URL produced by {@link HistoryArtifactExtractor}
     */
    public Mono<byte[]> download(String url) {
        // URI object: the URL is already encoded and must not be encoded again
        return webClient.get()
            .uri(URI.create(url))
            .retrieve()
            .bodyToMono(byte[].class)
            .onErrorMap(WebClientResponseException.class, e -> new EngineProtocolException(
                "Artifact download failed: HTTP " + e.getStatusCode().value() + " " + url, e))
            .doOnNext(bytes -> log.debug("Downloaded {} bytes from {}", bytes.length, url));
    }

    /**
     * POST /upload/image as multipart, into the engine's input area
     *
     * @return the stored filename, which may differ from the one sent
     */
    public Mono<String> uploadImage(byte[] content, String filename) {
        MultipartBodyBuilder parts = new MultipartBodyBuilder();
        parts.part("image", new NamedByteArrayResource(content, filename))
            .contentType(MediaType.parseMediaType(MediaTypes.uploadContentType(filename)));
        parts.part("type", "input");

        return webClient.post()
            .uri("/upload/image")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(parts.build()))
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(text -> new AssetUploadException(
                    "Upload of " + filename + " failed: HTTP " + response.statusCode().value() + " " + text)))
            .bodyToMono(JsonNode.class)
            .flatMap(json -> {
                String name = json.path("name").asText("");
                if (name.isEmpty()) {
                    return Mono.error(new AssetUploadException("Upload response has no name: " + json));
                }
                log.info("Uploaded input image {} as {}", filename, name);
                return Mono.just(name);
            })
            .onErrorMap(e -> !(e instanceof AssetUploadException),
                e -> new AssetUploadException("Upload of " + filename + " failed: " + e.getMessage(), e));
    }

    /**
     * GET /object_info; true when the engine answers with a success status
     */
    public Mono<Boolean> probe() {
        return webClient.get()
            .uri("/object_info")
            .retrieve()
            .toBodilessEntity()
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .timeout(PROBE_TIMEOUT)
            .onErrorResume(e -> {
                log.warn("Engine probe failed: {}", e.getMessage());
                return Mono.just(false);
            });
    }

    /**
     * Multipart file parts need a filename, which a plain ByteArrayResource does not carry
     */
    private static final class NamedByteArrayResource extends ByteArrayResource {

        private final String filename;

        NamedByteArrayResource(byte[] content, String filename) {
            super(content);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }
    }
}
