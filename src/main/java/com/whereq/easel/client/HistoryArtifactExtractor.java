package com.whereq.easel.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.model.MediaArtifact;
import com.whereq.easel.model.MediaKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the artifact list of a finished prompt from its history entry.
 *
 * Output nodes are classified against the save nodes of the submitted graph:
 * <ol>
 *     <li>videos: outputs of {@code SaveVideo} nodes, or of any node flagged {@code animated}</li>
 *     <li>images: {@code images} of the remaining nodes, restricted to {@code SaveImage} nodes when the graph has any</li>
 *     <li>audio: {@code audio}/{@code audios} of any node</li>
 * </ol>
 * When none of these yields anything, every recognized output field of every node is taken.
 * That fallback can pick up intermediate outputs; it is best-effort by intent.
 */
@Slf4j
@Component
public class HistoryArtifactExtractor {

    static final String SAVE_IMAGE = "SaveImage";
    static final String SAVE_VIDEO = "SaveVideo";
    static final String SAVE_AUDIO = "SaveAudio";

    private static final List<String> FALLBACK_FIELDS = List.of("videos", "images", "audio", "audios");

    private final String baseUrl;

    @Autowired
    public HistoryArtifactExtractor(EaselProperties properties) {
        this(properties.getEngine().getBaseUrl());
    }

    HistoryArtifactExtractor(String baseUrl) {
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    /**
     * @param entry history entry of one prompt ({@code {"outputs": {...}}})
     * @param graph the graph that was submitted
     */
    public List<MediaArtifact> extract(JsonNode entry, NodeGraph graph) {
        JsonNode outputs = entry.path("outputs");
        Set<String> imageNodes = graph.nodeIdsOfClass(SAVE_IMAGE);
        Set<String> videoNodes = graph.nodeIdsOfClass(SAVE_VIDEO);
        log.debug("History outputs: nodes={}, saveImage={}, saveVideo={}, saveAudio={}",
            outputs.size(), imageNodes, videoNodes, graph.nodeIdsOfClass(SAVE_AUDIO));

        List<MediaArtifact> artifacts = new ArrayList<>();

        forEachOutput(outputs, (nodeId, out) -> {
            if (!isVideoNode(nodeId, out, videoNodes)) {
                return;
            }
            String field = out.has("videos") ? "videos" : out.has("images") ? "images" : null;
            if (field != null) {
                addFiles(artifacts, out.path(field), MediaKind.VIDEO);
            }
        });

        forEachOutput(outputs, (nodeId, out) -> {
            if (isVideoNode(nodeId, out, videoNodes) || !out.has("images")) {
                return;
            }
            if (!imageNodes.isEmpty() && !imageNodes.contains(nodeId)) {
                return;
            }
            addFiles(artifacts, out.path("images"), MediaKind.IMAGE);
        });

        forEachOutput(outputs, (nodeId, out) -> {
            if (out.has("audio")) {
                addFiles(artifacts, out.path("audio"), MediaKind.AUDIO);
            } else if (out.has("audios")) {
                addFiles(artifacts, out.path("audios"), MediaKind.AUDIO);
            }
        });

        if (artifacts.isEmpty()) {
            log.debug("No media matched save nodes, scanning raw outputs");
            forEachOutput(outputs, (nodeId, out) -> {
                for (String field : FALLBACK_FIELDS) {
                    if (!out.has(field)) {
                        continue;
                    }
                    MediaKind kind;
                    if (field.equals("videos") || isAnimated(out)) {
                        kind = MediaKind.VIDEO;
                    } else if (field.startsWith("audio")) {
                        kind = MediaKind.AUDIO;
                    } else {
                        kind = MediaKind.IMAGE;
                    }
                    addFiles(artifacts, out.path(field), kind);
                }
            });
        }
        return artifacts;
    }

    private void addFiles(List<MediaArtifact> artifacts, JsonNode files, MediaKind kind) {
        if (!files.isArray()) {
            return;
        }
        for (JsonNode file : files) {
            String filename = file.path("filename").asText("");
            if (filename.isEmpty()) {
                continue;
            }
            String subfolder = file.path("subfolder").asText("");
            String type = file.path("type").asText("output");
            artifacts.add(MediaArtifact.builder()
                .url(viewUrl(filename, subfolder, type))
                .filename(filename)
                .subfolder(subfolder)
                .kind(kind)
                .mimeType(MediaTypes.guess(kind, filename))
                .build());
        }
    }

    String viewUrl(String filename, String subfolder, String type) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/view")
            .queryParam("filename", filename)
            .queryParam("subfolder", subfolder)
            .queryParam("type", type)
            .encode()
            .build()
            .toUriString();
    }

    private static boolean isVideoNode(String nodeId, JsonNode out, Set<String> videoNodes) {
        return videoNodes.contains(nodeId) || isAnimated(out);
    }

    /**
     * {@code animated} is a boolean or, from animated save nodes, an array of booleans
     */
    private static boolean isAnimated(JsonNode out) {
        JsonNode animated = out.path("animated");
        if (animated.isBoolean()) {
            return animated.booleanValue();
        }
        if (animated.isArray()) {
            for (JsonNode flag : animated) {
                if (flag.asBoolean(false)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void forEachOutput(JsonNode outputs, OutputVisitor visitor) {
        Iterator<Map.Entry<String, JsonNode>> it = outputs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            visitor.visit(entry.getKey(), entry.getValue());
        }
    }

    @FunctionalInterface
    private interface OutputVisitor {
        void visit(String nodeId, JsonNode output);
    }
}
