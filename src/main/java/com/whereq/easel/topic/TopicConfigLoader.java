package com.whereq.easel.topic;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.easel.exception.TopicConfigurationException;
import com.whereq.easel.graph.GraphNode;
import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.graph.NodeRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads one topic directory: {@code meta.json}, {@code nodes.json} and {@code workflow.json}.
 *
 * The directory name is the topic alias.
 */
@Slf4j
@Component
public class TopicConfigLoader {

    static final String META_FILE = "meta.json";
    static final String NODES_FILE = "nodes.json";
    static final String WORKFLOW_FILE = "workflow.json";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public TopicConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load and validate a topic.
     *
     * @param topicDir directory of the topic
     * @return the topic
     * @throws TopicConfigurationException if a file is missing or malformed, a rule is invalid,
     *     or a rule targets a node that is absent or has no inputs
     */
    public TopicConfig load(Path topicDir) {
        String alias = topicDir.getFileName().toString();

        JsonNode meta = readTree(topicDir.resolve(META_FILE), alias);
        JsonNode nodes = readTree(topicDir.resolve(NODES_FILE), alias);
        NodeGraph workflow = readWorkflow(topicDir.resolve(WORKFLOW_FILE), alias);

        List<NodeRule> rules = parseRules(nodes.path("nodes"), alias);
        validate(rules, workflow, alias);

        TopicConfig topic = TopicConfig.builder()
            .alias(alias)
            .title(Optional.ofNullable(textOrNull(meta.get("title"))).orElse(alias))
            .description(textOrNull(meta.get("description")))
            .workflow(workflow)
            .rules(rules)
            .nodeDefaults(toMap(nodes.get("defaults"), alias))
            .defaults(toMap(meta.get("defaults"), alias))
            .inlineAllowed(parseAllowed(meta.get("inline_allowed")))
            .inlineLimits(parseLimits(meta.get("inline_limits")))
            .build();

        log.debug("Topic {} parsed: nodes={}, rules={}", alias, workflow.size(), rules.size());
        return topic;
    }

    private List<NodeRule> parseRules(JsonNode array, String alias) {
        List<NodeRule> rules = new ArrayList<>();
        if (array.isMissingNode() || array.isNull()) {
            return rules;
        }
        if (!array.isArray()) {
            throw new TopicConfigurationException("Topic " + alias + ": 'nodes' must be an array");
        }
        for (JsonNode entry : array) {
            List<String> nodeIds = new ArrayList<>();
            for (JsonNode id : entry.path("node_ids")) {
                nodeIds.add(id.asText());
            }
            JsonNode param = entry.get("param");
            String paramName = param != null && param.isValueNode() ? param.asText().trim() : null;
            try {
                rules.add(NodeRule.of(
                    textOrNull(entry.get("type")),
                    nodeIds,
                    textOrNull(entry.get("key")),
                    paramName == null || paramName.isEmpty() ? null : paramName));
            } catch (IllegalArgumentException e) {
                throw new TopicConfigurationException("Topic " + alias + ": " + e.getMessage(), e);
            }
        }
        return rules;
    }

    private void validate(List<NodeRule> rules, NodeGraph workflow, String alias) {
        for (NodeRule rule : rules) {
            for (String nodeId : rule.getNodeIds()) {
                GraphNode node = workflow.node(nodeId).orElseThrow(() -> new TopicConfigurationException(
                    "Topic " + alias + ": rule '" + rule.getDeclaredKind()
                        + "' references node " + nodeId + " absent in " + WORKFLOW_FILE));
                if (node.getInputs() == null) {
                    throw new TopicConfigurationException(
                        "Topic " + alias + ": workflow node " + nodeId + " has no 'inputs'");
                }
            }
        }
    }

    private JsonNode readTree(Path file, String alias) {
        if (!Files.isRegularFile(file)) {
            throw new TopicConfigurationException("Topic " + alias + ": missing " + file.getFileName());
        }
        try {
            JsonNode tree = objectMapper.readTree(file.toFile());
            if (tree == null || !tree.isObject()) {
                throw new TopicConfigurationException(
                    "Topic " + alias + ": " + file.getFileName() + " is not a JSON object");
            }
            return tree;
        } catch (IOException e) {
            throw new TopicConfigurationException(
                "Topic " + alias + ": cannot read " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private NodeGraph readWorkflow(Path file, String alias) {
        JsonNode tree = readTree(file, alias);
        try {
            return objectMapper.treeToValue(tree, NodeGraph.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new TopicConfigurationException(
                "Topic " + alias + ": malformed " + WORKFLOW_FILE + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Object> toMap(JsonNode node, String alias) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new TopicConfigurationException("Topic " + alias + ": defaults must be an object");
        }
        return new LinkedHashMap<>(objectMapper.convertValue(node, MAP_TYPE));
    }

    /**
     * A non-list value means no restriction
     */
    private static Set<String> parseAllowed(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        Set<String> allowed = new LinkedHashSet<>();
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                allowed.add(item.asText().toLowerCase(Locale.ROOT));
            }
        }
        return Set.copyOf(allowed);
    }

    private static Map<String, NumericLimit> parseLimits(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        Map<String, NumericLimit> limits = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            JsonNode bounds = entry.getValue();
            if (!bounds.isObject()) {
                return;
            }
            Double min = bounds.path("min").isNumber() ? bounds.path("min").doubleValue() : null;
            Double max = bounds.path("max").isNumber() ? bounds.path("max").doubleValue() : null;
            limits.put(entry.getKey().toLowerCase(Locale.ROOT), new NumericLimit(min, max));
        });
        return limits;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
