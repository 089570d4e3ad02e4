package com.whereq.easel.template;

import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.graph.NodeRule;
import com.whereq.easel.graph.RuleKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Turns a topic's parameterized node graph into a concrete graph for one request.
 *
 * Rules are applied in fixed passes: prompt, negative prompt, named text fields,
 * single input image, input image lists (with pruning of unused image nodes), then
 * scalar parameters. Later passes see the graph left by earlier ones, so the order
 * is part of the contract. The template and parameters are never modified.
 */
@Slf4j
@Component
public class WorkflowTemplateEngine {

    public static final String SEED = "seed";
    public static final String NEGATIVE_PROMPT = "negative_prompt";
    public static final String INPUT_IMAGE = "input_image";
    public static final String INPUT_IMAGES = "input_images";

    private static final long SEED_BOUND = 1L << 48;

    private final LongSupplier seedSource;

    public WorkflowTemplateEngine() {
        this(() -> ThreadLocalRandom.current().nextLong(SEED_BOUND));
    }

    WorkflowTemplateEngine(LongSupplier seedSource) {
        this.seedSource = seedSource;
    }

    /**
     * Render a concrete graph.
     *
     * Referential integrity of rules against the template is checked when the topic is
     * loaded, not here.
     *
     * @param template node graph template
     * @param rules    mapping rules, in declaration order
     * @param prompt   positive prompt
     * @param params   runtime parameters; names are matched case-insensitively
     * @return a new graph
     */
    public NodeGraph render(NodeGraph template, List<NodeRule> rules, String prompt, Map<String, Object> params) {
        NodeGraph graph = template.deepCopy();
        Map<String, Object> effective = effectiveParams(params);

        for (NodeRule rule : rules) {
            if (rule.getKind() == RuleKind.PROMPT) {
                writeAll(graph, rule, prompt);
            }
        }

        for (NodeRule rule : rules) {
            if (rule.getKind() == RuleKind.NEGATIVE_PROMPT) {
                writeIfPresent(graph, rule, effective.get(NEGATIVE_PROMPT));
            }
        }

        for (NodeRule rule : rules) {
            if (rule.getKind() == RuleKind.TEXT && rule.getParamKey() != null) {
                writeIfPresent(graph, rule, effective.get(rule.getParamKey()));
            }
        }

        for (NodeRule rule : rules) {
            if (rule.getKind() == RuleKind.INPUT_IMAGE) {
                Object filename = effective.get(INPUT_IMAGE);
                if (filename != null) {
                    graph.setInput(rule.getNodeIds().get(0), rule.getInputKey(), filename);
                }
            }
        }

        for (NodeRule rule : rules) {
            if (rule.getKind() == RuleKind.INPUT_IMAGES) {
                applyImageList(graph, rule, effective.get(INPUT_IMAGES));
            }
        }

        for (NodeRule rule : rules) {
            if (rule.getKind() == RuleKind.SCALAR) {
                writeIfPresent(graph, rule, effective.get(rule.getParamKey()));
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Workflow rendered: nodes={}, seed={}", graph.size(), effective.get(SEED));
        }
        return graph;
    }

    private void applyImageList(NodeGraph graph, NodeRule rule, Object value) {
        List<String> nodeIds = rule.getNodeIds();
        List<?> filenames = value instanceof List ? (List<?>) value : List.of();

        int used = Math.min(filenames.size(), nodeIds.size());
        for (int i = 0; i < used; i++) {
            graph.setInput(nodeIds.get(i), rule.getInputKey(), filenames.get(i));
        }

        if (used < nodeIds.size()) {
            List<String> unused = nodeIds.subList(used, nodeIds.size());
            int detached = graph.pruneNodes(unused);
            log.debug("Pruned image nodes {} ({} inputs detached)", unused, detached);
        }
    }

    private Map<String, Object> effectiveParams(Map<String, Object> params) {
        Map<String, Object> effective = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    effective.put(key, value);
                }
            });
        }
        if (!effective.containsKey(SEED)) {
            long seed = seedSource.getAsLong();
            effective.put(SEED, seed);
            log.debug("Generated random seed: {}", seed);
        }
        return effective;
    }

    private static void writeIfPresent(NodeGraph graph, NodeRule rule, Object value) {
        if (value != null) {
            writeAll(graph, rule, value);
        }
    }

    private static void writeAll(NodeGraph graph, NodeRule rule, Object value) {
        for (String nodeId : rule.getNodeIds()) {
            graph.setInput(nodeId, rule.getInputKey(), value);
        }
    }
}
