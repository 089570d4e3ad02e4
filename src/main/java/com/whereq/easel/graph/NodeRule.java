package com.whereq.easel.graph;

import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Declares how one logical parameter maps onto input slots of one or more graph nodes.
 *
 * Order of {@link #getNodeIds()} matters for sequential assignment (multiple input images).
 */
@Value
public class NodeRule {

    RuleKind kind;

    /**
     * Kind string as declared in the topic, normalized to lower case
     */
    String declaredKind;

    List<String> nodeIds;

    /**
     * Input slot written on every target node
     */
    String inputKey;

    /**
     * Name looked up in the parameter set; {@code null} for prompt rules and for
     * text rules that name no parameter
     */
    String paramKey;

    /**
     * Resolve a declared rule.
     *
     * @param kind      free-form kind string, e.g. {@code prompt}, {@code text:caption}, {@code width}
     * @param nodeIds   target node ids, in assignment order
     * @param inputKey  input slot name on the target nodes
     * @param paramName explicit parameter name, used by plain {@code text}/{@code string} rules
     * @return the resolved rule
     * @throws IllegalArgumentException if kind or input key is blank or no node id is given
     */
    public static NodeRule of(String kind, List<String> nodeIds, String inputKey, String paramName) {
        String normalized = kind == null ? "" : kind.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Rule kind must not be blank");
        }
        if (inputKey == null || inputKey.isBlank()) {
            throw new IllegalArgumentException("Rule '" + normalized + "' has no input key");
        }
        if (nodeIds == null || nodeIds.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + normalized + "' targets no nodes");
        }

        RuleKind resolved = RuleKind.resolve(normalized);
        String paramKey;
        switch (resolved) {
            case PROMPT:
                paramKey = null;
                break;
            case TEXT:
                int colon = normalized.indexOf(':');
                if (colon >= 0) {
                    paramKey = blankToNull(normalized.substring(colon + 1));
                } else {
                    paramKey = paramName == null ? null : blankToNull(paramName);
                }
                break;
            default:
                paramKey = normalized;
        }
        return new NodeRule(resolved, normalized, List.copyOf(nodeIds), inputKey.trim(), paramKey);
    }

    private static String blankToNull(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
