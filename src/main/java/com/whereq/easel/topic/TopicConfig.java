package com.whereq.easel.topic;

import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.graph.NodeRule;
import com.whereq.easel.graph.RuleKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A loaded topic: its workflow template, mapping rules and parameter policy
 */
@Value
@Builder
public class TopicConfig {

    String alias;

    String title;

    String description;

    /**
     * Template graph; never mutated, rendering works on a copy
     */
    NodeGraph workflow;

    @Builder.Default
    List<NodeRule> rules = List.of();

    /**
     * Defaults declared next to the rules, lowest precedence
     */
    @Builder.Default
    Map<String, Object> nodeDefaults = Map.of();

    /**
     * Topic-level defaults, override {@link #nodeDefaults}
     */
    @Builder.Default
    Map<String, Object> defaults = Map.of();

    /**
     * Lower-case names a request may override; {@code null} allows every name
     */
    Set<String> inlineAllowed;

    @Builder.Default
    Map<String, NumericLimit> inlineLimits = Map.of();

    public boolean hasRule(RuleKind kind) {
        return rules.stream().anyMatch(rule -> rule.getKind() == kind);
    }

    public boolean isInlineAllowed(String name) {
        return inlineAllowed == null || inlineAllowed.contains(name);
    }
}
