package com.whereq.easel.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NodeRuleTest {

    @Test
    void resolvesKnownKinds() {
        assertEquals(RuleKind.PROMPT, NodeRule.of("Prompt", List.of("5"), "text", null).getKind());
        assertEquals(RuleKind.NEGATIVE_PROMPT, NodeRule.of("negative_prompt", List.of("6"), "text", null).getKind());
        assertEquals(RuleKind.INPUT_IMAGE, NodeRule.of("input_image", List.of("1"), "image", null).getKind());
        assertEquals(RuleKind.INPUT_IMAGES, NodeRule.of("input_images", List.of("1", "2"), "image", null).getKind());
    }

    @Test
    void textKinds_takeParamFromSuffixOrParamName() {
        NodeRule suffixed = NodeRule.of("text:Caption", List.of("8"), "text", "ignored");
        assertEquals(RuleKind.TEXT, suffixed.getKind());
        assertEquals("caption", suffixed.getParamKey());

        NodeRule named = NodeRule.of("string", List.of("8"), "text", "style");
        assertEquals(RuleKind.TEXT, named.getKind());
        assertEquals("style", named.getParamKey());

        assertNull(NodeRule.of("text", List.of("8"), "text", null).getParamKey());
    }

    @Test
    void unknownKind_isScalarKeyedByKind() {
        NodeRule rule = NodeRule.of(" Steps ", List.of("3"), "steps", null);

        assertEquals(RuleKind.SCALAR, rule.getKind());
        assertEquals("steps", rule.getParamKey());
        assertEquals("steps", rule.getDeclaredKind());
    }

    @Test
    void rejectsIncompleteRules() {
        assertThrows(IllegalArgumentException.class, () -> NodeRule.of(" ", List.of("1"), "text", null));
        assertThrows(IllegalArgumentException.class, () -> NodeRule.of("prompt", List.of(), "text", null));
        assertThrows(IllegalArgumentException.class, () -> NodeRule.of("prompt", List.of("1"), "", null));
    }
}
