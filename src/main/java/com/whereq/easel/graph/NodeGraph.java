package com.whereq.easel.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Execution plan understood by the remote engine: node id to {@link GraphNode}.
 *
 * Serializes to and from the engine's JSON form ({@code {"3": {"class_type": ..., "inputs": {...}}}}).
 * Node order is preserved, so equal graphs serialize to identical bytes.
 */
@EqualsAndHashCode
@ToString
public class NodeGraph {

    private final Map<String, GraphNode> nodes;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public NodeGraph(Map<String, GraphNode> nodes) {
        this.nodes = new LinkedHashMap<>(nodes);
    }

    @JsonValue
    public Map<String, GraphNode> asMap() {
        return Collections.unmodifiableMap(nodes);
    }

    public Optional<GraphNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Ids of nodes whose class equals the given class type
     */
    public Set<String> nodeIdsOfClass(String classType) {
        Set<String> ids = new LinkedHashSet<>();
        nodes.forEach((id, node) -> {
            if (classType.equals(node.getClassType())) {
                ids.add(id);
            }
        });
        return ids;
    }

    /**
     * Write a literal into a node's input slot.
     *
     * @return false if the node is not in the graph (it may have been pruned)
     */
    public boolean setInput(String nodeId, String inputKey, Object value) {
        GraphNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        if (node.getInputs() == null) {
            node.setInputs(new LinkedHashMap<>());
        }
        node.getInputs().put(inputKey, value);
        return true;
    }

    /**
     * Remove nodes and detach every input, on the remaining nodes, whose edge points at one of them.
     *
     * @return number of input entries that were detached
     */
    public int pruneNodes(Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return 0;
        }
        Set<String> removed = new HashSet<>(nodeIds);
        nodes.keySet().removeAll(removed);

        int detached = 0;
        for (GraphNode node : nodes.values()) {
            Map<String, Object> inputs = node.getInputs();
            if (inputs == null) {
                continue;
            }
            Iterator<Map.Entry<String, Object>> it = inputs.entrySet().iterator();
            while (it.hasNext()) {
                Optional<String> source = edgeSource(it.next().getValue());
                if (source.isPresent() && removed.contains(source.get())) {
                    it.remove();
                    detached++;
                }
            }
        }
        return detached;
    }

    public NodeGraph deepCopy() {
        Map<String, GraphNode> copy = new LinkedHashMap<>();
        nodes.forEach((id, node) -> copy.put(id, node.deepCopy()));
        return new NodeGraph(copy);
    }

    /**
     * Source node id of an edge value, empty for literals
     */
    public static Optional<String> edgeSource(Object value) {
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            if (!list.isEmpty() && list.get(0) instanceof String) {
                return Optional.of((String) list.get(0));
            }
        }
        return Optional.empty();
    }

    static Map<String, Object> copyMap(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copyMap((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<?> list = (List<?>) value;
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }
}
