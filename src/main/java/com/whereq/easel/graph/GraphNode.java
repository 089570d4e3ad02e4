package com.whereq.easel.graph;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One operation of a {@link NodeGraph}: its class and its inputs.
 *
 * An input value is either a literal (string, number, boolean, list, map) or an edge,
 * a two-element list {@code [sourceNodeId, outputIndex]}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GraphNode {

    @JsonProperty("class_type")
    private String classType;

    private Map<String, Object> inputs;

    /**
     * Fields the engine accepts but this service does not interpret, such as {@code _meta}
     */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    public GraphNode(String classType, Map<String, Object> inputs) {
        this(classType, inputs, new LinkedHashMap<>());
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extra.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    GraphNode deepCopy() {
        return new GraphNode(
            classType,
            inputs == null ? null : NodeGraph.copyMap(inputs),
            NodeGraph.copyMap(extra));
    }
}
