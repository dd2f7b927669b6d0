package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of concept a {@link GraphNode} represents.
 */
public enum NodeType {
    ROOT("root"),
    DIMENSION("dimension"),
    HYPOTHESIS("hypothesis"),
    EVIDENCE("evidence"),
    SYNTHESIS("synthesis"),
    REFLECTION("reflection"),
    BRIDGE("bridge"),
    GAP("gap"),
    KNOWLEDGE("knowledge");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + value);
    }
}
