package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relation carried by a {@link GraphEdge}.
 */
public enum EdgeType {
    SUPPORTIVE("supportive"),
    CONTRADICTORY("contradictory"),
    CORRELATIVE("correlative"),
    CAUSAL("causal"),
    TEMPORAL("temporal"),
    PREREQUISITE("prerequisite");

    private final String value;

    EdgeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EdgeType fromValue(String value) {
        for (EdgeType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown edge type: " + value);
    }
}
