package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Label of a {@link HyperEdge}.
 */
public enum HyperEdgeType {
    /** Evidence nodes sharing a disciplinary tag. */
    INTERDISCIPLINARY("interdisciplinary"),
    /** One hypothesis backed by several evidence nodes. */
    MULTI_CAUSAL("multi_causal"),
    /** Several strongly supported evidence nodes. */
    COMPLEX_RELATIONSHIP("complex_relationship"),
    /** Evidence cited together by a composed section. */
    SYNTHESIS("synthesis");

    private final String value;

    HyperEdgeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
