package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Seeded session knowledge (communication, content and user profile preferences).
 *
 * @param category   knowledge category, e.g. "communication_preferences"
 * @param attributes free-form key/value preferences
 */
public record KnowledgeDetails(
    @JsonProperty("category") String category,
    @JsonProperty("attributes") Map<String, String> attributes
) {
    public KnowledgeDetails {
        attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Map.of();
    }
}
