package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a completed stage.
 *
 * @param stage      stage number
 * @param status     final status
 * @param content    Markdown summary of what the stage did
 * @param nodes      nodes of the committed graph
 * @param edges      valid edges of the committed graph
 * @param hyperedges valid hyperedges of the committed graph
 * @param timestamp  completion time
 * @param metadata   timing, token usage, confidence and stage-specific figures
 */
public record StageResult(
    @JsonProperty("stage") int stage,
    @JsonProperty("status") StageStatus status,
    @JsonProperty("content") String content,
    @JsonProperty("nodes") List<GraphNode> nodes,
    @JsonProperty("edges") List<GraphEdge> edges,
    @JsonProperty("hyperedges") List<HyperEdge> hyperedges,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("metadata") Metadata metadata
) {

    public StageResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");
        content = content != null ? content : "";
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        hyperedges = hyperedges != null ? List.copyOf(hyperedges) : List.of();
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /**
     * Result metadata.
     *
     * @param durationMs      wall time of the stage
     * @param tokenUsage      tokens used by the stage's model calls
     * @param confidenceScore aggregate confidence of the stage output [0.0, 1.0]
     * @param figures         stage-specific numbers, e.g. pruned and merged counts
     */
    public record Metadata(
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("token_usage") TokenUsage tokenUsage,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("figures") Map<String, Number> figures
    ) {
        public Metadata {
            tokenUsage = tokenUsage != null ? tokenUsage : TokenUsage.ZERO;
            figures = figures != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(figures))
                : Map.of();
        }
    }
}
