package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Directed relation between two nodes.
 *
 * <p>{@code confidence} and {@code weight} may be absent; {@link #resolved()} fills them
 * in (confidence defaults to 0.5, weight to the confidence).</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphEdge(
    @JsonProperty("id") String id,
    @JsonProperty("source") String source,
    @JsonProperty("target") String target,
    @JsonProperty("type") EdgeType type,
    @JsonProperty("confidence") @Nullable Double confidence,
    @JsonProperty("weight") @Nullable Double weight
) {

    public static final double DEFAULT_CONFIDENCE = 0.5;

    public GraphEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0], got: " + confidence);
        }
    }

    /**
     * Creates an edge whose weight equals its confidence.
     */
    public static GraphEdge of(@NotNull String id, @NotNull String source, @NotNull String target,
                               @NotNull EdgeType type, double confidence) {
        double c = ConfidenceVector.clamp(confidence);
        return new GraphEdge(id, source, target, type, c, c);
    }

    public double confidenceOrDefault() {
        return confidence != null ? confidence : DEFAULT_CONFIDENCE;
    }

    public double weightOrDefault() {
        return weight != null ? weight : confidenceOrDefault();
    }

    /**
     * Returns this edge with defaults applied to missing confidence and weight.
     */
    public GraphEdge resolved() {
        if (confidence != null && weight != null) {
            return this;
        }
        return new GraphEdge(id, source, target, type, confidenceOrDefault(), weightOrDefault());
    }

    /**
     * Returns a copy whose endpoints are redirected through {@code from → to}.
     */
    public GraphEdge redirect(@NotNull String from, @NotNull String to) {
        String newSource = source.equals(from) ? to : source;
        String newTarget = target.equals(from) ? to : target;
        if (newSource.equals(source) && newTarget.equals(target)) {
            return this;
        }
        return new GraphEdge(id, newSource, newTarget, type, confidence, weight);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    public boolean touches(@NotNull String nodeId) {
        return source.equals(nodeId) || target.equals(nodeId);
    }
}
