package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A research concept in the reasoning graph.
 *
 * <p>Instances are immutable. {@code id} and {@code type} never change once a node is
 * created; later stages replace confidence or metadata through the {@code withX} copies.</p>
 */
public final class GraphNode {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("label")
    @NotNull
    private final String label;

    @JsonProperty("type")
    @NotNull
    private final NodeType type;

    @JsonProperty("confidence")
    @NotNull
    private final ConfidenceVector confidence;

    @JsonProperty("metadata")
    @NotNull
    private final NodeMetadata metadata;

    /**
     * Constructs a new GraphNode.
     *
     * @param id         stable id, prefixed by the creating stage or node type
     * @param label      human-readable label
     * @param type       node kind
     * @param confidence four-dimensional confidence
     * @param metadata   node metadata
     */
    public GraphNode(
            @NotNull String id,
            @NotNull String label,
            @NotNull NodeType type,
            @NotNull ConfidenceVector confidence,
            @NotNull NodeMetadata metadata) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.confidence = Objects.requireNonNull(confidence, "confidence must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getLabel() {
        return label;
    }

    @NotNull
    public NodeType getType() {
        return type;
    }

    @NotNull
    public ConfidenceVector getConfidence() {
        return confidence;
    }

    @NotNull
    public NodeMetadata getMetadata() {
        return metadata;
    }

    /**
     * Shortcut for {@code getMetadata().impactScore()}.
     */
    public double impactScore() {
        return metadata.impactScore();
    }

    public GraphNode withConfidence(@NotNull ConfidenceVector newConfidence) {
        return new GraphNode(id, label, type, newConfidence, metadata);
    }

    public GraphNode withMetadata(@NotNull NodeMetadata newMetadata) {
        return new GraphNode(id, label, type, confidence, newMetadata);
    }

    /**
     * Merges another node into this one.
     *
     * <p>The result keeps this node's id, label and type, averages both confidence
     * vectors and merges metadata via {@link NodeMetadata#mergeWith(NodeMetadata)}.</p>
     *
     * @param other the node to absorb
     * @return new GraphNode carrying this node's identity
     */
    public GraphNode mergeWith(@NotNull GraphNode other) {
        Objects.requireNonNull(other, "other must not be null");
        ConfidenceVector merged = ConfidenceVector.average(List.of(confidence, other.confidence));
        return new GraphNode(id, label, type, merged, metadata.mergeWith(other.metadata));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        GraphNode node = (GraphNode) obj;
        return Objects.equals(id, node.id) &&
               Objects.equals(label, node.label) &&
               type == node.type &&
               Objects.equals(confidence, node.confidence) &&
               Objects.equals(metadata, node.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, type, confidence, metadata);
    }

    @Override
    public String toString() {
        return "GraphNode{" +
                "id='" + id + '\'' +
                ", label='" + label + '\'' +
                ", type=" + type +
                ", confidence=" + confidence.toList() +
                ", impact=" + metadata.impactScore() +
                '}';
    }

    /**
     * Builder for GraphNode instances.
     */
    public static class Builder {
        private String id;
        private String label;
        private NodeType type;
        private ConfidenceVector confidence = ConfidenceVector.DEFAULT;
        private NodeMetadata metadata;

        public Builder id(@NotNull String id) {
            this.id = id;
            return this;
        }

        public Builder label(@NotNull String label) {
            this.label = label;
            return this;
        }

        public Builder type(@NotNull NodeType type) {
            this.type = type;
            return this;
        }

        public Builder confidence(@NotNull ConfidenceVector confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder metadata(@NotNull NodeMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public GraphNode build() {
            NodeMetadata effective = metadata != null ? metadata : NodeMetadata.builder().build();
            return new GraphNode(id, label, type, confidence, effective);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
