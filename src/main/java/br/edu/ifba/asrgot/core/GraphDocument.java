package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Mutable node/edge/hyperedge container that represents the current reasoning state.
 *
 * <p>Node ids are unique. Edge and hyperedge ids are unique within their list; adding a
 * duplicate id is rejected. Edges and hyperedges may reference nodes that were later
 * removed: such relations stay in the document but are left out of the valid views
 * computed by the graph algorithms.</p>
 *
 * <p>Not thread-safe. Each document is owned by a single stage engine.</p>
 */
public final class GraphDocument {

    private final Map<String, GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final List<HyperEdge> hyperedges;
    private GraphMetadata metadata;

    public GraphDocument() {
        this(new LinkedHashMap<>(), new ArrayList<>(), new ArrayList<>(), GraphMetadata.initial());
    }

    private GraphDocument(Map<String, GraphNode> nodes, List<GraphEdge> edges,
                          List<HyperEdge> hyperedges, GraphMetadata metadata) {
        this.nodes = nodes;
        this.edges = edges;
        this.hyperedges = hyperedges;
        this.metadata = metadata;
    }

    // =========================================================================
    // Nodes
    // =========================================================================

    @JsonProperty("nodes")
    @NotNull
    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    @NotNull
    public Optional<GraphNode> getNode(@NotNull String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(@Nullable String id) {
        return id != null && nodes.containsKey(id);
    }

    @NotNull
    public List<GraphNode> nodesOfType(@NotNull NodeType type) {
        return findNodes(node -> node.getType() == type);
    }

    @NotNull
    public List<GraphNode> findNodes(@NotNull Predicate<GraphNode> filter) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (filter.test(node)) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Adds a node with a new id.
     *
     * @return false if a node with the same id already exists (document unchanged)
     */
    public boolean addNode(@NotNull GraphNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (nodes.containsKey(node.getId())) {
            return false;
        }
        nodes.put(node.getId(), node);
        return true;
    }

    /**
     * Replaces an existing node, keeping its position.
     *
     * @throws IllegalArgumentException if the id is unknown or the type would change
     */
    public void updateNode(@NotNull GraphNode node) {
        Objects.requireNonNull(node, "node must not be null");
        GraphNode existing = nodes.get(node.getId());
        if (existing == null) {
            throw new IllegalArgumentException("Unknown node: " + node.getId());
        }
        if (existing.getType() != node.getType()) {
            throw new IllegalArgumentException("Node type is immutable for " + node.getId()
                + ": " + existing.getType() + " -> " + node.getType());
        }
        nodes.put(node.getId(), node);
    }

    @Nullable
    public GraphNode removeNode(@NotNull String id) {
        return nodes.remove(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    // =========================================================================
    // Edges
    // =========================================================================

    @JsonProperty("edges")
    @NotNull
    public List<GraphEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Appends an edge.
     *
     * @return false if an edge with the same id already exists (document unchanged)
     */
    public boolean addEdge(@NotNull GraphEdge edge) {
        Objects.requireNonNull(edge, "edge must not be null");
        for (GraphEdge existing : edges) {
            if (existing.id().equals(edge.id())) {
                return false;
            }
        }
        edges.add(edge);
        return true;
    }

    public void replaceEdges(@NotNull Collection<GraphEdge> newEdges) {
        edges.clear();
        for (GraphEdge edge : newEdges) {
            addEdge(edge);
        }
    }

    public int edgeCount() {
        return edges.size();
    }

    // =========================================================================
    // Hyperedges
    // =========================================================================

    @JsonProperty("hyperedges")
    @NotNull
    public List<HyperEdge> getHyperedges() {
        return Collections.unmodifiableList(hyperedges);
    }

    /**
     * Appends a hyperedge.
     *
     * @return false if a hyperedge with the same id already exists (document unchanged)
     */
    public boolean addHyperedge(@NotNull HyperEdge hyperedge) {
        Objects.requireNonNull(hyperedge, "hyperedge must not be null");
        for (HyperEdge existing : hyperedges) {
            if (existing.id().equals(hyperedge.id())) {
                return false;
            }
        }
        hyperedges.add(hyperedge);
        return true;
    }

    public void replaceHyperedges(@NotNull Collection<HyperEdge> newHyperedges) {
        hyperedges.clear();
        for (HyperEdge hyperedge : newHyperedges) {
            addHyperedge(hyperedge);
        }
    }

    public int hyperedgeCount() {
        return hyperedges.size();
    }

    // =========================================================================
    // Metadata
    // =========================================================================

    @JsonProperty("metadata")
    @NotNull
    public GraphMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(@NotNull GraphMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /**
     * Records a stage commit: updates the stage number, counts and complexity.
     */
    public void touch(int stage, double graphComplexity) {
        this.metadata = metadata.withStage(stage)
            .withCounts(nodes.size(), edges.size(), hyperedges.size(), graphComplexity);
    }

    /**
     * Returns an independent copy. Nodes, edges and hyperedges are immutable and shared.
     */
    @NotNull
    public GraphDocument copy() {
        return new GraphDocument(new LinkedHashMap<>(nodes), new ArrayList<>(edges),
            new ArrayList<>(hyperedges), metadata);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "GraphDocument{" +
                "nodes=" + nodes.size() +
                ", edges=" + edges.size() +
                ", hyperedges=" + hyperedges.size() +
                ", stage=" + metadata.stage() +
                '}';
    }
}
