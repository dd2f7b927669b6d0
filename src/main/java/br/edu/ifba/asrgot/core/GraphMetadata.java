package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Document-level metadata of a {@link GraphDocument}.
 *
 * @param version         schema version
 * @param createdAt       creation time
 * @param updatedAt       last commit time
 * @param stage           last stage that committed, 0 before any
 * @param nodeCount       number of nodes
 * @param edgeCount       number of edges
 * @param hyperedgeCount  number of hyperedges
 * @param graphComplexity information-theoretic graph complexity
 * @param completed       true once stage 9 finished
 */
public record GraphMetadata(
    @JsonProperty("version") String version,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("stage") int stage,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount,
    @JsonProperty("hyperedge_count") int hyperedgeCount,
    @JsonProperty("graph_complexity") double graphComplexity,
    @JsonProperty("completed") boolean completed
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public static GraphMetadata initial() {
        Instant now = Instant.now();
        return new GraphMetadata(SCHEMA_VERSION, now, now, 0, 0, 0, 0, 0.0, false);
    }

    public GraphMetadata withStage(int newStage) {
        return new GraphMetadata(version, createdAt, Instant.now(), newStage, nodeCount, edgeCount,
            hyperedgeCount, graphComplexity, completed);
    }

    public GraphMetadata withCounts(int nodes, int edges, int hyperedges, double complexity) {
        return new GraphMetadata(version, createdAt, Instant.now(), stage, nodes, edges, hyperedges,
            complexity, completed);
    }

    public GraphMetadata withCompleted(boolean isCompleted) {
        return new GraphMetadata(version, createdAt, Instant.now(), stage, nodeCount, edgeCount,
            hyperedgeCount, graphComplexity, isCompleted);
    }
}
