package br.edu.ifba.asrgot.algorithms;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.HyperEdge;
import br.edu.ifba.asrgot.core.HyperEdgeType;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GraphAlgorithmsTest {

    private GraphAlgorithms algorithms;

    @BeforeEach
    void setUp() {
        algorithms = new GraphAlgorithms(new NodeSimilarityCalculator(), 0.75);
    }

    // =========================================================================
    // Grouping and merging
    // =========================================================================

    @Test
    @DisplayName("Empty input yields no groups")
    void testIdentifySimilarNodesEmpty() {
        assertTrue(algorithms.identifySimilarNodes(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Similar labels of the same type form one group, others stay singletons")
    void testIdentifySimilarNodesGroups() {
        // Arrange
        GraphNode x = node("x", "Sleep deprivation", NodeType.HYPOTHESIS);
        GraphNode y = node("y", "sleep deprivation!", NodeType.HYPOTHESIS);
        GraphNode z = node("z", "Working memory", NodeType.HYPOTHESIS);
        GraphNode w = node("w", "Sleep deprivation", NodeType.EVIDENCE);

        // Act
        List<List<GraphNode>> groups = algorithms.identifySimilarNodes(List.of(x, y, z, w));

        // Assert
        assertEquals(3, groups.size());
        assertEquals(List.of("x", "y"), ids(groups.get(0)));
        assertEquals(List.of("z"), ids(groups.get(1)));
        assertEquals(List.of("w"), ids(groups.get(2)));
    }

    @Test
    @DisplayName("Merge keeps the first node's identity and averages confidence")
    void testMergeNodesKeepsFirstIdentity() {
        // Arrange
        GraphNode x = node("x", "Sleep deprivation", NodeType.HYPOTHESIS,
            new ConfidenceVector(0.8, 0.6, 0.8, 0.6), 0.5, 1, "Neuroscience");
        GraphNode y = node("y", "sleep deprivation", NodeType.HYPOTHESIS,
            new ConfidenceVector(0.6, 0.8, 0.6, 0.8), 0.9, 2, "Psychology");

        // Act
        GraphNode merged = algorithms.mergeNodes(List.of(x, y));

        // Assert
        assertEquals("x", merged.getId());
        assertEquals("Sleep deprivation", merged.getLabel());
        for (double value : merged.getConfidence().toArray()) {
            assertEquals(0.7, value, 1e-9);
        }
        assertEquals(0.9, merged.impactScore(), 1e-9);
        assertEquals(3, merged.getMetadata().evidenceCount());
        assertEquals(List.of("Neuroscience", "Psychology"), merged.getMetadata().disciplinaryTags());
    }

    @Test
    void testMergeNodesSingletonAndEmpty() {
        GraphNode x = node("x", "Sleep deprivation", NodeType.HYPOTHESIS);

        assertSame(x, algorithms.mergeNodes(List.of(x)));
        assertThrows(IllegalArgumentException.class, () -> algorithms.mergeNodes(List.of()));
    }

    @Test
    @DisplayName("Merging rewires edges, dropping self-loops and duplicates")
    void testMergeSimilarNodesRewiresRelations() {
        // Arrange
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("root", "Task Understanding", NodeType.ROOT));
        graph.addNode(node("x", "Sleep deprivation", NodeType.HYPOTHESIS));
        graph.addNode(node("y", "sleep deprivation", NodeType.HYPOTHESIS));
        graph.addNode(node("z", "Working memory", NodeType.HYPOTHESIS));
        graph.addEdge(GraphEdge.of("e1", "root", "x", EdgeType.SUPPORTIVE, 0.8));
        graph.addEdge(GraphEdge.of("e2", "root", "y", EdgeType.SUPPORTIVE, 0.8));
        graph.addEdge(GraphEdge.of("e3", "y", "z", EdgeType.CAUSAL, 0.6));
        graph.addEdge(GraphEdge.of("e4", "x", "y", EdgeType.CORRELATIVE, 0.6));
        graph.addHyperedge(new HyperEdge("h1", List.of("x", "y"), HyperEdgeType.SYNTHESIS, null, 0.7));
        graph.addHyperedge(new HyperEdge("h2", List.of("x", "y", "z"), HyperEdgeType.SYNTHESIS, null, 0.7));

        // Act
        Map<String, String> redirects = algorithms.mergeSimilarNodes(graph);

        // Assert
        assertEquals(Map.of("y", "x"), redirects);
        assertEquals(3, graph.nodeCount());
        assertFalse(graph.containsNode("y"));

        Set<String> edges = graph.getEdges().stream()
            .map(edge -> edge.source() + "->" + edge.target())
            .collect(Collectors.toSet());
        assertEquals(Set.of("root->x", "x->z"), edges);

        assertEquals(1, graph.hyperedgeCount());
        assertEquals(List.of("x", "z"), graph.getHyperedges().get(0).nodes());
    }

    // =========================================================================
    // Pruning and valid views
    // =========================================================================

    @Test
    @DisplayName("Pruning removes low-confidence nodes but never the root")
    void testPruneLowConfidence() {
        // Arrange
        ConfidenceVector weak = new ConfidenceVector(0.1, 0.1, 0.1, 0.1);
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("root", "Task Understanding", NodeType.ROOT, weak, 1.0, 0, "Science"));
        graph.addNode(node("weak", "Weak claim", NodeType.HYPOTHESIS, weak, 0.5, 0, "Science"));
        graph.addNode(node("strong", "Strong claim", NodeType.HYPOTHESIS));

        // Act
        List<String> removed = algorithms.pruneLowConfidence(graph, 0.2);

        // Assert
        assertEquals(List.of("weak"), removed);
        assertTrue(graph.containsNode("root"));
        assertTrue(graph.containsNode("strong"));
    }

    @Test
    @DisplayName("Valid edges exclude dangling endpoints and default missing weights")
    void testGetValidEdges() {
        // Arrange
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("a", "Alpha", NodeType.HYPOTHESIS));
        graph.addNode(node("b", "Beta", NodeType.EVIDENCE));
        graph.addEdge(new GraphEdge("ab", "a", "b", EdgeType.SUPPORTIVE, null, null));
        graph.addEdge(GraphEdge.of("ag", "a", "ghost", EdgeType.SUPPORTIVE, 0.9));

        // Act
        List<GraphEdge> valid = algorithms.getValidEdges(graph);

        // Assert
        assertEquals(1, valid.size());
        assertEquals("ab", valid.get(0).id());
        assertEquals(GraphEdge.DEFAULT_CONFIDENCE, valid.get(0).confidence().doubleValue(), 1e-9);
        assertEquals(GraphEdge.DEFAULT_CONFIDENCE, valid.get(0).weight().doubleValue(), 1e-9);
    }

    @Test
    void testGetValidHyperedges() {
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("a", "Alpha", NodeType.EVIDENCE));
        graph.addNode(node("b", "Beta", NodeType.EVIDENCE));
        graph.addHyperedge(new HyperEdge("ok", List.of("a", "b"), HyperEdgeType.SYNTHESIS, null, 0.7));
        graph.addHyperedge(new HyperEdge("broken", List.of("a", "ghost"), HyperEdgeType.SYNTHESIS, null, 0.7));

        List<HyperEdge> valid = algorithms.getValidHyperedges(graph);

        assertEquals(List.of("ok"), valid.stream().map(HyperEdge::id).toList());
    }

    // =========================================================================
    // Subgraphs and connectivity
    // =========================================================================

    @Test
    @DisplayName("Subgraph keeps nodes above the impact threshold, optionally with neighbors")
    void testExtractHighImpactSubgraph() {
        // Arrange
        GraphDocument graph = chain();

        // Act
        GraphDocument strict = algorithms.extractHighImpactSubgraph(graph, 0.7);
        GraphDocument extended = algorithms.extractHighImpactSubgraph(graph, 0.7, true);

        // Assert
        assertEquals(List.of("a"), ids(strict.getNodes()));
        assertEquals(0, strict.edgeCount());
        assertEquals(List.of("a", "b"), ids(extended.getNodes()));
        assertEquals(1, extended.edgeCount());
        assertEquals("ab", extended.getEdges().get(0).id());
    }

    @Test
    @DisplayName("Neighbors are added through incoming edges too")
    void testSubgraphIncludesIncomingNeighbors() {
        // Arrange
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("x", "Source", NodeType.EVIDENCE, ConfidenceVector.DEFAULT, 0.2, 0, "Science"));
        graph.addNode(node("y", "Target", NodeType.HYPOTHESIS, ConfidenceVector.DEFAULT, 0.9, 0, "Science"));
        graph.addNode(node("z", "Unrelated", NodeType.GAP, ConfidenceVector.DEFAULT, 0.1, 0, "Science"));
        graph.addEdge(GraphEdge.of("xy", "x", "y", EdgeType.SUPPORTIVE, 0.7));

        // Act
        GraphDocument extended = algorithms.extractHighImpactSubgraph(graph, 0.7, true);

        // Assert
        assertEquals(List.of("x", "y"), ids(extended.getNodes()));
        assertEquals(1, extended.edgeCount());
    }

    @Test
    void testSubgraphOfEmptyGraphIsEmpty() {
        assertTrue(algorithms.extractHighImpactSubgraph(new GraphDocument(), 0.7).isEmpty());
    }

    @Test
    @DisplayName("Components and directed paths are counted over valid edges")
    void testConnectivity() {
        // Arrange
        GraphDocument graph = chain();
        graph.addNode(node("d", "Delta", NodeType.GAP));

        // Act
        ConnectivitySummary summary = algorithms.summarizeConnectivity(graph);

        // Assert
        assertEquals(2, summary.components());
        assertEquals(3, summary.paths());
        assertEquals(2, algorithms.countComponents(graph));
        assertEquals(3, algorithms.countPaths(graph));
    }

    @Test
    void testRejectsThresholdOutsideUnitRange() {
        NodeSimilarityCalculator calculator = new NodeSimilarityCalculator();

        assertThrows(IllegalArgumentException.class, () -> new GraphAlgorithms(calculator, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new GraphAlgorithms(calculator, -0.1));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private GraphDocument chain() {
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("a", "Alpha", NodeType.HYPOTHESIS, ConfidenceVector.DEFAULT, 0.9, 0, "Science"));
        graph.addNode(node("b", "Beta", NodeType.EVIDENCE, ConfidenceVector.DEFAULT, 0.5, 0, "Science"));
        graph.addNode(node("c", "Gamma", NodeType.EVIDENCE, ConfidenceVector.DEFAULT, 0.2, 0, "Science"));
        graph.addEdge(GraphEdge.of("ab", "a", "b", EdgeType.SUPPORTIVE, 0.7));
        graph.addEdge(GraphEdge.of("bc", "b", "c", EdgeType.CAUSAL, 0.6));
        return graph;
    }

    private static GraphNode node(String id, String label, NodeType type) {
        return node(id, label, type, ConfidenceVector.DEFAULT, 0.5, 0, "Science");
    }

    private static GraphNode node(String id, String label, NodeType type, ConfidenceVector confidence,
                                  double impact, int evidenceCount, String tag) {
        return GraphNode.builder()
            .id(id)
            .label(label)
            .type(type)
            .confidence(confidence)
            .metadata(NodeMetadata.builder()
                .stage(1)
                .impactScore(impact)
                .evidenceCount(evidenceCount)
                .addTag(tag)
                .build())
            .build();
    }

    private static List<String> ids(List<GraphNode> nodes) {
        return nodes.stream().map(GraphNode::getId).toList();
    }
}
