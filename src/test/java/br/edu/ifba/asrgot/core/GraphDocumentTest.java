package br.edu.ifba.asrgot.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphDocumentTest {

    @Test
    @DisplayName("Duplicate ids are rejected without changing the document")
    void testDuplicateIdsRejected() {
        GraphDocument graph = new GraphDocument();

        assertTrue(graph.addNode(node("n1", NodeType.DIMENSION)));
        assertFalse(graph.addNode(node("n1", NodeType.HYPOTHESIS)));
        assertEquals(NodeType.DIMENSION, graph.getNode("n1").orElseThrow().getType());

        assertTrue(graph.addEdge(GraphEdge.of("e1", "n1", "n2", EdgeType.SUPPORTIVE, 0.7)));
        assertFalse(graph.addEdge(GraphEdge.of("e1", "n2", "n1", EdgeType.CAUSAL, 0.7)));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    @DisplayName("Updating a node cannot change its type")
    void testUpdateNodeKeepsType() {
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("n1", NodeType.DIMENSION));

        assertThrows(IllegalArgumentException.class, () -> graph.updateNode(node("n1", NodeType.HYPOTHESIS)));
        assertThrows(IllegalArgumentException.class, () -> graph.updateNode(node("missing", NodeType.DIMENSION)));

        GraphNode updated = node("n1", NodeType.DIMENSION).withConfidence(ConfidenceVector.CERTAIN);
        graph.updateNode(updated);
        assertEquals(ConfidenceVector.CERTAIN, graph.getNode("n1").orElseThrow().getConfidence());
    }

    @Test
    @DisplayName("A copy is independent of the original")
    void testCopyIsIndependent() {
        GraphDocument original = new GraphDocument();
        original.addNode(node("n1", NodeType.ROOT));

        GraphDocument copy = original.copy();
        copy.addNode(node("n2", NodeType.DIMENSION));
        copy.addEdge(GraphEdge.of("e1", "n1", "n2", EdgeType.SUPPORTIVE, 0.8));

        assertEquals(1, original.nodeCount());
        assertEquals(0, original.edgeCount());
        assertEquals(2, copy.nodeCount());
    }

    @Test
    void testTouchRecordsStageAndCounts() {
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("n1", NodeType.ROOT));
        graph.addNode(node("n2", NodeType.DIMENSION));
        graph.addEdge(GraphEdge.of("e1", "n1", "n2", EdgeType.SUPPORTIVE, 0.8));

        graph.touch(2, 0.42);

        GraphMetadata metadata = graph.getMetadata();
        assertEquals(2, metadata.stage());
        assertEquals(2, metadata.nodeCount());
        assertEquals(1, metadata.edgeCount());
        assertEquals(0.42, metadata.graphComplexity(), 1e-9);
        assertEquals(GraphMetadata.SCHEMA_VERSION, metadata.version());
    }

    @Test
    void testNodesOfTypeKeepsInsertionOrder() {
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("n2", NodeType.DIMENSION));
        graph.addNode(node("n0", NodeType.ROOT));
        graph.addNode(node("n1", NodeType.DIMENSION));

        List<String> ids = graph.nodesOfType(NodeType.DIMENSION).stream().map(GraphNode::getId).toList();

        assertEquals(List.of("n2", "n1"), ids);
    }

    @Test
    @DisplayName("Confidence values outside [0, 1] are rejected")
    void testConfidenceVectorRange() {
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceVector(1.2, 0.5, 0.5, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceVector(0.5, -0.1, 0.5, 0.5));
        assertEquals(List.of(1.0, 0.0, 0.5, 0.5), ConfidenceVector.clamped(1.2, -0.1, 0.5, 0.5).toList());
    }

    @Test
    void testHyperedgeNeedsTwoMembers() {
        assertThrows(IllegalArgumentException.class,
            () -> new HyperEdge("h", List.of("n1"), HyperEdgeType.SYNTHESIS, null, 0.5));
        assertNull(new HyperEdge("h", List.of("a", "b"), HyperEdgeType.SYNTHESIS, null, 0.5).redirect("b", "a"));
    }

    private static GraphNode node(String id, NodeType type) {
        return GraphNode.builder()
            .id(id)
            .label("Node " + id)
            .type(type)
            .confidence(ConfidenceVector.DEFAULT)
            .build();
    }
}
