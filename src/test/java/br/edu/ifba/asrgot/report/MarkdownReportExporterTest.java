package br.edu.ifba.asrgot.report;

import br.edu.ifba.asrgot.core.AuditDetails;
import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.core.StageContext;
import br.edu.ifba.asrgot.core.SynthesisDetails;
import br.edu.ifba.asrgot.core.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownReportExporterTest {

    private final MarkdownReportExporter exporter = new MarkdownReportExporter();

    private final ResearchContext context = new ResearchContext("Neuroscience", "Does sleep aid memory?",
        List.of("Map consolidation pathways"), List.of("Human studies only"), List.of("Psychology"),
        List.of(), "Adults", List.of(), true);

    @Test
    @DisplayName("Report is titled by the research question and carries every populated section")
    void testFullReport() {
        // Arrange
        GraphDocument graph = new GraphDocument();
        graph.addNode(node("h1", "Sleep improves recall", NodeType.HYPOTHESIS, NodeMetadata.builder()
            .stage(3).impactScore(0.8).evidenceCount(2).value("Slow-wave sleep replays memories\nDetails").build()));
        graph.addNode(node("syn_1", "Findings", NodeType.SYNTHESIS, NodeMetadata.builder()
            .stage(7).value("Evidence converges.")
            .synthesis(new SynthesisDetails("Findings", List.of("e1", "e2"), 300)).build()));
        graph.addNode(node("refl", "Audit", NodeType.REFLECTION, NodeMetadata.builder()
            .stage(8).audit(new AuditDetails(false, List.of("Small samples"), List.of("Add replication"))).build()));
        List<StageContext> history = List.of(
            StageContext.running(ResearchStage.INITIALIZATION).completed(new TokenUsage(10, 5), 1));

        // Act
        String report = exporter.export(graph, context, history, "Narrative body.");

        // Assert
        assertTrue(report.startsWith("# Does sleep aid memory?\n\n**Field:** Neuroscience (Psychology)"));
        assertTrue(report.contains("Narrative body."));
        assertTrue(report.contains("- Map consolidation pathways"));
        assertTrue(report.contains("**Initial scope:** Adults"));
        assertTrue(report.contains("- **Sleep improves recall** (confidence 0.75, evidence 2): Slow-wave sleep replays memories\n"));
        assertTrue(report.contains("### Findings\n\nEvidence converges.\n\n_Sources: e1, e2_"));
        assertTrue(report.contains("**Status:** needs revision"));
        assertTrue(report.contains("- Small samples"));
        assertTrue(report.contains("| 1 | Initialization | completed |"));
        assertTrue(report.contains("- Nodes: 3"));
        assertFalse(report.contains("## Evidence"));
    }

    @Test
    void testEmptyGraphStillHasStatistics() {
        String report = exporter.export(new GraphDocument(), ResearchContext.empty(), List.of(), "");

        assertTrue(report.startsWith("# Research Report"));
        assertTrue(report.contains("## Graph Statistics"));
        assertFalse(report.contains("## Key Hypotheses"));
        assertFalse(report.contains("## Stage History"));
        assertEquals("text/markdown", exporter.getMediaType());
    }

    private static GraphNode node(String id, String label, NodeType type, NodeMetadata metadata) {
        return GraphNode.builder()
            .id(id)
            .label(label)
            .type(type)
            .confidence(ConfidenceVector.DEFAULT)
            .metadata(metadata)
            .build();
    }
}
