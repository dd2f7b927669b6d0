package br.edu.ifba.asrgot.report;

import br.edu.ifba.asrgot.core.AuditDetails;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.StageContext;
import br.edu.ifba.asrgot.core.SynthesisDetails;
import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Markdown report: narrative first, followed by appendices built from the graph.
 *
 * <p>Sections: research context, hypotheses ranked by impact, evidence table, synthesis
 * sections, audit outcome, stage history and graph statistics. Sections with no backing
 * nodes are left out.</p>
 */
public class MarkdownReportExporter implements ReportExporter {

    public static final String MEDIA_TYPE = "text/markdown";

    private static final int MAX_HYPOTHESES = 10;

    @Override
    @NotNull
    public String export(@NotNull GraphDocument graph,
                         @NotNull ResearchContext context,
                         @NotNull List<StageContext> history,
                         @NotNull String narrative) {
        StringBuilder report = new StringBuilder();

        String title = context.topic().isBlank() ? "Research Report" : context.topic();
        report.append("# ").append(title).append("\n\n");
        report.append("**Field:** ").append(context.field());
        if (!context.secondaryFields().isEmpty()) {
            report.append(" (").append(String.join(", ", context.secondaryFields())).append(')');
        }
        report.append("\n\n");

        if (!narrative.isBlank()) {
            report.append(narrative.trim()).append("\n\n");
        }

        appendContext(report, context);
        appendHypotheses(report, graph);
        appendEvidence(report, graph);
        appendSynthesis(report, graph);
        appendAudit(report, graph);
        appendHistory(report, history);
        appendStatistics(report, graph);

        return report.toString();
    }

    @Override
    @NotNull
    public String getMediaType() {
        return MEDIA_TYPE;
    }

    private void appendContext(StringBuilder report, ResearchContext context) {
        report.append("## Research Context\n\n");
        appendList(report, "Objectives", context.objectives());
        appendList(report, "Constraints", context.constraints());
        appendList(report, "Interdisciplinary connections", context.interdisciplinaryConnections());
        if (!context.initialScope().isBlank()) {
            report.append("**Initial scope:** ").append(context.initialScope()).append("\n\n");
        }
    }

    private void appendList(StringBuilder report, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        report.append("**").append(heading).append(":**\n\n");
        for (String item : items) {
            report.append("- ").append(item).append('\n');
        }
        report.append('\n');
    }

    private void appendHypotheses(StringBuilder report, GraphDocument graph) {
        List<GraphNode> hypotheses = graph.nodesOfType(NodeType.HYPOTHESIS).stream()
            .sorted(Comparator.comparingDouble(GraphNode::impactScore).reversed())
            .limit(MAX_HYPOTHESES)
            .collect(Collectors.toList());
        if (hypotheses.isEmpty()) {
            return;
        }
        report.append("## Key Hypotheses\n\n");
        for (GraphNode hypothesis : hypotheses) {
            report.append("- **").append(hypothesis.getLabel()).append("** (confidence ")
                .append(format(hypothesis.getConfidence().mean()))
                .append(", evidence ").append(hypothesis.getMetadata().evidenceCount()).append(")");
            String value = hypothesis.getMetadata().value();
            if (value != null && !value.isBlank()) {
                report.append(": ").append(firstLine(value));
            }
            report.append('\n');
        }
        report.append('\n');
    }

    private void appendEvidence(StringBuilder report, GraphDocument graph) {
        List<GraphNode> evidence = graph.nodesOfType(NodeType.EVIDENCE);
        if (evidence.isEmpty()) {
            return;
        }
        report.append("## Evidence\n\n");
        report.append("| Id | Hypothesis | Quality | Power | Peer review | Confidence |\n");
        report.append("|---|---|---|---|---|---|\n");
        for (GraphNode node : evidence) {
            EvidenceDetails details = node.getMetadata().evidence();
            report.append("| ").append(node.getId())
                .append(" | ").append(details != null ? details.hypothesisId() : "-")
                .append(" | ").append(details != null ? details.quality().getValue() : "-")
                .append(" | ").append(details != null ? format(details.statisticalPower()) : "-")
                .append(" | ").append(details != null ? details.peerReviewStatus() : "-")
                .append(" | ").append(format(node.getConfidence().mean()))
                .append(" |\n");
        }
        report.append('\n');
    }

    private void appendSynthesis(StringBuilder report, GraphDocument graph) {
        List<GraphNode> sections = graph.nodesOfType(NodeType.SYNTHESIS);
        if (sections.isEmpty()) {
            return;
        }
        report.append("## Synthesis\n\n");
        for (GraphNode section : sections) {
            report.append("### ").append(section.getLabel()).append("\n\n");
            String value = section.getMetadata().value();
            if (value != null && !value.isBlank()) {
                report.append(value.trim()).append("\n\n");
            }
            SynthesisDetails details = section.getMetadata().synthesis();
            if (details != null && !details.citations().isEmpty()) {
                report.append("_Sources: ").append(String.join(", ", details.citations())).append("_\n\n");
            }
        }
    }

    private void appendAudit(StringBuilder report, GraphDocument graph) {
        List<GraphNode> reflections = graph.nodesOfType(NodeType.REFLECTION);
        if (reflections.isEmpty()) {
            return;
        }
        report.append("## Quality Audit\n\n");
        for (GraphNode reflection : reflections) {
            AuditDetails audit = reflection.getMetadata().audit();
            if (audit == null) {
                continue;
            }
            report.append("**Status:** ").append(audit.passed() ? "passed" : "needs revision").append("\n\n");
            appendList(report, "Issues", audit.issues());
            appendList(report, "Suggested improvements", audit.qualityImprovements());
        }
    }

    private void appendHistory(StringBuilder report, List<StageContext> history) {
        if (history.isEmpty()) {
            return;
        }
        report.append("## Stage History\n\n");
        report.append("| Stage | Name | Status | Duration (ms) | Tokens | Calls |\n");
        report.append("|---|---|---|---|---|---|\n");
        for (StageContext context : history) {
            report.append("| ").append(context.stageId())
                .append(" | ").append(context.stageName())
                .append(" | ").append(context.status().getValue())
                .append(" | ").append(context.durationMs())
                .append(" | ").append(context.tokenUsage().total())
                .append(" | ").append(context.modelCalls())
                .append(" |\n");
        }
        report.append('\n');
    }

    private void appendStatistics(StringBuilder report, GraphDocument graph) {
        report.append("## Graph Statistics\n\n");
        report.append("- Nodes: ").append(graph.nodeCount()).append('\n');
        report.append("- Edges: ").append(graph.edgeCount()).append('\n');
        report.append("- Hyperedges: ").append(graph.hyperedgeCount()).append('\n');
        report.append("- Complexity: ").append(format(graph.getMetadata().graphComplexity())).append('\n');
    }

    private static String firstLine(String text) {
        String trimmed = text.trim();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline).trim();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
