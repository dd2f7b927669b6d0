package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.confidence.ConfidenceModel;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.core.StageContext;
import br.edu.ifba.asrgot.report.ReportExporter;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage 9: writes the final report and marks the graph completed.
 *
 * <p>The model writes the narrative; the {@link ReportExporter} wraps it with appendices
 * built from the graph, the research context and the stage history.</p>
 */
public class FinalSynthesisHandler implements StageHandler {

    private static final int MAX_PLAN_CHARS = 3000;
    private static final int MAX_AUDIT_CHARS = 2000;
    private static final int MAX_LISTED_HYPOTHESES = 20;

    private final ConfidenceModel confidenceModel;
    private final ReportExporter reportExporter;

    public FinalSynthesisHandler(@NotNull StageToolkit toolkit) {
        this.confidenceModel = toolkit.confidenceModel();
        this.reportExporter = toolkit.reportExporter();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.FINAL_SYNTHESIS;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        ResearchContext context = execution.getResearchContext();
        GraphDocument graph = execution.getGraph();

        String narrative = execution.ask(execution.thinking(buildPrompt(execution, context, graph)),
            TaskPriority.HIGH, execution.getSettings().reportTimeout());

        String report = reportExporter.export(graph, context, execution.getHistory(), narrative);
        execution.getSession().setFinalReport(report);
        graph.setMetadata(graph.getMetadata().withCompleted(true));

        List<GraphNode> nodes = graph.getNodes();
        double averageConfidence = confidenceModel.aggregate(nodes);

        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("report_length", report.length());
        figures.put("average_confidence", averageConfidence);
        figures.put("total_nodes", nodes.size());
        figures.put("evidence_nodes", graph.nodesOfType(NodeType.EVIDENCE).size());

        String content = "# Stage 9: Final Synthesis Complete\n\n"
            + String.format(Locale.ROOT, "- Nodes: %d%n- Edges: %d%n- Average confidence: %.2f%n- Report: %d characters (%s)%n",
                nodes.size(), graph.edgeCount(), averageConfidence, report.length(), reportExporter.getMediaType());
        return new StageOutcome(content, nodes, figures);
    }

    private String buildPrompt(StageExecution execution, ResearchContext context, GraphDocument graph) {
        StringBuilder hypotheses = new StringBuilder();
        graph.nodesOfType(NodeType.HYPOTHESIS).stream()
            .sorted((a, b) -> Double.compare(b.getConfidence().mean(), a.getConfidence().mean()))
            .limit(MAX_LISTED_HYPOTHESES)
            .forEach(node -> hypotheses.append(String.format(Locale.ROOT, "- %s (confidence %.2f, evidence %d): %s%n",
                node.getLabel(), node.getConfidence().mean(), node.getMetadata().evidenceCount(),
                HypothesisGenerationHandler.abbreviate(node.getMetadata().value(), 200))));

        StringBuilder stages = new StringBuilder();
        for (StageContext stage : execution.getHistory()) {
            stages.append("- Stage ").append(stage.stageId()).append(" (").append(stage.stageName()).append("): ")
                .append(stage.status().getValue()).append('\n');
        }

        return """
            Write the final scientific research report for the completed analysis.

            **Research Context**:
            - Topic: %s
            - Field: %s
            - Objectives: %s
            - Evidence nodes: %d
            - Hypotheses analyzed: %d

            **Hypotheses**:
            %s
            **Composition plan**: %s

            **Audit results**: %s

            **Stage history**:
            %s
            Write in Markdown with an executive summary, methodology, evidence analysis,
            hypothesis evaluation, statistical assessment, limitations and knowledge gaps,
            and conclusions. Use a formal academic tone, distinguish causal from
            correlational findings and cite evidence in Vancouver style.
            """.formatted(context.topic(), context.field(), String.join("; ", context.objectives()),
                graph.nodesOfType(NodeType.EVIDENCE).size(), graph.nodesOfType(NodeType.HYPOTHESIS).size(),
                hypotheses, truncate(execution.getSession().getComposition().orElse("none"), MAX_PLAN_CHARS),
                truncate(execution.getSession().getAudit().orElse("none"), MAX_AUDIT_CHARS), stages);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
