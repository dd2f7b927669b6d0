package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.algorithms.HyperedgeBuilder;
import br.edu.ifba.asrgot.confidence.ConfidenceModel;
import br.edu.ifba.asrgot.confidence.InformationTheory;
import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.EvidenceQuality;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.HyperEdge;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.extraction.TextSignalExtractor;
import br.edu.ifba.asrgot.scheduler.ModelTask;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stage 4: gathers and weighs evidence for every hypothesis.
 *
 * <p>Per hypothesis two calls are queued: a search-grounded evidence query and a
 * reasoning-only analysis of how the hypothesis could be supported or refuted. All calls
 * are queued before any result is awaited.</p>
 *
 * <p>The analysis text yields the evidence confidence, statistical power and quality; the
 * evidence text yields the peer-review status. The hypothesis confidence is blended with
 * the evidence confidence and its evidence count goes up by one. Derived hyperedges are
 * rebuilt at the end.</p>
 */
public class EvidenceIntegrationHandler implements StageHandler {

    private static final Logger logger = LoggerFactory.getLogger(EvidenceIntegrationHandler.class);

    private final TextSignalExtractor extractor;
    private final ConfidenceModel confidenceModel;
    private final InformationTheory informationTheory;
    private final HyperedgeBuilder hyperedgeBuilder;

    public EvidenceIntegrationHandler(@NotNull StageToolkit toolkit) {
        this.extractor = toolkit.extractor();
        this.confidenceModel = toolkit.confidenceModel();
        this.informationTheory = toolkit.informationTheory();
        this.hyperedgeBuilder = toolkit.hyperedgeBuilder();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.EVIDENCE_INTEGRATION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        ResearchContext context = execution.getResearchContext();
        GraphDocument graph = execution.getGraph();
        List<GraphNode> hypotheses = graph.nodesOfType(NodeType.HYPOTHESIS);

        List<ModelTask> tasks = new ArrayList<>(hypotheses.size() * 2);
        for (GraphNode hypothesis : hypotheses) {
            tasks.add(new ModelTask(execution.searchGrounded(evidencePrompt(context, hypothesis)), TaskPriority.HIGH));
            tasks.add(new ModelTask(execution.thinking(analysisPrompt(context, hypothesis)), TaskPriority.HIGH));
        }
        List<String> responses = execution.askAll(tasks, execution.getSettings().resultTimeout());

        List<GraphNode> touched = new ArrayList<>();
        Map<EvidenceQuality, Integer> qualityCounts = new EnumMap<>(EvidenceQuality.class);
        for (int i = 0; i < hypotheses.size(); i++) {
            GraphNode hypothesis = hypotheses.get(i);
            String evidenceText = responses.get(2 * i);
            String analysis = responses.get(2 * i + 1);

            GraphNode evidence = buildEvidence(graph, context, hypothesis, evidenceText, analysis);
            graph.addNode(evidence);
            qualityCounts.merge(evidence.getMetadata().evidence().quality(), 1, Integer::sum);

            GraphNode updated = hypothesis
                .withConfidence(confidenceModel.blend(hypothesis.getConfidence(), evidence.getConfidence(),
                    hypothesis.getMetadata().evidenceCount()))
                .withMetadata(hypothesis.getMetadata().withEvidenceCount(hypothesis.getMetadata().evidenceCount() + 1));
            graph.updateNode(updated);

            EdgeType relation = extractor.detectRelationType(analysis).orElse(EdgeType.SUPPORTIVE);
            graph.addEdge(GraphEdge.of("edge_" + hypothesis.getId() + "_" + evidence.getId(),
                hypothesis.getId(), evidence.getId(), relation, evidence.getConfidence().empiricalSupport()));

            touched.add(evidence);
            touched.add(updated);
        }

        List<HyperEdge> hyperedges = hyperedgeBuilder.rebuild(graph);
        logger.debug("Integrated evidence for {} hypotheses, {} derived hyperedges", hypotheses.size(),
            hyperedges.size());

        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("evidence_nodes", hypotheses.size());
        figures.put("hyperedges", hyperedges.size());
        for (EvidenceQuality quality : EvidenceQuality.values()) {
            figures.put(quality.getValue() + "_quality", qualityCounts.getOrDefault(quality, 0));
        }

        return new StageOutcome(buildContent(hypotheses.size(), qualityCounts, hyperedges), touched, figures);
    }

    private GraphNode buildEvidence(GraphDocument graph, ResearchContext context, GraphNode hypothesis,
                                    String evidenceText, String analysis) {
        ConfidenceVector confidence = extractor.parseConfidenceVector(analysis);
        double power = extractor.extractStatisticalPower(analysis);
        EvidenceQuality quality = extractor.assessEvidenceQuality(analysis);
        String peerStatus = extractor.detectPeerReviewStatus(evidenceText);

        NodeMetadata.Builder metadata = NodeMetadata.builder()
            .stage(ResearchStage.EVIDENCE_INTEGRATION.getNumber())
            .impactScore(ConfidenceVector.clamp(0.5 * power + 0.5 * confidence.mean()))
            .addTag(context.field())
            .value(evidenceText)
            .notes(analysis)
            .infoMetrics(informationTheory.evidenceMetrics(quality, power, peerStatus))
            .evidence(new EvidenceDetails(power, quality, peerStatus, hypothesis.getId()));
        String lowered = evidenceText != null ? evidenceText.toLowerCase(Locale.ROOT) : "";
        for (String secondary : context.secondaryFields()) {
            if (lowered.contains(secondary.toLowerCase(Locale.ROOT))) {
                metadata.addTag(secondary);
            }
        }

        return GraphNode.builder()
            .id(evidenceId(graph, hypothesis.getId()))
            .label("Evidence: " + hypothesis.getLabel())
            .type(NodeType.EVIDENCE)
            .confidence(confidence)
            .metadata(metadata.build())
            .build();
    }

    /**
     * {@code e_{hypothesisId}}, suffixed with {@code _2}, {@code _3}... when the stage is run again.
     */
    static String evidenceId(GraphDocument graph, String hypothesisId) {
        String base = "e_" + hypothesisId;
        if (!graph.containsNode(base)) {
            return base;
        }
        int suffix = 2;
        while (graph.containsNode(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }

    private String evidencePrompt(ResearchContext context, GraphNode hypothesis) {
        return """
            Research evidence for this hypothesis in %s:

            "%s"

            Focus on:
            - Peer-reviewed publications
            - Statistical data and studies
            - Expert opinions and consensus
            - Contradictory evidence
            - Recent developments (last 2 years)

            Provide comprehensive evidence with citations and a quality assessment.
            """.formatted(context.field(), hypothesis.getMetadata().value());
    }

    private String analysisPrompt(ResearchContext context, GraphNode hypothesis) {
        return """
            Analyze the evidential standing of this hypothesis for scientific rigor and relevance:

            **Hypothesis**: %s
            **Field**: %s
            **Falsification Criteria**: %s

            Provide a structured analysis:
            1. **Evidence Quality Assessment** (High/Medium/Low)
            2. **Statistical Power Analysis**
            3. **Bias Detection**
            4. **Confidence Updates** (empirical support, theoretical basis, methodological rigor, consensus alignment)
            5. **Relationship Type** (causal, correlational, contradictory, temporal or supportive)
            6. **Knowledge Gaps Identified**
            """.formatted(hypothesis.getMetadata().value(), context.field(),
                hypothesis.getMetadata().hypothesis() != null
                    ? hypothesis.getMetadata().hypothesis().falsificationCriteria() : "not specified");
    }

    private String buildContent(int count, Map<EvidenceQuality, Integer> qualityCounts, List<HyperEdge> hyperedges) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 4: Evidence Integration Complete\n\n");
        content.append("Integrated evidence for ").append(count).append(" hypotheses.\n\n");
        content.append("## Evidence Quality\n");
        for (EvidenceQuality quality : EvidenceQuality.values()) {
            content.append("- ").append(quality.getValue()).append(": ")
                .append(qualityCounts.getOrDefault(quality, 0)).append('\n');
        }
        content.append("\n## Hyperedges\n");
        if (hyperedges.isEmpty()) {
            content.append("None\n");
        }
        for (HyperEdge hyperedge : hyperedges) {
            content.append("- ").append(hyperedge.type().getValue()).append(": ")
                .append(hyperedge.nodes().size()).append(" nodes\n");
        }
        return content.toString();
    }
}
