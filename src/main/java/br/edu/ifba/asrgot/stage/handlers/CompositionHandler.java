package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.algorithms.GraphAlgorithms;
import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EdgeType;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphEdge;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.HyperEdge;
import br.edu.ifba.asrgot.core.HyperEdgeType;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.core.SynthesisDetails;
import br.edu.ifba.asrgot.extraction.JsonResponseParser;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import br.edu.ifba.asrgot.stage.StageToolkit;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stage 7: turns the extracted subgraph into a section plan of synthesis nodes.
 *
 * <p>The model returns a JSON plan of sections, each citing evidence node ids. Citations
 * that do not name an evidence node of the subgraph are dropped. Without a parseable plan
 * the whole response becomes a single "Synthesis" section citing every evidence node of
 * the subgraph.</p>
 */
public class CompositionHandler implements StageHandler {

    private static final Logger logger = LoggerFactory.getLogger(CompositionHandler.class);

    public static final String FALLBACK_SECTION = "Synthesis";

    static final double SYNTHESIS_IMPACT = 0.8;

    private static final Duration COMPOSITION_TIMEOUT = Duration.ofSeconds(60);

    private static final int MAX_LISTED_NODES = 40;

    private static final Map<String, Object> PLAN_SCHEMA = Map.of(
        "type", "object",
        "properties", Map.of(
            "sections", Map.of(
                "type", "array",
                "items", Map.of(
                    "type", "object",
                    "properties", Map.of(
                        "name", Map.of("type", "string"),
                        "content", Map.of("type", "string"),
                        "wordCount", Map.of("type", "integer"),
                        "citations", Map.of("type", "array", "items", Map.of("type", "string"))
                    ),
                    "required", List.of("name", "content")
                )
            )
        ),
        "required", List.of("sections")
    );

    private final GraphAlgorithms algorithms;

    public CompositionHandler(@NotNull StageToolkit toolkit) {
        this.algorithms = toolkit.algorithms();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.COMPOSITION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        ResearchContext context = execution.getResearchContext();
        GraphDocument graph = execution.getGraph();
        GraphDocument subgraph = execution.getSession().getExtractedSubgraph()
            .orElseGet(() -> algorithms.extractHighImpactSubgraph(graph,
                execution.getSettings().highImpactThreshold(), true));

        List<GraphNode> evidence = subgraph.nodesOfType(NodeType.EVIDENCE);
        Set<String> evidenceIds = evidence.stream()
            .map(GraphNode::getId)
            .filter(graph::containsNode)
            .collect(Collectors.toCollection(LinkedHashSet::new));

        String response = execution.ask(execution.structured(buildPrompt(context, subgraph, evidenceIds), PLAN_SCHEMA),
            TaskPriority.HIGH, COMPOSITION_TIMEOUT);
        execution.getSession().setComposition(response);

        List<Section> sections = parseSections(response, evidenceIds);
        int replaced = clearPreviousComposition(graph);
        List<GraphNode> created = new ArrayList<>();
        for (int i = 0; i < sections.size(); i++) {
            Section section = sections.get(i);
            GraphNode node = buildSynthesisNode(graph, context, i + 1, section);
            execution.upsertNode(node);
            linkCitations(graph, node, section);
            created.add(node);
        }

        int citations = sections.stream().mapToInt(section -> section.citations().size()).sum();
        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("sections", sections.size());
        figures.put("citations", citations);
        figures.put("subgraph_nodes", subgraph.nodeCount());
        figures.put("replaced_sections", replaced);

        return new StageOutcome(buildContent(sections), created, figures);
    }

    List<Section> parseSections(String response, Set<String> evidenceIds) {
        List<Section> sections = new ArrayList<>();
        JsonNode plan = JsonResponseParser.parseObject(response).orElse(null);
        if (plan != null && plan.path("sections").isArray()) {
            for (JsonNode item : plan.path("sections")) {
                String name = JsonResponseParser.text(item, "name");
                if (name == null) {
                    continue;
                }
                String content = JsonResponseParser.text(item, "content");
                List<String> citations = JsonResponseParser.textList(item, "citations").stream()
                    .filter(evidenceIds::contains)
                    .distinct()
                    .collect(Collectors.toList());
                sections.add(new Section(name, content != null ? content : "", citations,
                    item.path("wordCount").asInt(0)));
            }
        }
        if (sections.isEmpty()) {
            logger.debug("No section plan in composition response, using a single {} section", FALLBACK_SECTION);
            String content = response != null && !response.isBlank() ? response.trim() : "";
            sections.add(new Section(FALLBACK_SECTION, content, new ArrayList<>(evidenceIds),
                content.isEmpty() ? 0 : content.split("\\s+").length));
        }
        return sections;
    }

    /**
     * Removes synthesis nodes of an earlier composition together with their edges and
     * synthesis hyperedges.
     *
     * @return number of synthesis nodes removed
     */
    int clearPreviousComposition(GraphDocument graph) {
        Set<String> stale = graph.nodesOfType(NodeType.SYNTHESIS).stream()
            .map(GraphNode::getId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (stale.isEmpty()) {
            return 0;
        }
        stale.forEach(graph::removeNode);
        graph.replaceEdges(graph.getEdges().stream()
            .filter(edge -> !stale.contains(edge.source()) && !stale.contains(edge.target()))
            .collect(Collectors.toList()));
        graph.replaceHyperedges(graph.getHyperedges().stream()
            .filter(hyperedge -> hyperedge.type() != HyperEdgeType.SYNTHESIS
                && hyperedge.nodes().stream().noneMatch(stale::contains))
            .collect(Collectors.toList()));
        logger.debug("Replacing {} synthesis sections from an earlier composition", stale.size());
        return stale.size();
    }

    private GraphNode buildSynthesisNode(GraphDocument graph, ResearchContext context, int index, Section section) {
        List<ConfidenceVector> cited = new ArrayList<>();
        for (String id : section.citations()) {
            graph.getNode(id).ifPresent(node -> cited.add(node.getConfidence()));
        }
        ConfidenceVector confidence = cited.isEmpty() ? ConfidenceVector.DEFAULT : ConfidenceVector.average(cited);

        return GraphNode.builder()
            .id("syn_" + index)
            .label(section.name())
            .type(NodeType.SYNTHESIS)
            .confidence(confidence)
            .metadata(NodeMetadata.builder()
                .stage(ResearchStage.COMPOSITION.getNumber())
                .impactScore(SYNTHESIS_IMPACT)
                .addTag(context.field())
                .value(section.content())
                .notes("Composition section " + index)
                .synthesis(new SynthesisDetails(section.name(), section.citations(), section.wordCount()))
                .build())
            .build();
    }

    private void linkCitations(GraphDocument graph, GraphNode synthesis, Section section) {
        double total = 0.0;
        for (String evidenceId : section.citations()) {
            GraphNode evidence = graph.getNode(evidenceId).orElse(null);
            if (evidence == null) {
                continue;
            }
            graph.addEdge(GraphEdge.of("edge_" + evidenceId + "_" + synthesis.getId(), evidenceId,
                synthesis.getId(), EdgeType.SUPPORTIVE, evidence.getConfidence().empiricalSupport()));
            total += evidence.getConfidence().mean();
        }
        if (section.citations().size() >= 2) {
            List<String> members = new ArrayList<>(section.citations());
            graph.addHyperedge(new HyperEdge("hyper_synthesis_" + synthesis.getId(), members,
                HyperEdgeType.SYNTHESIS, "Synthesis: " + section.name(),
                ConfidenceVector.clamp(total / members.size())));
        }
    }

    private String buildPrompt(ResearchContext context, GraphDocument subgraph, Set<String> evidenceIds) {
        StringBuilder nodes = new StringBuilder();
        subgraph.getNodes().stream()
            .sorted((a, b) -> Double.compare(b.impactScore(), a.impactScore()))
            .limit(MAX_LISTED_NODES)
            .forEach(node -> nodes.append(String.format(Locale.ROOT, "- [%s] %s (%s, confidence %.2f): %s%n",
                node.getId(), node.getLabel(), node.getType().getValue(), node.getConfidence().mean(),
                HypothesisGenerationHandler.abbreviate(node.getMetadata().value(), 200))));

        return """
            Organize the research analysis into a structured composition plan.

            **Research Context**:
            - Topic: %s
            - Field: %s
            - Hypotheses: %d

            **High-impact subgraph**:
            %s
            **Citable evidence ids**: %s

            Propose sections such as Executive Summary, Methodology, Evidence Analysis,
            Statistical Assessment, Hypothesis Evaluation, Knowledge Gaps and Conclusions.
            Distinguish causal from correlational claims and present contradictory evidence.
            Cite evidence only by the ids listed above.

            Return JSON:
            {
              "sections": [
                {"name": "Executive Summary", "content": "synthesized text", "wordCount": 250, "citations": ["evidence id"]}
              ]
            }
            """.formatted(context.topic(), context.field(), context.hypotheses().size(), nodes,
                evidenceIds.isEmpty() ? "none" : String.join(", ", evidenceIds));
    }

    private String buildContent(List<Section> sections) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 7: Composition Complete\n\n");
        for (int i = 0; i < sections.size(); i++) {
            Section section = sections.get(i);
            content.append("## ").append(section.name()).append(" (syn_").append(i + 1).append(")\n");
            if (!section.content().isBlank()) {
                content.append(HypothesisGenerationHandler.abbreviate(section.content(), 300)).append('\n');
            }
            if (!section.citations().isEmpty()) {
                content.append("_Citations: ").append(String.join(", ", section.citations())).append("_\n");
            }
            content.append('\n');
        }
        return content.toString();
    }

    record Section(String name, String content, List<String> citations, int wordCount) {
    }
}
