package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.KnowledgeDetails;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.extraction.JsonResponseParser;
import br.edu.ifba.asrgot.extraction.TextSignalExtractor;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stage 1: detects the research field and creates the root node {@code n0_root}.
 *
 * <p>The field analysis is requested as JSON. When the response is not parseable JSON the
 * field and objectives are extracted heuristically with default constraints and scope;
 * an empty response falls back to the fixed defaults. Knowledge nodes K1 to K3 are seeded
 * the first time the stage runs in a session.</p>
 */
public class InitializationHandler implements StageHandler {

    private static final Logger logger = LoggerFactory.getLogger(InitializationHandler.class);

    public static final String ROOT_ID = "n0_root";
    public static final ConfidenceVector ROOT_CONFIDENCE = new ConfidenceVector(0.8, 0.7, 0.6, 0.8);

    static final List<String> FALLBACK_CONSTRAINTS =
        List.of("Limited computational resources", "Time constraints");
    static final String FALLBACK_SCOPE = "Comprehensive analysis required";

    private static final Duration FIELD_DETECTION_TIMEOUT = Duration.ofSeconds(30);

    private static final Map<String, Object> FIELD_ANALYSIS_SCHEMA = Map.of(
        "type", "object",
        "properties", Map.of(
            "primary_field", Map.of("type", "string"),
            "secondary_fields", Map.of("type", "array", "items", Map.of("type", "string")),
            "objectives", Map.of("type", "array", "items", Map.of("type", "string")),
            "interdisciplinary_connections", Map.of("type", "array", "items", Map.of("type", "string")),
            "constraints", Map.of("type", "array", "items", Map.of("type", "string")),
            "initial_scope", Map.of("type", "string")
        ),
        "required", List.of("primary_field", "objectives")
    );

    private final TextSignalExtractor extractor;

    public InitializationHandler(@NotNull StageToolkit toolkit) {
        this.extractor = toolkit.extractor();
    }

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.INITIALIZATION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        String query = execution.getQuery() != null ? execution.getQuery().trim() : "";

        String response = execution.ask(
            execution.structured(buildPrompt(query), FIELD_ANALYSIS_SCHEMA),
            TaskPriority.HIGH,
            FIELD_DETECTION_TIMEOUT);

        ResearchContext context = parseFieldAnalysis(response, query);
        execution.getSession().setResearchContext(context);

        GraphDocument graph = execution.getGraph();
        List<GraphNode> touched = new ArrayList<>();

        GraphNode root = buildRoot(query, context);
        execution.upsertNode(root);
        touched.add(root);

        int seeded = 0;
        if (!execution.getSession().isKnowledgeSeeded()) {
            for (GraphNode knowledge : knowledgeNodes(context)) {
                if (graph.addNode(knowledge)) {
                    touched.add(knowledge);
                    seeded++;
                }
            }
            execution.getSession().markKnowledgeSeeded();
        }

        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("secondary_fields", context.secondaryFields().size());
        figures.put("objectives", context.objectives().size());
        figures.put("knowledge_nodes", seeded);

        return new StageOutcome(buildContent(context), touched, figures);
    }

    ResearchContext parseFieldAnalysis(String response, String query) {
        Optional<JsonNode> json = JsonResponseParser.parseObject(response)
            .filter(node -> JsonResponseParser.text(node, "primary_field") != null);
        if (json.isPresent()) {
            JsonNode node = json.get();
            return new ResearchContext(
                JsonResponseParser.text(node, "primary_field"),
                query,
                JsonResponseParser.textList(node, "objectives"),
                JsonResponseParser.textList(node, "constraints"),
                JsonResponseParser.textList(node, "secondary_fields"),
                JsonResponseParser.textList(node, "interdisciplinary_connections"),
                JsonResponseParser.text(node, "initial_scope"),
                List.of(),
                true
            );
        }

        if (response == null || response.isBlank()) {
            logger.debug("Empty field analysis, using default research context");
            return new ResearchContext(TextSignalExtractor.DEFAULT_FIELD, query,
                TextSignalExtractor.DEFAULT_OBJECTIVES, List.of(), List.of(), List.of(), "", List.of(), true);
        }

        logger.debug("Field analysis is not JSON, extracting field and objectives from text");
        return new ResearchContext(
            extractor.extractField(response),
            query,
            extractor.extractObjectives(response),
            FALLBACK_CONSTRAINTS,
            List.of(),
            List.of(),
            FALLBACK_SCOPE,
            List.of(),
            true
        );
    }

    private GraphNode buildRoot(String query, ResearchContext context) {
        List<String> tags = new ArrayList<>();
        tags.add(context.field());
        tags.addAll(context.secondaryFields());

        return GraphNode.builder()
            .id(ROOT_ID)
            .label("Task Understanding")
            .type(NodeType.ROOT)
            .confidence(ROOT_CONFIDENCE)
            .metadata(NodeMetadata.builder()
                .stage(ResearchStage.INITIALIZATION.getNumber())
                .impactScore(1.0)
                .disciplinaryTags(tags)
                .value(query)
                .notes("Auto-detected field: " + context.field())
                .build())
            .build();
    }

    private List<GraphNode> knowledgeNodes(ResearchContext context) {
        Map<String, String> communication = new LinkedHashMap<>();
        communication.put("tone", "formal");
        communication.put("style", "informative");
        communication.put("citation_style", "vancouver");
        communication.put("length", "extensive");

        Map<String, String> content = new LinkedHashMap<>();
        content.put("accuracy", "high");
        content.put("innovation", "progressive");
        content.put("query_specificity", "research");

        Map<String, String> profile = new LinkedHashMap<>();
        profile.put("identity", "Researcher");
        profile.put("expertise", context.field());
        profile.put("philosophy", "Interdisciplinary, evidence-driven");

        return List.of(
            knowledgeNode("K1", "Communication Preferences", "communication_preferences",
                "Formal academic tone with Vancouver citations", communication),
            knowledgeNode("K2", "Content Requirements", "content_requirements",
                "Current, scientifically accurate and relevant research", content),
            knowledgeNode("K3", "User Profile", "user_profile",
                "Research profile of the requesting user", profile)
        );
    }

    private GraphNode knowledgeNode(String id, String label, String category, String notes,
                                    Map<String, String> attributes) {
        return GraphNode.builder()
            .id(id)
            .label(label)
            .type(NodeType.KNOWLEDGE)
            .confidence(ConfidenceVector.CERTAIN)
            .metadata(NodeMetadata.builder()
                .stage(ResearchStage.INITIALIZATION.getNumber())
                .impactScore(0.5)
                .notes(notes)
                .knowledge(new KnowledgeDetails(category, attributes))
                .build())
            .build();
    }

    private String buildPrompt(String query) {
        return """
            Analyze this research question and identify:
            1) The primary scientific field(s)
            2) Key research objectives (3-5 specific objectives)
            3) Potential interdisciplinary connections
            4) Initial constraints and considerations

            Research Question: "%s"

            Format your response as JSON:
            {
              "primary_field": "string",
              "secondary_fields": ["string"],
              "objectives": ["string"],
              "interdisciplinary_connections": ["string"],
              "constraints": ["string"],
              "initial_scope": "string"
            }
            """.formatted(query);
    }

    private String buildContent(ResearchContext context) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 1: Initialization Complete\n\n");
        content.append("## Field Analysis\n");
        content.append("**Primary Field**: ").append(context.field()).append('\n');
        content.append("**Secondary Fields**: ")
            .append(context.secondaryFields().isEmpty() ? "None identified" : String.join(", ", context.secondaryFields()))
            .append("\n\n");
        if (!context.initialScope().isBlank()) {
            content.append("## Research Scope\n").append(context.initialScope()).append("\n\n");
        }
        content.append("## Objectives\n");
        for (int i = 0; i < context.objectives().size(); i++) {
            content.append(i + 1).append(". ").append(context.objectives().get(i)).append('\n');
        }
        content.append("\n## Root Node\n");
        content.append("- **Node ID**: ").append(ROOT_ID).append(" (Task Understanding)\n");
        content.append("- **Confidence**: ").append(ROOT_CONFIDENCE.toList()).append('\n');
        return content.toString();
    }
}
