package br.edu.ifba.asrgot.stage.handlers;

import br.edu.ifba.asrgot.core.AuditDetails;
import br.edu.ifba.asrgot.core.ConfidenceVector;
import br.edu.ifba.asrgot.core.EvidenceDetails;
import br.edu.ifba.asrgot.core.GraphDocument;
import br.edu.ifba.asrgot.core.GraphNode;
import br.edu.ifba.asrgot.core.NodeMetadata;
import br.edu.ifba.asrgot.core.NodeType;
import br.edu.ifba.asrgot.core.ResearchContext;
import br.edu.ifba.asrgot.core.ResearchStage;
import br.edu.ifba.asrgot.extraction.JsonResponseParser;
import br.edu.ifba.asrgot.scheduler.TaskPriority;
import br.edu.ifba.asrgot.stage.StageExecution;
import br.edu.ifba.asrgot.stage.StageHandler;
import br.edu.ifba.asrgot.stage.StageOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Stage 8: audits the analysis and records the outcome in a single reflection node.
 *
 * <p>The audit is requested as JSON with an {@code auditFindings} object. When it cannot be
 * parsed, the pass flag and issues are taken from keywords in the text. Earlier nodes are
 * never modified.</p>
 */
public class ReflectionHandler implements StageHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReflectionHandler.class);

    public static final String REFLECTION_ID = "audit_reflection";
    public static final ConfidenceVector REFLECTION_CONFIDENCE = new ConfidenceVector(0.95, 0.9, 0.95, 0.9);

    static final String STATUS_PASSED = "passed";
    static final String STATUS_NEEDS_REVISION = "needs_revision";

    private static final int MAX_HEURISTIC_ISSUES = 10;
    private static final int MAX_COMPOSITION_CHARS = 5000;

    private static final Pattern REVISION_MARKER = Pattern.compile(
        "needs[_ ]revision|critical issue|fails? (?:the )?audit|not passed", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISSUE_LINE = Pattern.compile(
        "^\\s*(?:[-*•]|\\d+[.)])\\s*.*\\b(?:issue|bias|missing|lack|insufficient|unfalsifiable|confound)",
        Pattern.CASE_INSENSITIVE);

    private static final Map<String, Object> AUDIT_SCHEMA = Map.of(
        "type", "object",
        "properties", Map.of(
            "auditFindings", Map.of(
                "type", "object",
                "properties", Map.of(
                    "criticalIssues", Map.of("type", "array", "items", Map.of("type", "string")),
                    "qualityImprovements", Map.of("type", "array", "items", Map.of("type", "string")),
                    "validationStatus", Map.of("type", "string", "enum", List.of(STATUS_PASSED, STATUS_NEEDS_REVISION))
                ),
                "required", List.of("validationStatus")
            )
        ),
        "required", List.of("auditFindings")
    );

    @Override
    @NotNull
    public ResearchStage getStage() {
        return ResearchStage.REFLECTION;
    }

    @Override
    @NotNull
    public StageOutcome execute(@NotNull StageExecution execution) {
        ResearchContext context = execution.getResearchContext();
        GraphDocument graph = execution.getGraph();

        String response = execution.ask(
            execution.structured(buildPrompt(context, graph, execution.getSession().getComposition().orElse("")),
                AUDIT_SCHEMA),
            TaskPriority.HIGH, execution.getSettings().resultTimeout());
        execution.getSession().setAudit(response);

        AuditDetails audit = parseAudit(response);
        GraphNode reflection = GraphNode.builder()
            .id(REFLECTION_ID)
            .label("Quality Audit")
            .type(NodeType.REFLECTION)
            .confidence(REFLECTION_CONFIDENCE)
            .metadata(NodeMetadata.builder()
                .stage(ResearchStage.REFLECTION.getNumber())
                .impactScore(1.0)
                .addTag(context.field())
                .value(response)
                .notes(audit.passed() ? "Audit passed" : "Audit requires revision")
                .audit(audit)
                .build())
            .build();
        execution.upsertNode(reflection);

        long biasFlags = audit.issues().stream()
            .filter(issue -> issue.toLowerCase(Locale.ROOT).contains("bias"))
            .count();
        Map<String, Number> figures = new LinkedHashMap<>();
        figures.put("passed", audit.passed() ? 1 : 0);
        figures.put("issues", audit.issues().size());
        figures.put("quality_improvements", audit.qualityImprovements().size());
        figures.put("bias_flags", biasFlags);

        return new StageOutcome(buildContent(audit), List.of(reflection), figures);
    }

    AuditDetails parseAudit(String response) {
        JsonNode findings = JsonResponseParser.parseObject(response)
            .map(node -> node.path("auditFindings"))
            .filter(JsonNode::isObject)
            .orElse(null);
        if (findings != null && JsonResponseParser.text(findings, "validationStatus") != null) {
            String status = JsonResponseParser.text(findings, "validationStatus");
            return new AuditDetails(
                STATUS_PASSED.equalsIgnoreCase(status),
                JsonResponseParser.textList(findings, "criticalIssues"),
                JsonResponseParser.textList(findings, "qualityImprovements"));
        }

        logger.debug("Audit response has no auditFindings object, using keyword heuristics");
        if (response == null || response.isBlank()) {
            return new AuditDetails(true, List.of(), List.of());
        }
        List<String> issues = new ArrayList<>();
        for (String line : response.split("\\R")) {
            if (issues.size() >= MAX_HEURISTIC_ISSUES) {
                break;
            }
            if (ISSUE_LINE.matcher(line).find()) {
                issues.add(line.replaceFirst("^\\s*(?:[-*•]|\\d+[.)])\\s*", "").trim());
            }
        }
        boolean passed = !REVISION_MARKER.matcher(response).find();
        return new AuditDetails(passed, issues, List.of());
    }

    private String buildPrompt(ResearchContext context, GraphDocument graph, String composition) {
        StringBuilder evidence = new StringBuilder();
        for (GraphNode node : graph.nodesOfType(NodeType.EVIDENCE)) {
            EvidenceDetails details = node.getMetadata().evidence();
            evidence.append(String.format(Locale.ROOT, "- %s: confidence %s, power %.2f, quality %s, %s%n",
                node.getLabel(), node.getConfidence().toList(),
                details != null ? details.statisticalPower() : 0.0,
                details != null ? details.quality().getValue() : "unknown",
                details != null ? details.peerReviewStatus() : EvidenceDetails.UNKNOWN));
        }
        String plan = composition.length() > MAX_COMPOSITION_CHARS
            ? composition.substring(0, MAX_COMPOSITION_CHARS) + "..."
            : composition;

        return """
            Conduct a quality audit of this %s research analysis on "%s".

            **Composition plan**:
            %s

            **Evidence**:
            %s
            **Graph**: %d nodes, %d edges, %d hyperedges

            Check:
            1. **Bias**: selection, confirmation, publication or funding bias in the evidence
            2. **Statistical rigor**: adequacy of power and sample sizes
            3. **Falsifiability**: whether every hypothesis can be refuted
            4. **Causality**: causal claims resting on correlational evidence
            5. **Coverage**: dimensions or hypotheses left without evidence

            Return JSON:
            {
              "auditFindings": {
                "criticalIssues": [],
                "qualityImprovements": [],
                "validationStatus": "passed|needs_revision"
              }
            }
            """.formatted(context.field(), context.topic(), plan, evidence, graph.nodeCount(),
                graph.edgeCount(), graph.hyperedgeCount());
    }

    private String buildContent(AuditDetails audit) {
        StringBuilder content = new StringBuilder();
        content.append("# Stage 8: Reflection Complete\n\n");
        content.append("**Validation status**: ").append(audit.passed() ? STATUS_PASSED : STATUS_NEEDS_REVISION)
            .append("\n\n");
        if (!audit.issues().isEmpty()) {
            content.append("## Critical Issues\n");
            audit.issues().forEach(issue -> content.append("- ").append(issue).append('\n'));
            content.append('\n');
        }
        if (!audit.qualityImprovements().isEmpty()) {
            content.append("## Suggested Improvements\n");
            audit.qualityImprovements().forEach(item -> content.append("- ").append(item).append('\n'));
        }
        return content.toString();
    }
}
