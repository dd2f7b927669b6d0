package br.edu.ifba.asrgot.stage;

import br.edu.ifba.asrgot.core.TokenUsage;
import br.edu.ifba.asrgot.exception.ModelCallException;
import br.edu.ifba.asrgot.llm.ModelCallService;
import br.edu.ifba.asrgot.llm.ModelRequest;
import br.edu.ifba.asrgot.llm.ModelResponse;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Model service for tests that answers each stage's prompt with a canned response.
 */
public class ScriptedModelCallService implements ModelCallService {

    public static final String QUERY = "How does sleep affect memory consolidation?";

    public static final String FIELD_ANALYSIS = """
        {
          "primary_field": "Neuroscience",
          "secondary_fields": ["Psychology"],
          "objectives": ["Map consolidation pathways", "Measure recall after sleep"],
          "interdisciplinary_connections": ["Cognitive science"],
          "constraints": ["Human studies only"],
          "initial_scope": "Adult sleep and memory"
        }
        """;

    public static final String DIMENSIONS = """
        Scope: Adults aged 18 to 65 in laboratory sleep studies

        Objectives: Quantify recall gains after a night of sleep

        Constraints: Ethical limits on sleep deprivation protocols
        """;

    public static final String HYPOTHESES = """
        Hypothesis 1: Slow wave sleep strengthens declarative memory
        A randomized controlled trial design, widely accepted.
        Hypothesis 2: REM sleep supports emotional memory
        Hypothesis 3: Sleep spindles predict overnight recall gains
        Hypothesis 4: Short naps give partial consolidation benefits
        Hypothesis 5: Sleep deprivation impairs encoding the next day
        """;

    public static final String EVIDENCE =
        "A peer-reviewed study published in Nature found improved recall in Psychology cohorts.";

    public static final String ANALYSIS = """
        Evidence Quality: High
        Statistical power: 0.9
        A meta-analysis with p < 0.001, widely accepted.
        Relationship: a correlation was observed.
        """;

    public static final String COMPOSITION = """
        {"sections": [
          {"name": "Executive Summary", "content": "Sleep supports memory consolidation.", "wordCount": 4,
           "citations": ["e_hn1_scope_1", "e_hn1_scope_2"]},
          {"name": "Conclusions", "content": "More longitudinal work is needed.", "wordCount": 5,
           "citations": ["unknown_evidence"]}
        ]}
        """;

    public static final String AUDIT = """
        {"auditFindings": {"validationStatus": "passed", "criticalIssues": [],
          "qualityImprovements": ["Report effect sizes"]}}
        """;

    public static final String NARRATIVE = "## Executive Summary\nSleep consolidates declarative memory.";

    private final List<ModelRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile String failOn;

    @Override
    @NotNull
    public CompletableFuture<ModelResponse> call(@NotNull ModelRequest request) {
        requests.add(request);
        String prompt = request.prompt();
        if (failOn != null && prompt.contains(failOn)) {
            return CompletableFuture.failedFuture(new ModelCallException("Scripted failure"));
        }
        return CompletableFuture.completedFuture(new ModelResponse(respond(prompt), new TokenUsage(10, 5)));
    }

    /**
     * Fails every call whose prompt contains {@code marker}; {@code null} clears it.
     */
    public void failOn(String marker) {
        this.failOn = marker;
    }

    public List<ModelRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    private static String respond(String prompt) {
        if (prompt.contains("Write the final scientific research report")) {
            return NARRATIVE;
        }
        if (prompt.contains("Conduct a quality audit")) {
            return AUDIT;
        }
        if (prompt.contains("Organize the research analysis")) {
            return COMPOSITION;
        }
        if (prompt.contains("Analyze the evidential standing")) {
            return ANALYSIS;
        }
        if (prompt.contains("Research evidence for this hypothesis")) {
            return EVIDENCE;
        }
        if (prompt.contains("testable hypotheses")) {
            return HYPOTHESES;
        }
        if (prompt.contains("dimension analysis")) {
            return DIMENSIONS;
        }
        if (prompt.contains("Analyze this research question")) {
            return FIELD_ANALYSIS;
        }
        return "No further remarks.";
    }
}
