package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Session-wide facts derived by stage 1 and read by every later stage.
 *
 * <p>Stage 1 is the only writer of field, objectives and constraints. Stage 3 records the
 * generated hypothesis texts through {@link #withHypotheses(List)}.</p>
 *
 * @param field                       primary research field
 * @param topic                       the research question as submitted
 * @param objectives                  research objectives
 * @param constraints                 research constraints
 * @param secondaryFields             related fields
 * @param interdisciplinaryConnections cross-field connections named by the model
 * @param initialScope                initial scope statement
 * @param hypotheses                  hypothesis texts generated by stage 3
 * @param autoGenerated               true when the facts came from model output rather than the caller
 */
public record ResearchContext(
    @JsonProperty("field") String field,
    @JsonProperty("topic") String topic,
    @JsonProperty("objectives") List<String> objectives,
    @JsonProperty("constraints") List<String> constraints,
    @JsonProperty("secondary_fields") List<String> secondaryFields,
    @JsonProperty("interdisciplinary_connections") List<String> interdisciplinaryConnections,
    @JsonProperty("initial_scope") String initialScope,
    @JsonProperty("hypotheses") List<String> hypotheses,
    @JsonProperty("auto_generated") boolean autoGenerated
) {

    public static final String DEFAULT_FIELD = "General Science";
    public static final List<String> DEFAULT_OBJECTIVES = List.of("Comprehensive analysis");

    public ResearchContext {
        field = field != null && !field.isBlank() ? field : DEFAULT_FIELD;
        topic = topic != null ? topic : "";
        objectives = objectives != null && !objectives.isEmpty() ? List.copyOf(objectives) : DEFAULT_OBJECTIVES;
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        secondaryFields = secondaryFields != null ? List.copyOf(secondaryFields) : List.of();
        interdisciplinaryConnections = interdisciplinaryConnections != null
            ? List.copyOf(interdisciplinaryConnections) : List.of();
        initialScope = initialScope != null ? initialScope : "";
        hypotheses = hypotheses != null ? List.copyOf(hypotheses) : List.of();
    }

    /**
     * Context used before stage 1 has run.
     */
    public static ResearchContext empty() {
        return new ResearchContext(DEFAULT_FIELD, "", DEFAULT_OBJECTIVES, List.of(), List.of(), List.of(),
            "", List.of(), false);
    }

    @NotNull
    public ResearchContext withHypotheses(@NotNull List<String> newHypotheses) {
        return new ResearchContext(field, topic, objectives, constraints, secondaryFields,
            interdisciplinaryConnections, initialScope, newHypotheses, autoGenerated);
    }
}
