package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Bookkeeping record for one stage execution.
 *
 * <p>A running context is replaced by exactly one completed or error context; the
 * history kept by the engine is otherwise append-only.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageContext(
    @JsonProperty("stage_id") int stageId,
    @JsonProperty("stage_name") String stageName,
    @JsonProperty("status") StageStatus status,
    @JsonProperty("error_message") @Nullable String errorMessage,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") @Nullable Instant completedAt,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("token_usage") TokenUsage tokenUsage,
    @JsonProperty("model_calls") int modelCalls
) {

    public static final String UNKNOWN_ERROR = "Unknown error";

    public static StageContext running(ResearchStage stage) {
        return new StageContext(stage.getNumber(), stage.getDisplayName(), StageStatus.RUNNING, null,
            Instant.now(), null, 0L, TokenUsage.ZERO, 0);
    }

    public StageContext completed(TokenUsage usage, int calls) {
        Instant now = Instant.now();
        return new StageContext(stageId, stageName, StageStatus.COMPLETED, null, startedAt, now,
            Duration.between(startedAt, now).toMillis(), usage, calls);
    }

    public StageContext failed(@Nullable String message, TokenUsage usage, int calls) {
        Instant now = Instant.now();
        String effective = message != null && !message.isBlank() ? message : UNKNOWN_ERROR;
        return new StageContext(stageId, stageName, StageStatus.ERROR, effective, startedAt, now,
            Duration.between(startedAt, now).toMillis(), usage, calls);
    }

    public boolean isCompleted() {
        return status == StageStatus.COMPLETED;
    }
}
