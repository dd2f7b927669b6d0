package br.edu.ifba.asrgot.llm;

import org.jetbrains.annotations.Nullable;

/**
 * Per-request overrides of the configured generation settings.
 *
 * @param stageId         stage tag, also part of the cache key for large prompts
 * @param temperature     sampling temperature, or null for the configured default
 * @param maxOutputTokens output limit, or null for the configured default
 */
public record ModelOptions(
    @Nullable String stageId,
    @Nullable Double temperature,
    @Nullable Integer maxOutputTokens
) {
    public static final ModelOptions NONE = new ModelOptions(null, null, null);

    public static ModelOptions forStage(String stageId) {
        return new ModelOptions(stageId, null, null);
    }
}
