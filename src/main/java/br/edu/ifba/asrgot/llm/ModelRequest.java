package br.edu.ifba.asrgot.llm;

import br.edu.ifba.asrgot.core.ApiCredentials;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A single call to the model provider.
 *
 * @param prompt       prompt text
 * @param credentials  provider keys
 * @param capabilities requested capabilities
 * @param schema       JSON schema for structured output, may be null
 * @param options      generation overrides
 */
public record ModelRequest(
    String prompt,
    ApiCredentials credentials,
    Set<Capability> capabilities,
    @Nullable Map<String, Object> schema,
    ModelOptions options
) {

    public ModelRequest {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(credentials, "credentials must not be null");
        capabilities = capabilities == null || capabilities.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        options = options != null ? options : ModelOptions.NONE;
    }

    /** Reasoning-only request. */
    public static ModelRequest thinking(@NotNull String prompt, @NotNull ApiCredentials credentials,
                                        @NotNull ModelOptions options) {
        return new ModelRequest(prompt, credentials, EnumSet.of(Capability.THINKING), null, options);
    }

    /** Reasoning plus web search grounding. */
    public static ModelRequest searchGrounded(@NotNull String prompt, @NotNull ApiCredentials credentials,
                                              @NotNull ModelOptions options) {
        return new ModelRequest(prompt, credentials,
            EnumSet.of(Capability.THINKING, Capability.SEARCH_GROUNDING), null, options);
    }

    /** Reasoning plus a JSON response constrained by {@code schema}. */
    public static ModelRequest structured(@NotNull String prompt, @NotNull ApiCredentials credentials,
                                          @NotNull Map<String, Object> schema, @NotNull ModelOptions options) {
        return new ModelRequest(prompt, credentials,
            EnumSet.of(Capability.THINKING, Capability.STRUCTURED_OUTPUTS), schema, options);
    }

    /**
     * The additional (non-THINKING) capability, if any. When several are present the first
     * in declaration order is returned.
     */
    public Optional<Capability> tool() {
        return capabilities.stream().filter(Capability::isTool).findFirst();
    }

    /** Copy with a different prompt, used for chunked calls. */
    public ModelRequest withPrompt(@NotNull String newPrompt) {
        return new ModelRequest(newPrompt, credentials, capabilities, schema, options);
    }
}
