package br.edu.ifba.asrgot.llm;

import br.edu.ifba.asrgot.core.TokenUsage;

import java.util.Objects;

/**
 * Text returned by the model provider, with token accounting.
 */
public record ModelResponse(String text, TokenUsage usage) {

    public ModelResponse {
        Objects.requireNonNull(text, "text must not be null");
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public static ModelResponse of(String text) {
        return new ModelResponse(text, TokenUsage.ZERO);
    }
}
