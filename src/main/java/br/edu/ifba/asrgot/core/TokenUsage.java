package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token consumption of one or more model calls.
 *
 * <p>Immutable; {@link #plus(TokenUsage)} aggregates usage across calls of a stage.</p>
 *
 * @param input  tokens sent to the model
 * @param output tokens received from the model
 */
public record TokenUsage(
    @JsonProperty("input") int input,
    @JsonProperty("output") int output
) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0);

    /**
     * Compact constructor with validation.
     */
    public TokenUsage {
        if (input < 0) {
            throw new IllegalArgumentException("input must be >= 0, got: " + input);
        }
        if (output < 0) {
            throw new IllegalArgumentException("output must be >= 0, got: " + output);
        }
    }

    /**
     * Returns the total tokens (input + output).
     */
    @JsonProperty("total")
    public int total() {
        return input + output;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(input + other.input, output + other.output);
    }
}
