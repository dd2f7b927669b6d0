package br.edu.ifba.asrgot.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Provider API keys supplied by the caller of a research session.
 *
 * @param gemini     Gemini API key
 * @param perplexity Perplexity API key, kept for callers that pass it; search goes through the model's search tool
 * @param openai     optional OpenAI API key
 */
public record ApiCredentials(
    @JsonProperty("gemini") @Nullable String gemini,
    @JsonProperty("perplexity") @Nullable String perplexity,
    @JsonProperty("openai") @Nullable String openai
) {

    public static final ApiCredentials NONE = new ApiCredentials(null, null, null);

    public static ApiCredentials gemini(String apiKey) {
        return new ApiCredentials(apiKey, null, null);
    }

    /**
     * True when at least one key is present and non-blank.
     */
    public boolean hasAny() {
        return present(gemini) || present(perplexity) || present(openai);
    }

    public boolean hasGemini() {
        return present(gemini);
    }

    @Override
    public String toString() {
        return "ApiCredentials{gemini=" + mask(gemini) + ", perplexity=" + mask(perplexity)
            + ", openai=" + mask(openai) + '}';
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String mask(String value) {
        return present(value) ? "***" : "<none>";
    }
}
