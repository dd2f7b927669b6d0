package br.edu.ifba.asrgot.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Credentials for a new research session. All keys are optional here; stage execution
 * fails when none is present.
 */
public record SessionCreateRequest(
        @JsonProperty("gemini_api_key")
        @Size(max = 512, message = "Gemini API key is too long")
        String geminiApiKey,

        @JsonProperty("perplexity_api_key")
        @Size(max = 512, message = "Perplexity API key is too long")
        String perplexityApiKey,

        @JsonProperty("openai_api_key")
        @Size(max = 512, message = "OpenAI API key is too long")
        String openaiApiKey,

        @JsonProperty("enforce_stage_order")
        Boolean enforceStageOrder
) {
}
