package br.edu.ifba.asrgot.llm.gemini;

import br.edu.ifba.asrgot.exception.ModelCallException;

/**
 * Non-2xx response from the Gemini API.
 */
public class GeminiApiException extends ModelCallException {

    private final int status;

    public GeminiApiException(final int status, final String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /** Quota exhaustion (429) or server-side failure (5xx). */
    public boolean isRetryable() {
        return status == 429 || status >= 500;
    }
}
