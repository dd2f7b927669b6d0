package br.edu.ifba.asrgot.llm;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Sends prompts to a language model.
 *
 * <p>Failures (transport errors, non-2xx responses, quota or timeout) complete the future
 * exceptionally with a {@link br.edu.ifba.asrgot.exception.ModelCallException}.</p>
 */
public interface ModelCallService {

    /**
     * Issues one model call.
     *
     * @param request prompt, credentials and capabilities
     * @return future completed with the response text and token usage
     */
    @NotNull
    CompletableFuture<ModelResponse> call(@NotNull ModelRequest request);
}
