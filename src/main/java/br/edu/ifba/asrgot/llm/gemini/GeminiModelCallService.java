package br.edu.ifba.asrgot.llm.gemini;

import br.edu.ifba.asrgot.exception.AsrGotException;
import br.edu.ifba.asrgot.exception.ModelCallException;
import br.edu.ifba.asrgot.llm.ModelCallService;
import br.edu.ifba.asrgot.llm.ModelRequest;
import br.edu.ifba.asrgot.llm.ModelResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * {@link ModelCallService} backed by the Gemini REST API.
 *
 * <p>Failures other than pipeline exceptions are wrapped in {@link ModelCallException}.</p>
 */
@ApplicationScoped
public class GeminiModelCallService implements ModelCallService {

    private static final Logger LOG = Logger.getLogger(GeminiModelCallService.class);

    @Inject
    GeminiGateway gateway;

    @Override
    @NotNull
    public CompletableFuture<ModelResponse> call(@NotNull ModelRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return gateway.generate(request);
            } catch (AsrGotException e) {
                throw e;
            } catch (RuntimeException e) {
                LOG.warnf("Gemini call failed: %s", e.getMessage());
                throw new ModelCallException("Gemini call failed: " + e.getMessage(), e);
            }
        });
    }
}
