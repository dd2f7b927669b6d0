package br.edu.ifba.asrgot.llm;

import br.edu.ifba.asrgot.core.TokenUsage;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator that splits prompts larger than a token threshold into chunks.
 *
 * <p>Each chunk is sent as an independent call. A failed chunk contributes the marker
 * {@code [Error processing chunk N]} (1-based) instead of failing the whole call. Chunk
 * outputs are joined with blank lines, in chunk order.</p>
 */
public class ChunkedModelCallService implements ModelCallService {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedModelCallService.class);

    static final String CHUNK_SEPARATOR = "\n\n";

    private final ModelCallService delegate;
    private final int tokenThreshold;

    public ChunkedModelCallService(@NotNull ModelCallService delegate, int tokenThreshold) {
        if (tokenThreshold <= 0) {
            throw new IllegalArgumentException("tokenThreshold must be positive, got: " + tokenThreshold);
        }
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.tokenThreshold = tokenThreshold;
    }

    @Override
    @NotNull
    public CompletableFuture<ModelResponse> call(@NotNull ModelRequest request) {
        int tokens = TokenEstimator.estimateTokens(request.prompt());
        if (tokens <= tokenThreshold) {
            return delegate.call(request);
        }

        List<String> chunks = TokenEstimator.chunk(request.prompt(), tokenThreshold);
        logger.info("Prompt of {} tokens exceeds threshold {}, sending {} chunks",
            tokens, tokenThreshold, chunks.size());

        List<CompletableFuture<ModelResponse>> calls = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            calls.add(callChunk(request.withPrompt(chunks.get(i)), i + 1));
        }

        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                StringBuilder text = new StringBuilder();
                TokenUsage usage = TokenUsage.ZERO;
                for (CompletableFuture<ModelResponse> call : calls) {
                    ModelResponse response = call.join();
                    if (text.length() > 0) {
                        text.append(CHUNK_SEPARATOR);
                    }
                    text.append(response.text());
                    usage = usage.plus(response.usage());
                }
                return new ModelResponse(text.toString(), usage);
            });
    }

    private CompletableFuture<ModelResponse> callChunk(ModelRequest chunkRequest, int chunkNumber) {
        CompletableFuture<ModelResponse> future;
        try {
            future = delegate.call(chunkRequest);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(error -> {
            logger.warn("Chunk {} failed: {}", chunkNumber, error.getMessage());
            return ModelResponse.of(errorMarker(chunkNumber));
        });
    }

    static String errorMarker(int chunkNumber) {
        return "[Error processing chunk " + chunkNumber + "]";
    }
}
