package br.edu.ifba.asrgot.llm;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.core.TokenUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class ChunkedModelCallServiceTest {

    private static final ApiCredentials CREDENTIALS = ApiCredentials.gemini("test-key");

    private final List<String> prompts = Collections.synchronizedList(new ArrayList<>());

    @Test
    @DisplayName("Prompts under the threshold are passed through untouched")
    void testSmallPromptIsDelegated() {
        ChunkedModelCallService service = new ChunkedModelCallService(recording(-1), 1000);

        ModelResponse response = service.call(request("short prompt")).join();

        assertEquals(List.of("short prompt"), prompts);
        assertEquals("ok: short prompt", response.text());
    }

    @Test
    @DisplayName("Large prompts are split and the outputs joined in chunk order")
    void testLargePromptIsChunked() {
        // Arrange
        String prompt = "memory consolidation during slow wave sleep ".repeat(40);
        int expectedChunks = TokenEstimator.chunk(prompt, 20).size();
        ChunkedModelCallService service = new ChunkedModelCallService(recording(-1), 20);

        // Act
        ModelResponse response = service.call(request(prompt)).join();

        // Assert
        assertTrue(expectedChunks > 1);
        assertEquals(expectedChunks, prompts.size());
        assertEquals(expectedChunks, response.text().split(ChunkedModelCallService.CHUNK_SEPARATOR).length);
        assertEquals(expectedChunks * 3, response.usage().input());
    }

    @Test
    @DisplayName("A failed chunk is replaced by an error marker")
    void testFailedChunkBecomesMarker() {
        // Arrange
        String prompt = "memory consolidation during slow wave sleep ".repeat(40);
        ChunkedModelCallService service = new ChunkedModelCallService(recording(2), 20);

        // Act
        ModelResponse response = service.call(request(prompt)).join();

        // Assert
        assertTrue(response.text().contains("[Error processing chunk 2]"));
        assertFalse(response.text().contains(ChunkedModelCallService.errorMarker(1)));
    }

    @Test
    void testRejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkedModelCallService(recording(-1), 0));
    }

    @Test
    void testTokenEstimates() {
        assertEquals(0, TokenEstimator.estimateTokens(null));
        assertEquals(3, TokenEstimator.estimateTokensApproximate("abcdefghij"));
        assertTrue(TokenEstimator.chunk("", 10).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> TokenEstimator.chunk("text", 0));
    }

    /**
     * Delegate that records every prompt and fails the call with the given 1-based number.
     */
    private ModelCallService recording(int failingCall) {
        return request -> {
            prompts.add(request.prompt());
            if (prompts.size() == failingCall) {
                return CompletableFuture.failedFuture(new IllegalStateException("boom"));
            }
            return CompletableFuture.completedFuture(
                new ModelResponse("ok: " + request.prompt(), new TokenUsage(3, 1)));
        };
    }

    private static ModelRequest request(String prompt) {
        return ModelRequest.thinking(prompt, CREDENTIALS, ModelOptions.NONE);
    }
}
