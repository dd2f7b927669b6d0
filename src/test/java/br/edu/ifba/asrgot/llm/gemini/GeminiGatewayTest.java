package br.edu.ifba.asrgot.llm.gemini;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.asrgot.core.ApiCredentials;
import br.edu.ifba.asrgot.exception.MalformedResponseException;
import br.edu.ifba.asrgot.exception.MissingCredentialsException;
import br.edu.ifba.asrgot.llm.Capability;
import br.edu.ifba.asrgot.llm.ModelOptions;
import br.edu.ifba.asrgot.llm.ModelRequest;
import br.edu.ifba.asrgot.llm.ModelResponse;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.Candidate;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.Content;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.GenerateContentRequest;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.GenerateContentResponse;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.Part;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.UsageMetadata;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;

/**
 * Request building and response handling of {@link GeminiGateway}, with the REST client mocked.
 */
@QuarkusTest
class GeminiGatewayTest {

    private static final String MODEL = "gemini-2.5-pro";
    private static final ApiCredentials CREDENTIALS = ApiCredentials.gemini("test-key");

    @Inject
    GeminiGateway gateway;

    @InjectMock
    @RestClient
    GeminiClient client;

    // =========================================================================
    // Calls
    // =========================================================================

    @Test
    @DisplayName("Text parts are joined and usage is reported")
    void testGenerate() {
        // Arrange
        when(client.generateContent(anyString(), anyString(), any(), any(), any(GenerateContentRequest.class)))
            .thenReturn(response(List.of(new Part("Hello "), new Part("world")), new UsageMetadata(12, 7, 19)));
        ModelRequest request = ModelRequest.thinking("Short prompt", CREDENTIALS, ModelOptions.forStage("1"));

        // Act
        ModelResponse result = gateway.generate(request);

        // Assert
        assertEquals("Hello world", result.text());
        assertEquals(12, result.usage().input());
        assertEquals(7, result.usage().output());
        verify(client).generateContent(eq(MODEL), eq("test-key"), isNull(), isNull(), any(GenerateContentRequest.class));
    }

    @Test
    @DisplayName("Large prompts carry the cache headers")
    void testCacheHeaders() {
        // Arrange
        when(client.generateContent(anyString(), anyString(), any(), any(), any(GenerateContentRequest.class)))
            .thenReturn(response(List.of(new Part("ok")), null));
        ModelRequest request = ModelRequest.thinking("a".repeat(GeminiGateway.CACHE_THRESHOLD_BYTES + 1),
            CREDENTIALS, ModelOptions.forStage("7"));
        String expectedKey = GeminiGateway.cacheKey(request);

        // Act
        gateway.generate(request);

        // Assert
        assertEquals(64, expectedKey.length());
        verify(client).generateContent(eq(MODEL), eq("test-key"), eq("true"), eq(expectedKey),
            any(GenerateContentRequest.class));
    }

    @Test
    void testMissingKeyIsRejectedBeforeCalling() {
        ModelRequest request = ModelRequest.thinking("prompt", new ApiCredentials(null, "pplx", null),
            ModelOptions.NONE);

        assertThrows(MissingCredentialsException.class, () -> gateway.generate(request));
        verify(client, never()).generateContent(any(), any(), any(), any(), any());
    }

    @Test
    void testResponseWithoutCandidates() {
        when(client.generateContent(anyString(), anyString(), any(), any(), any(GenerateContentRequest.class)))
            .thenReturn(new GenerateContentResponse(List.of(), null));
        ModelRequest request = ModelRequest.thinking("prompt", CREDENTIALS, ModelOptions.NONE);

        assertThrows(MalformedResponseException.class, () -> gateway.generate(request));
    }

    // =========================================================================
    // Request building
    // =========================================================================

    @Test
    @DisplayName("Search grounding adds the dynamic retrieval tool")
    void testSearchGroundedRequest() {
        ModelRequest request = ModelRequest.searchGrounded("prompt", CREDENTIALS, ModelOptions.NONE);

        GenerateContentRequest body = gateway.buildRequest(request);

        assertEquals(1, body.tools().size());
        assertEquals("MODE_DYNAMIC", body.tools().get(0).googleSearchRetrieval().dynamicRetrievalConfig().mode());
        assertEquals(0.7, body.tools().get(0).googleSearchRetrieval().dynamicRetrievalConfig().dynamicThreshold(), 1e-9);
        assertNull(body.generationConfig().responseMimeType());
        assertEquals(GeminiGateway.SYSTEM_INSTRUCTION, body.systemInstruction().parts().get(0).text());
        assertEquals("user", body.contents().get(0).role());
    }

    @Test
    @DisplayName("Code execution declares an empty code execution tool")
    void testCodeExecutionRequest() {
        ModelRequest request = new ModelRequest("prompt", CREDENTIALS,
            EnumSet.of(Capability.THINKING, Capability.CODE_EXECUTION), null, ModelOptions.NONE);

        GenerateContentRequest body = gateway.buildRequest(request);

        assertEquals(1, body.tools().size());
        assertEquals(Map.of(), body.tools().get(0).codeExecution());
        assertNull(body.tools().get(0).googleSearchRetrieval());
        assertNull(body.generationConfig().responseMimeType());
    }

    @Test
    @DisplayName("Structured output sets the JSON mime type and schema without tools")
    void testStructuredRequest() {
        Map<String, Object> schema = Map.of("type", "object");
        ModelRequest request = ModelRequest.structured("prompt", CREDENTIALS, schema,
            new ModelOptions("3", 0.1, 2048));

        GenerateContentRequest body = gateway.buildRequest(request);

        assertNull(body.tools());
        assertEquals("application/json", body.generationConfig().responseMimeType());
        assertEquals(schema, body.generationConfig().responseSchema());
        assertEquals(0.1, body.generationConfig().temperature().doubleValue(), 1e-9);
        assertEquals(2048, body.generationConfig().maxOutputTokens().intValue());
    }

    @Test
    void testDefaultsFromConfiguration() {
        GenerateContentRequest body = gateway.buildRequest(
            ModelRequest.thinking("prompt", CREDENTIALS, ModelOptions.NONE));

        assertNull(body.tools());
        assertEquals(0.4, body.generationConfig().temperature().doubleValue(), 1e-9);
        assertEquals(65536, body.generationConfig().maxOutputTokens().intValue());
        assertEquals(40, body.generationConfig().topK().intValue());
        assertTrue(body.generationConfig().topP() > 0.0);
    }

    private static GenerateContentResponse response(List<Part> parts, UsageMetadata usage) {
        return new GenerateContentResponse(List.of(new Candidate(new Content("model", parts), "STOP")), usage);
    }
}
