package br.edu.ifba.asrgot.llm.gemini;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;
import java.util.Map;

/**
 * REST client for the Gemini {@code generateContent} endpoint.
 *
 * <p>Registered with the key "gemini":
 * <pre>
 * quarkus.rest-client.gemini.url=https://generativelanguage.googleapis.com
 * quarkus.rest-client.gemini.read-timeout=120000
 * </pre>
 */
@RegisterRestClient(configKey = "gemini")
@RegisterProvider(GeminiClientExceptionMapper.class)
@Path("/v1beta/models")
public interface GeminiClient {

    /**
     * Generates content for a single prompt.
     *
     * @param model    model name, e.g. "gemini-2.5-pro"
     * @param apiKey   API key sent as {@code x-goog-api-key}
     * @param cache    "true" to request prompt caching, null otherwise
     * @param cacheKey SHA-256 cache key, null when not caching
     * @param request  request body
     */
    @POST
    @Path("/{model}:generateContent")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    GenerateContentResponse generateContent(
        @PathParam("model") String model,
        @HeaderParam("x-goog-api-key") String apiKey,
        @HeaderParam("x-goog-cache") String cache,
        @HeaderParam("x-goog-cache-key") String cacheKey,
        GenerateContentRequest request
    );

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateContentRequest(
        List<Content> contents,
        GenerationConfig generationConfig,
        Content systemInstruction,
        List<Tool> tools
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Content(String role, List<Part> parts) {
        public static Content user(String text) {
            return new Content("user", List.of(new Part(text)));
        }

        public static Content system(String text) {
            return new Content(null, List.of(new Part(text)));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Part(String text) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerationConfig(
        Double temperature,
        Integer maxOutputTokens,
        Double topP,
        Integer topK,
        String responseMimeType,
        Map<String, Object> responseSchema
    ) {}

    /**
     * One tool declaration; exactly one field is set.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Tool(GoogleSearchRetrieval googleSearchRetrieval, Map<String, Object> codeExecution) {
        public static Tool searchRetrieval(double dynamicThreshold) {
            return new Tool(new GoogleSearchRetrieval(
                new DynamicRetrievalConfig("MODE_DYNAMIC", dynamicThreshold)), null);
        }

        public static Tool codeExecutionTool() {
            return new Tool(null, Map.of());
        }
    }

    record GoogleSearchRetrieval(DynamicRetrievalConfig dynamicRetrievalConfig) {}

    record DynamicRetrievalConfig(String mode, double dynamicThreshold) {}

    record GenerateContentResponse(List<Candidate> candidates, UsageMetadata usageMetadata) {}

    record Candidate(Content content, String finishReason) {}

    record UsageMetadata(Integer promptTokenCount, Integer candidatesTokenCount, Integer totalTokenCount) {}
}
