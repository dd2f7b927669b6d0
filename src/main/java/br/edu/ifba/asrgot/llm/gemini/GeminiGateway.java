package br.edu.ifba.asrgot.llm.gemini;

import br.edu.ifba.asrgot.config.AsrGotConfig;
import br.edu.ifba.asrgot.core.TokenUsage;
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
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.GenerationConfig;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.Part;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.Tool;
import br.edu.ifba.asrgot.llm.gemini.GeminiClient.UsageMetadata;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.List;

/**
 * Blocking Gemini call with retry on transient failures.
 *
 * <p>Features:
 * <ul>
 *   <li>exponential backoff retry on 429, 5xx and I/O errors (see {@link TransientModelErrorPredicate})</li>
 *   <li>request timeout</li>
 *   <li>prompt cache headers for prompts above {@value #CACHE_THRESHOLD_BYTES} bytes</li>
 * </ul>
 */
@ApplicationScoped
public class GeminiGateway {

    private static final Logger LOG = Logger.getLogger(GeminiGateway.class);

    static final int CACHE_THRESHOLD_BYTES = 200_000;
    static final double SEARCH_DYNAMIC_THRESHOLD = 0.7;
    static final String SYSTEM_INSTRUCTION = "You are an expert AI research assistant. Always think step-by-step "
        + "and provide detailed, accurate responses.";

    @Inject
    @RestClient
    GeminiClient client;

    @Inject
    AsrGotConfig config;

    /**
     * Sends one request and returns the first candidate's text.
     *
     * @throws MissingCredentialsException if no Gemini key is present
     * @throws GeminiApiException          on a non-2xx response (after retries)
     * @throws MalformedResponseException  if the response carries no text
     */
    @Retry(maxRetries = 3, delay = 1000, jitter = 200, maxDuration = 180, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(factor = 2, maxDelay = 16000)
    @RetryWhen(exception = TransientModelErrorPredicate.class)
    @Timeout(value = 120, unit = ChronoUnit.SECONDS)
    public ModelResponse generate(@NotNull ModelRequest request) {
        if (!request.credentials().hasGemini()) {
            throw new MissingCredentialsException("Gemini API key required");
        }

        byte[] promptBytes = request.prompt().getBytes(StandardCharsets.UTF_8);
        boolean cache = promptBytes.length > CACHE_THRESHOLD_BYTES;
        String cacheKey = cache ? cacheKey(request) : null;

        LOG.debugf("Gemini call: %d bytes, capability=%s, cache=%s",
            Integer.valueOf(promptBytes.length), request.tool().map(Enum::name).orElse("THINKING"),
            Boolean.valueOf(cache));

        GenerateContentResponse response = client.generateContent(
            config.model().name(),
            request.credentials().gemini(),
            cache ? "true" : null,
            cacheKey,
            buildRequest(request)
        );

        return new ModelResponse(firstText(response), usage(response.usageMetadata()));
    }

    GenerateContentRequest buildRequest(ModelRequest request) {
        AsrGotConfig.Model model = config.model();
        ModelOptions options = request.options();
        Capability tool = request.tool().orElse(Capability.THINKING);

        boolean structured = tool == Capability.STRUCTURED_OUTPUTS && request.schema() != null;
        GenerationConfig generationConfig = new GenerationConfig(
            options.temperature() != null ? options.temperature() : model.temperature(),
            options.maxOutputTokens() != null ? options.maxOutputTokens() : model.maxOutputTokens(),
            model.topP(),
            model.topK(),
            structured ? "application/json" : null,
            structured ? request.schema() : null
        );

        List<Tool> tools = switch (tool) {
            case SEARCH_GROUNDING -> List.of(Tool.searchRetrieval(SEARCH_DYNAMIC_THRESHOLD));
            case CODE_EXECUTION -> List.of(Tool.codeExecutionTool());
            default -> null;
        };

        return new GenerateContentRequest(
            List.of(Content.user(request.prompt())),
            generationConfig,
            Content.system(SYSTEM_INSTRUCTION),
            tools
        );
    }

    private static String firstText(GenerateContentResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw new MalformedResponseException("Invalid response from Gemini API: no candidates");
        }
        Candidate candidate = response.candidates().get(0);
        if (candidate.content() == null || candidate.content().parts() == null) {
            throw new MalformedResponseException("Invalid response from Gemini API: empty content");
        }
        StringBuilder text = new StringBuilder();
        for (Part part : candidate.content().parts()) {
            if (part.text() != null) {
                text.append(part.text());
            }
        }
        if (text.length() == 0) {
            throw new MalformedResponseException("Invalid response from Gemini API: no text parts");
        }
        return text.toString();
    }

    private static TokenUsage usage(UsageMetadata metadata) {
        if (metadata == null) {
            return TokenUsage.ZERO;
        }
        int input = metadata.promptTokenCount() != null ? metadata.promptTokenCount() : 0;
        int output = metadata.candidatesTokenCount() != null ? metadata.candidatesTokenCount() : 0;
        return new TokenUsage(input, output);
    }

    /**
     * SHA-256 of stage id followed by the prompt, hex encoded.
     */
    static String cacheKey(ModelRequest request) {
        String stageId = request.options().stageId() != null ? request.options().stageId() : "";
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((stageId + request.prompt()).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
