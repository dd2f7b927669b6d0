package br.edu.ifba.asrgot.llm.gemini;

import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeminiClientExceptionMapperTest {

    private final GeminiClientExceptionMapper mapper = new GeminiClientExceptionMapper();

    @Test
    @DisplayName("Gemini error JSON yields status and message")
    void testStructuredErrorBody() {
        String body = """
            {"error": {"code": 429, "message": "Quota exceeded for model", "status": "RESOURCE_EXHAUSTED"}}
            """;

        assertEquals("RESOURCE_EXHAUSTED - Quota exceeded for model", GeminiClientExceptionMapper.describe(body));
    }

    @Test
    void testPlainBodyIsTruncated() {
        String body = "x".repeat(600);

        String detail = GeminiClientExceptionMapper.describe(body);

        assertEquals(503, detail.length());
        assertTrue(detail.endsWith("..."));
    }

    @Test
    void testEmptyBody() {
        assertEquals("no details", GeminiClientExceptionMapper.describe(""));
        assertEquals("no details", GeminiClientExceptionMapper.describe(null));
    }

    @Test
    @DisplayName("Error responses become retryable or permanent exceptions by status")
    void testToThrowable() {
        RuntimeException quota = mapper.toThrowable(Response.status(429).build());
        RuntimeException badKey = mapper.toThrowable(Response.status(403).build());

        GeminiApiException quotaError = assertInstanceOf(GeminiApiException.class, quota);
        assertEquals(429, quotaError.getStatus());
        assertTrue(quotaError.isRetryable());
        assertEquals("Gemini API error 429: no details", quotaError.getMessage());

        GeminiApiException keyError = assertInstanceOf(GeminiApiException.class, badKey);
        assertFalse(keyError.isRetryable());
        assertEquals("Gemini API error 403: no details", keyError.getMessage());
    }

    @Test
    void testHandlesOnlyErrors() {
        assertTrue(mapper.handles(500, null));
        assertFalse(mapper.handles(200, null));
    }
}
