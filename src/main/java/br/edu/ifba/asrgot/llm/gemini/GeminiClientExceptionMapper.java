package br.edu.ifba.asrgot.llm.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns Gemini error responses into {@link GeminiApiException}.
 *
 * <p>Gemini reports failures as {@code {"error": {"code", "message", "status"}}}; the
 * message and status are used when present, the raw (truncated) body otherwise.</p>
 */
public class GeminiClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(GeminiClientExceptionMapper.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_DETAIL_LENGTH = 500;

    @Override
    public boolean handles(final int status, final MultivaluedMap<String, Object> headers) {
        return status >= 400;
    }

    @Override
    public RuntimeException toThrowable(final Response response) {
        final int status = response.getStatus();
        final String body = readBody(response);
        final String detail = describe(body);

        if (status == 429) {
            LOG.warnf("Gemini quota exhausted: %s", detail);
        } else {
            LOG.errorf("Gemini call failed with HTTP %d: %s", status, detail);
        }
        return new GeminiApiException(status, "Gemini API error " + status + ": " + detail);
    }

    private static String readBody(final Response response) {
        if (!response.hasEntity()) {
            return "";
        }
        try {
            return response.readEntity(String.class);
        } catch (ProcessingException | IllegalStateException e) {
            LOG.debugf("Gemini error body unreadable: %s", e.getMessage());
            return "";
        }
    }

    static String describe(final String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            final JsonNode error = MAPPER.readTree(body).path("error");
            final String message = error.path("message").asText("");
            final String status = error.path("status").asText("");
            if (!message.isEmpty()) {
                return status.isEmpty() ? message : status + " - " + message;
            }
        } catch (JsonProcessingException e) {
            LOG.tracef("Gemini error body is not JSON: %s", e.getMessage());
        }
        return body.length() <= MAX_DETAIL_LENGTH ? body : body.substring(0, MAX_DETAIL_LENGTH) + "...";
    }
}
