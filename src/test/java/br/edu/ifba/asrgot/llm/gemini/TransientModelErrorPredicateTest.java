package br.edu.ifba.asrgot.llm.gemini;

import br.edu.ifba.asrgot.exception.ModelCallException;
import jakarta.ws.rs.ProcessingException;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link TransientModelErrorPredicate}.
 *
 * Quota exhaustion (429), server errors (5xx) and transport failures are retried;
 * other client errors are permanent.
 */
class TransientModelErrorPredicateTest {

    private TransientModelErrorPredicate predicate;

    @BeforeEach
    void setUp() {
        predicate = new TransientModelErrorPredicate();
    }

    @Nested
    @DisplayName("HTTP status")
    class HttpStatus {

        @ParameterizedTest
        @ValueSource(ints = {429, 500, 502, 503, 504})
        @DisplayName("should retry quota and server errors")
        void testRetryableStatus(int status) {
            assertTrue(predicate.test(new GeminiApiException(status, "Gemini API error " + status)));
        }

        @ParameterizedTest
        @ValueSource(ints = {400, 401, 403, 404})
        @DisplayName("should not retry other client errors")
        void testPermanentStatus(int status) {
            assertFalse(predicate.test(new GeminiApiException(status, "Gemini API error " + status)));
        }

        @Test
        @DisplayName("status wins over a transient-looking message")
        void testStatusBeatsMessage() {
            assertFalse(predicate.test(new GeminiApiException(400, "quota field is invalid")));
        }
    }

    @Nested
    @DisplayName("Transport failures")
    class TransportFailures {

        @Test
        void testIoException() {
            assertTrue(predicate.test(new IOException("broken pipe")));
        }

        @Test
        void testFaultToleranceTimeout() {
            assertTrue(predicate.test(new TimeoutException("timed out")));
        }

        @Test
        void testClientProcessingFailure() {
            assertTrue(predicate.test(new ProcessingException("unable to connect")));
        }

        @Test
        @DisplayName("should follow the cause chain")
        void testWrappedCause() {
            final ModelCallException wrapped = new ModelCallException("call failed", new SocketTimeoutException());
            assertTrue(predicate.test(wrapped));
        }
    }

    @Nested
    @DisplayName("Message patterns")
    class MessagePatterns {

        @ParameterizedTest
        @ValueSource(strings = {
            "Connection reset by peer",
            "Read timed out",
            "RESOURCE EXHAUSTED",
            "Rate limit reached, try again later",
            "Service temporarily unavailable"
        })
        void testTransientMessages(String message) {
            assertTrue(predicate.test(new RuntimeException(message)));
        }

        @Test
        void testPermanentMessage() {
            assertFalse(predicate.test(new RuntimeException("API key not valid")));
        }

        @Test
        void testNullHandling() {
            assertFalse(predicate.test(null));
            assertFalse(predicate.test(new RuntimeException((String) null)));
        }
    }
}
