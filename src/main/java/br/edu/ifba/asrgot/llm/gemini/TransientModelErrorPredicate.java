package br.edu.ifba.asrgot.llm.gemini;

import jakarta.ws.rs.ProcessingException;
import org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides whether a failed Gemini call is worth retrying.
 *
 * <h2>Transient (will retry):</h2>
 * <ul>
 *   <li>HTTP 429 and 5xx responses</li>
 *   <li>client-side processing and I/O errors</li>
 *   <li>fault-tolerance timeouts</li>
 *   <li>messages matching known transient patterns</li>
 * </ul>
 *
 * <p>Other 4xx responses (bad key, malformed request) are permanent.</p>
 */
public final class TransientModelErrorPredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientModelErrorPredicate.class);

    private static final Pattern TRANSIENT_MESSAGE_PATTERN = Pattern.compile(
        "(?i)(" +
        "connection\\s+(refused|reset|closed|timed\\s*out)" +
        "|read\\s+timed\\s*out" +
        "|connect\\s+timed\\s*out" +
        "|resource\\s+exhausted" +
        "|rate\\s+limit" +
        "|quota" +
        "|temporarily\\s+unavailable" +
        "|try\\s+(again|later)" +
        ")"
    );

    @Override
    public boolean test(final Throwable throwable) {
        if (throwable == null) {
            return false;
        }

        if (throwable instanceof GeminiApiException apiException) {
            boolean retryable = apiException.isRetryable();
            logger.debug("Gemini status {} is {}", apiException.getStatus(), retryable ? "transient" : "permanent");
            return retryable;
        }

        if (throwable instanceof TimeoutException || throwable instanceof IOException) {
            logger.debug("Transient failure detected: {}", throwable.getClass().getSimpleName());
            return true;
        }

        if (throwable instanceof ProcessingException) {
            logger.debug("Client processing failure detected: {}", throwable.getMessage());
            return true;
        }

        String message = throwable.getMessage();
        if (message != null && TRANSIENT_MESSAGE_PATTERN.matcher(message).find()) {
            logger.debug("Transient error detected by message pattern: {}",
                message.length() > 100 ? message.substring(0, 100) + "..." : message);
            return true;
        }

        Throwable cause = throwable.getCause();
        if (cause != null && cause != throwable) {
            return test(cause);
        }
        return false;
    }
}
