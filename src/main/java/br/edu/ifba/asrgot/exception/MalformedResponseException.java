package br.edu.ifba.asrgot.exception;

/**
 * Model output could not be parsed and no fallback extraction applied.
 */
public class MalformedResponseException extends AsrGotException {

    public MalformedResponseException(final String message) {
        super(ErrorCode.MALFORMED_RESPONSE, message);
    }

    public MalformedResponseException(final String message, final Throwable cause) {
        super(ErrorCode.MALFORMED_RESPONSE, message, cause);
    }
}
