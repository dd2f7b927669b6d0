package br.edu.ifba.asrgot.exception;

/**
 * Transport error, non-2xx status, quota or timeout from the model provider.
 */
public class ModelCallException extends AsrGotException {

    public ModelCallException(final String message) {
        super(ErrorCode.MODEL_CALL_FAILURE, message);
    }

    public ModelCallException(final String message, final Throwable cause) {
        super(ErrorCode.MODEL_CALL_FAILURE, message, cause);
    }
}
