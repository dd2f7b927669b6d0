package br.edu.ifba.asrgot.exception;

/**
 * Base class of every failure raised by the reasoning pipeline.
 */
public class AsrGotException extends RuntimeException {

    private final ErrorCode errorCode;

    public AsrGotException(final ErrorCode errorCode, final String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AsrGotException(final ErrorCode errorCode, final String message, final Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
