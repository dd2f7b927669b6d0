package br.edu.ifba.asrgot.exception;

public class MissingCredentialsException extends AsrGotException {

    public MissingCredentialsException(final String message) {
        super(ErrorCode.MISSING_CREDENTIALS, message);
    }

    public MissingCredentialsException(final String message, final Throwable cause) {
        super(ErrorCode.MISSING_CREDENTIALS, message, cause);
    }
}
