package br.edu.ifba.asrgot.exception;

public class SessionNotFoundException extends AsrGotException {

    public SessionNotFoundException(final String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Research session not found: " + sessionId);
    }
}
