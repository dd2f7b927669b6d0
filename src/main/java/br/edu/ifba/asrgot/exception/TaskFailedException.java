package br.edu.ifba.asrgot.exception;

public class TaskFailedException extends AsrGotException {

    public TaskFailedException(final String message) {
        super(ErrorCode.TASK_FAILED, message);
    }

    public TaskFailedException(final String message, final Throwable cause) {
        super(ErrorCode.TASK_FAILED, message, cause);
    }
}
