package br.edu.ifba.asrgot.exception;

public class TaskNotFoundException extends AsrGotException {

    public TaskNotFoundException(final String taskId) {
        super(ErrorCode.TASK_NOT_FOUND, "Task not found: " + taskId);
    }
}
