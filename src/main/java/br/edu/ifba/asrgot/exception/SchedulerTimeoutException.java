package br.edu.ifba.asrgot.exception;

import java.time.Duration;

public class SchedulerTimeoutException extends AsrGotException {

    public SchedulerTimeoutException(final String taskId, final Duration timeout) {
        super(ErrorCode.SCHEDULER_TIMEOUT,
            "Task " + taskId + " did not complete within " + timeout.toMillis() + "ms");
    }
}
