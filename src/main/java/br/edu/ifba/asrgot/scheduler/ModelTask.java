package br.edu.ifba.asrgot.scheduler;

import br.edu.ifba.asrgot.llm.ModelRequest;

import java.util.Objects;

/**
 * A model call waiting to be scheduled.
 */
public record ModelTask(ModelRequest request, TaskPriority priority) {

    public ModelTask {
        Objects.requireNonNull(request, "request must not be null");
        priority = priority != null ? priority : TaskPriority.MEDIUM;
    }

    public static ModelTask of(ModelRequest request) {
        return new ModelTask(request, TaskPriority.MEDIUM);
    }
}
