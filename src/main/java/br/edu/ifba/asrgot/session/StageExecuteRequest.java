package br.edu.ifba.asrgot.session;

import jakarta.validation.constraints.Size;

/**
 * Body of a stage execution. The query is read by stage 1 only.
 */
public record StageExecuteRequest(
        @Size(max = 10000, message = "Query must be at most 10000 characters")
        String query
) {
}
