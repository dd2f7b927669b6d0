package br.edu.ifba.asrgot.exception;

import jakarta.ws.rs.core.Response;

/**
 * Failure categories raised by the pipeline, each with the HTTP status it maps to.
 */
public enum ErrorCode {
    INVALID_STAGE_NUMBER("Invalid Stage Number", Response.Status.BAD_REQUEST),
    EMPTY_QUERY("Empty Query", Response.Status.BAD_REQUEST),
    MISSING_CREDENTIALS("Missing Credentials", Response.Status.BAD_REQUEST),
    STAGE_PREREQUISITE_NOT_MET("Stage Prerequisite Not Met", Response.Status.CONFLICT),
    MALFORMED_RESPONSE("Malformed Model Response", Response.Status.BAD_GATEWAY),
    MODEL_CALL_FAILURE("Model Call Failure", Response.Status.BAD_GATEWAY),
    SCHEDULER_TIMEOUT("Scheduler Timeout", Response.Status.GATEWAY_TIMEOUT),
    SINGLE_TOOL_RULE_VIOLATION("Single-Tool Rule Violation", Response.Status.BAD_REQUEST),
    TASK_NOT_FOUND("Task Not Found", Response.Status.NOT_FOUND),
    TASK_FAILED("Task Failed", Response.Status.BAD_GATEWAY),
    SESSION_NOT_FOUND("Session Not Found", Response.Status.NOT_FOUND);

    private final String title;
    private final Response.Status status;

    ErrorCode(String title, Response.Status status) {
        this.title = title;
        this.status = status;
    }

    public String getTitle() {
        return title;
    }

    public Response.Status getStatus() {
        return status;
    }
}
