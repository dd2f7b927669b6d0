package br.edu.ifba.asrgot.exception;

import java.util.stream.Collectors;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps bean validation failures on session and stage requests. Every violation is
 * reported as {@code field: message}, sorted by field.
 */
@Provider
public class ConstraintViolationExceptionMapper implements ExceptionMapper<ConstraintViolationException> {

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final ConstraintViolationException exception) {
        final String detail = exception.getConstraintViolations().stream()
                .map(ConstraintViolationExceptionMapper::describe)
                .sorted()
                .collect(Collectors.joining("; "));

        return ErrorResponse.of(Response.Status.BAD_REQUEST, "Invalid Request",
                detail.isEmpty() ? "Validation failed" : detail, uriInfo.getPath()).toResponse();
    }

    private static String describe(final ConstraintViolation<?> violation) {
        String field = null;
        for (final Path.Node node : violation.getPropertyPath()) {
            field = node.getName();
        }
        return (field != null ? field : "request") + ": " + violation.getMessage();
    }
}
