package br.edu.ifba.asrgot.exception;

import jakarta.ws.rs.core.Response;

/**
 * Problem details body (RFC 9457) returned by the exception mappers.
 */
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance
) {

    public static final String MEDIA_TYPE = "application/problem+json";

    private static final String DEFAULT_TYPE = "about:blank";

    public static ErrorResponse of(final Response.Status status, final String title,
                                   final String detail, final String instance) {
        return new ErrorResponse(DEFAULT_TYPE, title, status.getStatusCode(), detail, instance);
    }

    public Response toResponse() {
        return Response.status(status)
                .entity(this)
                .type(MEDIA_TYPE)
                .build();
    }
}
