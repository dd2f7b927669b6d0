package br.edu.ifba.asrgot.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps argument checks of the graph model and algorithms (duplicate ids, out-of-range
 * thresholds, immutable node types) that reach the REST layer.
 */
@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {

    private static final Logger LOG = Logger.getLogger(IllegalArgumentExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IllegalArgumentException exception) {
        LOG.debugf("Invalid argument on %s: %s", uriInfo.getPath(), exception.getMessage());
        return ErrorResponse.of(Response.Status.BAD_REQUEST, "Invalid Argument",
                exception.getMessage(), uriInfo.getPath()).toResponse();
    }
}
