package br.edu.ifba.asrgot.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class AsrGotExceptionMapper implements ExceptionMapper<AsrGotException> {

    private static final Logger LOG = Logger.getLogger(AsrGotExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final AsrGotException exception) {
        final ErrorCode code = exception.getErrorCode();
        if (code.getStatus().getFamily() == Response.Status.Family.SERVER_ERROR) {
            LOG.errorf(exception, "Request to %s failed: %s", uriInfo.getPath(), exception.getMessage());
        } else {
            LOG.debugf("Request to %s rejected (%s): %s", uriInfo.getPath(), code, exception.getMessage());
        }

        return ErrorResponse.of(code.getStatus(), code.getTitle(), exception.getMessage(), uriInfo.getPath())
                .toResponse();
    }
}
