package ai.pipestream.history.http;

import ai.pipestream.history.exception.ConcurrencyConflictException;
import ai.pipestream.history.exception.DocumentNotFoundException;
import ai.pipestream.history.exception.HistoryServiceException;
import ai.pipestream.history.exception.InvalidInputException;
import ai.pipestream.history.exception.SizeLimitExceededException;
import ai.pipestream.history.exception.VersionNotFoundException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Maps history failures to JSON error bodies with a matching HTTP status.
 */
@Provider
public class HistoryExceptionMapper implements ExceptionMapper<HistoryServiceException> {

    private static final Logger LOG = Logger.getLogger(HistoryExceptionMapper.class);

    @Override
    public Response toResponse(HistoryServiceException exception) {
        Response.Status status = statusFor(exception);
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            LOG.errorf(exception, "Unhandled history failure in %s", exception.getOperation());
        } else {
            LOG.debugf("%s -> %d", exception.getMessage(), status.getStatusCode());
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(exception.getErrorCode(), exception.getOperation(), exception.getMessage()))
                .build();
    }

    static Response.Status statusFor(HistoryServiceException exception) {
        if (exception instanceof DocumentNotFoundException || exception instanceof VersionNotFoundException) {
            return Response.Status.NOT_FOUND;
        }
        if (exception instanceof InvalidInputException) {
            return Response.Status.BAD_REQUEST;
        }
        if (exception instanceof ConcurrencyConflictException) {
            return Response.Status.CONFLICT;
        }
        if (exception instanceof SizeLimitExceededException) {
            return Response.Status.REQUEST_ENTITY_TOO_LARGE;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }
}
