package com.e2eq.cnl.rest.exceptions;

import com.e2eq.cnl.exceptions.*;
import com.e2eq.cnl.rest.models.RestError;
import jakarta.ws.rs.core.Response;

/**
 * Builds the {@link RestError} body and status for exceptions raised by the graph core.
 */
public final class RestErrors {
    private RestErrors() {}

    public static Response.Status statusOf(CnlGraphException exception) {
        if (exception instanceof ReferentialException) {
            ReferentialException re = (ReferentialException) exception;
            return re.getKind() == ReferentialErrorKind.NOT_FOUND ? Response.Status.NOT_FOUND : Response.Status.CONFLICT;
        }
        if (exception instanceof DuplicateException || exception instanceof ConflictException) {
            return Response.Status.CONFLICT;
        }
        if (exception instanceof StatementRejectedException) {
            return Response.Status.BAD_REQUEST;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    public static String reasonCodeOf(CnlGraphException exception) {
        if (exception instanceof ReferentialException) {
            return ((ReferentialException) exception).getKind().name();
        }
        if (exception instanceof DuplicateException) return "DUPLICATE";
        if (exception instanceof ConflictException) return "CONFLICT";
        if (exception instanceof StatementRejectedException) return "VALIDATION";
        return "INTERNAL";
    }

    public static RestError from(CnlGraphException exception) {
        Response.Status status = statusOf(exception);
        RestError error = RestError.builder()
                .status(status.getStatusCode())
                .reasonCode(reasonCodeOf(exception))
                .statusMessage(exception.getMessage())
                .reasonMessage(status.getReasonPhrase())
                .build();
        if (exception instanceof ReferentialException) {
            error.setReferenceId(((ReferentialException) exception).getReferenceId());
        } else if (exception instanceof DuplicateException) {
            error.setReferenceId(((DuplicateException) exception).getName());
        } else if (exception instanceof ConflictException) {
            error.setReferenceId(((ConflictException) exception).getNodeId());
        } else if (exception instanceof StatementRejectedException) {
            error.setValidationErrors(((StatementRejectedException) exception).getErrors());
        }
        return error;
    }

    public static RestError badRequest(IllegalArgumentException exception) {
        return RestError.builder()
                .status(Response.Status.BAD_REQUEST.getStatusCode())
                .reasonCode("BAD_REQUEST")
                .statusMessage(exception.getMessage())
                .reasonMessage("The request could not be applied as given")
                .build();
    }
}
