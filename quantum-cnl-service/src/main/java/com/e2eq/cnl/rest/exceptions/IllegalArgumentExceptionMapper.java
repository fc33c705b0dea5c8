package com.e2eq.cnl.rest.exceptions;

import com.e2eq.cnl.rest.models.RestError;
import com.e2eq.cnl.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {
    @Override
    public Response toResponse(IllegalArgumentException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Bad request");

        RestError error = RestErrors.badRequest(exception);
        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
