package com.e2eq.cnl.rest.exceptions;

import com.e2eq.cnl.exceptions.CnlGraphException;
import com.e2eq.cnl.rest.models.RestError;
import com.e2eq.cnl.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class CnlGraphExceptionMapper implements ExceptionMapper<CnlGraphException> {
    @Override
    public Response toResponse(CnlGraphException exception) {
        // referential, duplicate and stale-write failures are client errors
        ExceptionLoggingUtils.logWarn(exception, "Graph mutation refused");

        RestError error = RestErrors.from(exception);
        return Response.status(error.getStatus()).entity(error).build();
    }
}
