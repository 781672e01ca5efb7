package com.modelpack.api;

import com.modelpack.core.storage.BlobNotFoundException;
import com.modelpack.core.storage.ManifestNotFoundException;
import com.modelpack.core.storage.StoreException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

@Provider
public class StoreExceptionMapper implements ExceptionMapper<StoreException> {

    private static final Logger log = Logger.getLogger(StoreExceptionMapper.class);

    @Override
    public Response toResponse(StoreException exception) {
        Response.Status status;
        if (exception instanceof ManifestNotFoundException || exception instanceof BlobNotFoundException) {
            status = Response.Status.NOT_FOUND;
        } else {
            log.errorf(exception, "Content store failure");
            status = Response.Status.INTERNAL_SERVER_ERROR;
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", exception.getMessage(), "status", status.getStatusCode()))
                .build();
    }
}
