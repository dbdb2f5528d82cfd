package tech.accesshub.platform.authentication.sso;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Renders upstream identity failures as a 401 authentication failure.
 */
@Provider
public class UpstreamIdentityExceptionMapper implements ExceptionMapper<UpstreamIdentityException> {

    private static final Logger LOG = Logger.getLogger(UpstreamIdentityExceptionMapper.class);

    @Override
    public Response toResponse(UpstreamIdentityException exception) {
        LOG.warnf(exception, "Upstream identity failure: %s", exception.getMessage());
        return Response.status(Response.Status.UNAUTHORIZED)
            .type(MediaType.APPLICATION_JSON)
            .entity(Map.of("error", "access_denied"))
            .build();
    }
}
