package tech.accesshub.platform.authentication.oauth;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * JAX-RS exception mapper for OAuthException.
 *
 * Response format:
 * <pre>
 * { "error": "invalid_grant" }
 * </pre>
 *
 * Authorization errors that are redirectable become a 303 to the client's redirect URI.
 * The internal reason is logged, never returned.
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    private static final Logger LOG = Logger.getLogger(OAuthExceptionMapper.class);

    @Override
    public Response toResponse(OAuthException exception) {
        LOG.warnf("OAuth request rejected with %s: %s", exception.getError().code(), exception.getMessage());

        if (exception instanceof AuthorizationRedirectException redirect) {
            return Response.seeOther(redirect.location()).build();
        }

        Response.ResponseBuilder response = Response.status(exception.getStatus())
            .type(MediaType.APPLICATION_JSON)
            .header("Cache-Control", "no-store")
            .header("Pragma", "no-cache")
            .entity(Map.of("error", exception.getError().code()));

        if (exception.getChallenge() != null) {
            response.header("WWW-Authenticate", exception.getChallenge());
        }
        return response.build();
    }
}
