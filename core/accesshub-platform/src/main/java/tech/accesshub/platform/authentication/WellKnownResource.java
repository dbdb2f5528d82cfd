package tech.accesshub.platform.authentication;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.CacheControl;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Metadata that relying applications read before talking to the hub: where the OAuth endpoints
 * live and which key signs access tokens.
 */
@Path("/.well-known")
@Tag(name = "Well-Known", description = "Hub metadata and signing keys")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    private static final int KEY_SET_MAX_AGE_SECONDS = 300;

    @Inject
    JwtKeyService jwtKeyService;

    @Context
    UriInfo uriInfo;

    @GET
    @Path("/openid-configuration")
    @Operation(summary = "Hub endpoint metadata")
    public Response metadata() {
        String hubUrl = uriInfo.getBaseUri().toString();
        if (hubUrl.endsWith("/")) {
            hubUrl = hubUrl.substring(0, hubUrl.length() - 1);
        }
        return Response.ok(jwtKeyService.getOpenIdConfiguration(hubUrl)).build();
    }

    /**
     * Public half of the signing key. Applications may cache it briefly; a rotated key
     * shows up under a new {@code kid}.
     */
    @GET
    @Path("/jwks.json")
    @Operation(summary = "Access token signing keys")
    public Response signingKeys() {
        CacheControl cacheControl = new CacheControl();
        cacheControl.setMaxAge(KEY_SET_MAX_AGE_SECONDS);
        return Response.ok(jwtKeyService.getJwks()).cacheControl(cacheControl).build();
    }
}
