package tech.accesshub.platform.authentication.sso;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The endpoints the upstream identity provider publishes in its OpenID discovery document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpstreamDiscoveryDocument(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("userinfo_endpoint") String userinfoEndpoint,
    @JsonProperty("jwks_uri") String jwksUri,
    @JsonProperty("end_session_endpoint") String endSessionEndpoint
) {
}
