package tech.accesshub.platform.authentication.sso;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An identity the upstream provider has vouched for. Treated as trusted input.
 *
 * @param externalSubjectId subject id at the upstream provider
 * @param email             email address
 * @param displayName       full name, may be null
 * @param firstName         given name, may be null
 * @param lastName          family name, may be null
 * @param department        department, may be null
 * @param jobTitle          job title, may be null
 * @param groupNames        group names asserted upstream, never null
 */
public record VerifiedIdentity(
    String externalSubjectId,
    String email,
    String displayName,
    String firstName,
    String lastName,
    String department,
    String jobTitle,
    List<String> groupNames
) {

    public VerifiedIdentity {
        groupNames = groupNames == null ? List.of() : List.copyOf(groupNames);
    }

    /**
     * Build an identity from raw assertion claims.
     *
     * @throws UpstreamIdentityException if a required claim is absent or blank
     */
    public static VerifiedIdentity fromClaims(Map<String, ?> claims) {
        Set<IdentityClaim> missing = EnumSet.noneOf(IdentityClaim.class);
        for (IdentityClaim claim : IdentityClaim.values()) {
            if (claim.required() && text(claims, claim) == null) {
                missing.add(claim);
            }
        }
        if (!missing.isEmpty()) {
            throw new UpstreamIdentityException("Identity assertion missing required claims " + missing);
        }

        String givenName = text(claims, IdentityClaim.GIVEN_NAME);
        String displayName = text(claims, IdentityClaim.DISPLAY_NAME);
        return new VerifiedIdentity(
            text(claims, IdentityClaim.SUBJECT),
            text(claims, IdentityClaim.EMAIL).toLowerCase(),
            displayName != null ? displayName : givenName,
            givenName,
            text(claims, IdentityClaim.FAMILY_NAME),
            text(claims, IdentityClaim.DEPARTMENT),
            text(claims, IdentityClaim.JOB_TITLE),
            list(claims, IdentityClaim.GROUPS));
    }

    private static String text(Map<String, ?> claims, IdentityClaim claim) {
        for (String name : claim.names()) {
            Object value = claims.get(name);
            if (value != null && !value.toString().isBlank()) {
                return value.toString().trim();
            }
        }
        return null;
    }

    private static List<String> list(Map<String, ?> claims, IdentityClaim claim) {
        List<String> values = new ArrayList<>();
        for (String name : claim.names()) {
            Object value = claims.get(name);
            if (value instanceof Collection<?> collection) {
                collection.stream()
                    .filter(item -> item != null && !item.toString().isBlank())
                    .forEach(item -> values.add(item.toString()));
                return values;
            }
            if (value != null && !value.toString().isBlank()) {
                values.add(value.toString());
                return values;
            }
        }
        return values;
    }
}
