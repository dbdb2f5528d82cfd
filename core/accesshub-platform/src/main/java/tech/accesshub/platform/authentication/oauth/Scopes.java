package tech.accesshub.platform.authentication.oauth;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scope parsing and negotiation.
 */
public final class Scopes {

    public static final String OPENID = "openid";

    /**
     * Scopes the hub grants, in canonical order.
     */
    public static final List<String> SUPPORTED = List.of(OPENID, "profile", "email");

    private Scopes() {
    }

    /**
     * Intersect a space-separated request with the supported scopes.
     * Unknown scopes are dropped; an empty result becomes {@code openid}.
     */
    public static Set<String> negotiate(String requested) {
        Set<String> requestedSet = parse(requested);
        Set<String> granted = new LinkedHashSet<>();
        for (String scope : SUPPORTED) {
            if (requestedSet.contains(scope)) {
                granted.add(scope);
            }
        }
        if (granted.isEmpty()) {
            granted.add(OPENID);
        }
        return granted;
    }

    public static Set<String> parse(String scope) {
        Set<String> scopes = new LinkedHashSet<>();
        if (scope == null) {
            return scopes;
        }
        for (String part : scope.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                scopes.add(part);
            }
        }
        return scopes;
    }

    public static String format(Collection<String> scopes) {
        return scopes == null ? "" : scopes.stream().collect(Collectors.joining(" "));
    }
}
