package tech.accesshub.platform.authentication.oauth;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Appends query parameters to a registered redirect URI, preserving any query it already has.
 */
final class CallbackUrl {

    private CallbackUrl() {
    }

    static URI withParameters(String baseUri, Map<String, String> params) {
        StringBuilder url = new StringBuilder(baseUri);
        char separator = baseUri.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            url.append(separator)
                .append(urlEncode(param.getKey()))
                .append('=')
                .append(urlEncode(param.getValue()));
            separator = '&';
        }
        return URI.create(url.toString());
    }

    static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
