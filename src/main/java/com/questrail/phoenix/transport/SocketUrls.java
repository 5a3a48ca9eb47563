package com.questrail.phoenix.transport;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds the connect URL from the endpoint and connection params.
 *
 * <p>Params are appended as form-encoded query parameters, after any query the
 * endpoint already carries. Iteration order of the map is preserved.</p>
 */
public final class SocketUrls
{
    private SocketUrls()
    {
    }

    public static URI withParams(URI endpoint, Map<String, String> params)
    {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(params, "params");

        if (params.isEmpty()) {
            return endpoint;
        }

        StringJoiner query = new StringJoiner("&");
        params.forEach((k, v) -> query.add(encode(k) + "=" + encode(v == null ? "" : v)));

        String base = endpoint.toString();
        String fragment = "";
        int hash = base.indexOf('#');
        if (hash >= 0) {
            fragment = base.substring(hash);
            base = base.substring(0, hash);
        }

        String separator = endpoint.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator + query + fragment);
    }

    private static String encode(String value)
    {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
