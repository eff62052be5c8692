package com.rivet.core.route;

import java.util.Objects;

/**
 * One line of a {@code .routes} file.
 *
 * @param method HTTP method, upper case
 * @param path request path, starting with {@code /}
 * @param contentType response content type
 * @param body response body, possibly empty
 * @param source route file the line came from, e.g. {@code api.routes}
 */
public record Route(
    String method,
    String path,
    String contentType,
    String body,
    String source
) {
    public static final String DEFAULT_CONTENT_TYPE = "text/plain";

    public Route {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        contentType = contentType == null ? DEFAULT_CONTENT_TYPE : contentType;
        body = body == null ? "" : body;
    }
}
