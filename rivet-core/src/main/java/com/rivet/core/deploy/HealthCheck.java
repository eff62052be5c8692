package com.rivet.core.deploy;

import java.net.URI;

/**
 * Asks a deployed application whether it is up.
 */
@FunctionalInterface
public interface HealthCheck {

    /**
     * Requests the URL.
     *
     * @param uri health endpoint
     * @return HTTP status code
     */
    int check(URI uri);
}
