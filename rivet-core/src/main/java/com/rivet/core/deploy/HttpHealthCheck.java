package com.rivet.core.deploy;

import com.rivet.core.exception.RivetException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HealthCheck} over {@link HttpClient}.
 */
public class HttpHealthCheck implements HealthCheck {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient client = HttpClient.newBuilder()
        .connectTimeout(TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();

    @Override
    public int check(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(TIMEOUT)
            .GET()
            .build();
        try {
            return client.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
        } catch (IOException e) {
            throw new RivetException("Health check failed for " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RivetException("Health check interrupted for " + uri, e);
        }
    }
}
