package com.indigententerprises.telemetry.common.serviceimplementations;

import com.indigententerprises.telemetry.common.serviceinterfaces.IntegrityAuthority;
import com.indigententerprises.telemetry.common.serviceinterfaces.IntegrityCheckException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Asks the release service whether it knows a digest: {@code GET <base>/check_releases/<digest>}.
 * 200 means known, 404 means unknown, anything else is an error.
 */
public final class HttpIntegrityAuthority implements IntegrityAuthority {

    private final HttpClient httpClient;
    private final String baseUrl;

    public HttpIntegrityAuthority(final HttpClient httpClient, final String baseUrl) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public boolean isRecognized(final String digest) throws IntegrityCheckException {
        final URI uri;

        try {
            uri = URI.create(baseUrl + "/check_releases/" + digest);
        } catch (IllegalArgumentException e) {
            throw new IntegrityCheckException("invalid release check url: " + baseUrl, e);
        }

        final HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .GET()
                .build();

        try {
            final HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            final int status = response.statusCode();

            if (status == 200) {
                return true;
            } else if (status == 404) {
                return false;
            } else {
                throw new IntegrityCheckException("release check got unexpected status " + status + " from " + uri);
            }
        } catch (IOException e) {
            throw new IntegrityCheckException("release check IO error: " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IntegrityCheckException("release check interrupted: " + uri, e);
        }
    }
}
