package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.FetchFailure;
import com.plazaintel.comparisons.model.FetchFailureType;
import com.plazaintel.comparisons.model.FetchedPayload;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Downloads period files from the object store over plain HTTP(S).
 * Share links redirect before serving the bytes, so redirects are followed.
 */
@Slf4j
public class HttpByteFetchClient implements ByteFetchClient {

    private final HttpClient httpClient;

    public HttpByteFetchClient(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .build();
    }

    @Override
    public FetchedPayload fetch(String label, String locator, Duration timeout) {
        URI uri = toHttpUri(label, locator);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw unusableLocator(label, e.getMessage(), e);
        }

        log.debug("Downloading {} from {}", label, uri);
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                throw new FetchFailedException(FetchFailure.http(label, response.statusCode()));
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            return new FetchedPayload(response.body(), contentType, null);

        } catch (HttpTimeoutException e) {
            throw new FetchFailedException(FetchFailure.of(FetchFailureType.TIMEOUT, label,
                    "no response within " + timeout.toMillis() + " ms"), e);
        } catch (IOException e) {
            throw new FetchFailedException(FetchFailure.of(FetchFailureType.NETWORK_ERROR, label,
                    e.getClass().getSimpleName() + ": " + e.getMessage()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchFailedException(FetchFailure.of(FetchFailureType.NETWORK_ERROR, label,
                    "interrupted"), e);
        }
    }

    /** Only absolute http(s) URLs with a host are accepted; anything else fails as NO_LOCATOR. */
    static URI toHttpUri(String label, String locator) {
        if (locator == null || locator.isBlank()) {
            throw unusableLocator(label, null, null);
        }
        URI uri;
        try {
            uri = URI.create(locator.trim());
        } catch (IllegalArgumentException e) {
            throw unusableLocator(label, e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw unusableLocator(label, "not an http(s) URL: " + locator, null);
        }
        if (uri.getHost() == null) {
            throw unusableLocator(label, "no host in " + locator, null);
        }
        return uri;
    }

    private static FetchFailedException unusableLocator(String label, String detail, Throwable cause) {
        FetchFailure failure = FetchFailure.of(FetchFailureType.NO_LOCATOR, label, detail);
        return cause == null ? new FetchFailedException(failure) : new FetchFailedException(failure, cause);
    }
}
