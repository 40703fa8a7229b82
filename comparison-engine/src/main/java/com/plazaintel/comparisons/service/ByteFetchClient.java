package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.model.FetchedPayload;

import java.time.Duration;

public interface ByteFetchClient {

    /**
     * Download the object behind {@code locator}.
     *
     * @throws FetchFailedException with TIMEOUT, HTTP_ERROR or NETWORK_ERROR
     */
    FetchedPayload fetch(String label, String locator, Duration timeout);
}
