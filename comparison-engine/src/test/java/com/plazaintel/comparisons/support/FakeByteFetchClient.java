package com.plazaintel.comparisons.support;

import com.plazaintel.comparisons.model.FetchFailure;
import com.plazaintel.comparisons.model.FetchFailureType;
import com.plazaintel.comparisons.model.FetchedPayload;
import com.plazaintel.comparisons.service.ByteFetchClient;
import com.plazaintel.comparisons.service.FetchFailedException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Plays back scripted outcomes in order; once the script runs out it keeps
 * serving the last payload it was given.
 */
public class FakeByteFetchClient implements ByteFetchClient {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<String> calls = new ArrayList<>();
    private byte[] fallback;

    public FakeByteFetchClient thenFail(FetchFailureType type) {
        script.add(type);
        return this;
    }

    public FakeByteFetchClient thenHttpError(int status) {
        script.add(status);
        return this;
    }

    public FakeByteFetchClient thenThrow(RuntimeException e) {
        script.add(e);
        return this;
    }

    public FakeByteFetchClient thenReturn(byte[] bytes) {
        script.add(bytes);
        fallback = bytes;
        return this;
    }

    public List<String> calls() {
        return calls;
    }

    @Override
    public FetchedPayload fetch(String label, String locator, Duration timeout) {
        calls.add(locator);
        Object next = script.isEmpty() ? fallback : script.poll();
        if (next instanceof RuntimeException) {
            throw (RuntimeException) next;
        }
        if (next instanceof FetchFailureType) {
            throw new FetchFailedException(FetchFailure.of((FetchFailureType) next, label, "scripted"));
        }
        if (next instanceof Integer) {
            throw new FetchFailedException(FetchFailure.http(label, (Integer) next));
        }
        if (next == null) {
            throw new FetchFailedException(FetchFailure.of(FetchFailureType.NETWORK_ERROR, label, "nothing scripted"));
        }
        return new FetchedPayload((byte[]) next, "text/csv", null);
    }
}
