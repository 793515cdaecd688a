package com.metabolite.classification.http;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link HttpTransport} answering from canned responses keyed by full URI.
 * Unknown URIs answer 404 with an empty body.
 */
public class StubHttpTransport implements HttpTransport {

    private final Map<String, HttpReply> replies = new HashMap<>();
    private final Map<String, IOException> failures = new HashMap<>();
    private final List<String> requestedUris = new ArrayList<>();
    private final List<Duration> requestedTimeouts = new ArrayList<>();

    public StubHttpTransport reply(String uri, int status, String body) {
        replies.put(uri, new HttpReply(status, body));
        return this;
    }

    public StubHttpTransport ok(String uri, String body) {
        return reply(uri, 200, body);
    }

    public StubHttpTransport fail(String uri, IOException failure) {
        failures.put(uri, failure);
        return this;
    }

    @Override
    public HttpReply get(URI uri, Duration timeout) throws IOException {
        String key = uri.toString();
        requestedUris.add(key);
        requestedTimeouts.add(timeout);
        IOException failure = failures.get(key);
        if (failure != null) {
            throw failure;
        }
        return replies.getOrDefault(key, new HttpReply(404, ""));
    }

    public List<String> requestedUris() {
        return requestedUris;
    }

    public List<Duration> requestedTimeouts() {
        return requestedTimeouts;
    }
}
