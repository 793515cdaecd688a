package com.metabolite.classification.http;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Blocking HTTP GET seam. Implementations must honour the per-call deadline and
 * report a breach as an {@link IOException} (typically {@link java.net.http.HttpTimeoutException}).
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Issues a GET request and waits for the full response.
     *
     * @param uri     the target
     * @param timeout deadline for the whole exchange
     * @return the reply, whatever its status code
     */
    HttpReply get(URI uri, Duration timeout) throws IOException, InterruptedException;
}
