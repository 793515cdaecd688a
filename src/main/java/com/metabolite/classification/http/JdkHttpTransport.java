package com.metabolite.classification.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link HttpTransport} backed by {@link java.net.http.HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String USER_AGENT = "metabolite-classification/1.0";

    private final HttpClient httpClient;

    public JdkHttpTransport() {
        this(DEFAULT_CONNECT_TIMEOUT);
    }

    public JdkHttpTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public HttpReply get(URI uri, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        log.debug("http.get uri={} timeout={}", uri, timeout);
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        log.debug("http.response uri={} status={} length={}", uri, response.statusCode(),
                response.body() != null ? response.body().length() : 0);
        return new HttpReply(response.statusCode(), response.body());
    }
}
