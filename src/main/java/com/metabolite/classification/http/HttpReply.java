package com.metabolite.classification.http;

/**
 * Status code and body of a completed HTTP exchange.
 */
public record HttpReply(int statusCode, String body) {

    public HttpReply {
        body = body != null ? body : "";
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
