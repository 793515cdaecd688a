package com.metabolite.classification.http;

import com.metabolite.classification.core.model.LookupError;
import com.metabolite.classification.core.model.LookupResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RateLimitedHttpClientTest {

    private static final URI URI_UNDER_TEST = URI.create("http://rest.kegg.jp/get/cpd:C00031");
    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    @Mock
    private HttpTransport transport;

    @Mock
    private RateLimitPolicy policy;

    private RateLimitedHttpClient client;

    @BeforeEach
    void setUp() {
        client = new RateLimitedHttpClient("KEGG", transport, policy);
    }

    @Test
    @DisplayName("Should return the body of a 2xx reply")
    void testSuccess() throws Exception {
        when(transport.get(URI_UNDER_TEST, TIMEOUT)).thenReturn(new HttpReply(200, "ENTRY C00031"));

        LookupResult<String> result = client.get(URI_UNDER_TEST, TIMEOUT);

        assertTrue(result.isFound());
        assertEquals("ENTRY C00031", result.value());
    }

    @Test
    @DisplayName("Should report non-2xx status as request error")
    void testNon2xx() throws Exception {
        when(transport.get(URI_UNDER_TEST, TIMEOUT)).thenReturn(new HttpReply(503, "busy"));

        LookupResult<String> result = client.get(URI_UNDER_TEST, TIMEOUT);

        assertEquals(LookupError.REQUEST_ERROR, result.error());
        assertTrue(result.message().contains("503"));
    }

    @Test
    @DisplayName("Should report a deadline breach as request error")
    void testTimeout() throws Exception {
        when(transport.get(URI_UNDER_TEST, TIMEOUT)).thenThrow(new HttpTimeoutException("request timed out"));

        LookupResult<String> result = client.get(URI_UNDER_TEST, TIMEOUT);

        assertEquals(LookupError.REQUEST_ERROR, result.error());
        assertTrue(result.message().contains("timed out"));
    }

    @Test
    @DisplayName("Should report transport exceptions as request error")
    void testIoException() throws Exception {
        when(transport.get(URI_UNDER_TEST, TIMEOUT)).thenThrow(new IOException("connection reset"));

        LookupResult<String> result = client.get(URI_UNDER_TEST, TIMEOUT);

        assertEquals(LookupError.REQUEST_ERROR, result.error());
        assertEquals("connection reset", result.message());
    }

    @Test
    @DisplayName("Should acquire before and release after every request")
    void testPolicyWrapsRequest() throws Exception {
        when(transport.get(any(), any())).thenThrow(new IOException("boom"));

        client.get(URI_UNDER_TEST, TIMEOUT);

        InOrder inOrder = inOrder(policy, transport);
        inOrder.verify(policy).acquire();
        inOrder.verify(transport).get(URI_UNDER_TEST, TIMEOUT);
        inOrder.verify(policy).release();
    }

    @Test
    @DisplayName("Should not call the transport when interrupted while waiting")
    void testInterruptedWhileWaiting() throws Exception {
        doThrow(new InterruptedException()).when(policy).acquire();

        LookupResult<String> result = client.get(URI_UNDER_TEST, TIMEOUT);

        assertEquals(LookupError.REQUEST_ERROR, result.error());
        assertTrue(Thread.interrupted(), "interrupt flag should be restored");
        verifyNoInteractions(transport);
    }
}
