package com.testfleet.report;

import com.testfleet.core.model.BuildIdentity;
import com.testfleet.core.model.BuildNumberSource;
import com.testfleet.core.model.OverallStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ResultFinalizerTest {

    private static final BuildIdentity IDENTITY = new BuildIdentity(1342, "a1b2c3d");

    private HttpClient httpClient;
    private Map<String, String> env;
    private ResultFinalizer finalizer;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        env = Map.of("COVERALLS_REPO_TOKEN", "s3cr3t");
        finalizer = newFinalizer(BuildNumberSource.REVISION);
    }

    private ResultFinalizer newFinalizer(BuildNumberSource source) {
        return new ResultFinalizer(httpClient, URI.create("https://coveralls.example/webhook"),
                "COVERALLS_REPO_TOKEN", name -> env.get(name), Duration.ofSeconds(5), Duration.ZERO, source);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @Nested
    @DisplayName("request")
    class Request {

        @Test
        @DisplayName("posts to the webhook with the token from the environment")
        void postsWithToken() throws Exception {
            doReturn(response(200, "{\"done\":true}")).when(httpClient).send(any(), any());

            var ack = finalizer.finalize(IDENTITY, OverallStatus.SUCCESS);

            assertEquals(200, ack.httpStatus());
            assertEquals(1, ack.attempts());
            var captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), any());
            HttpRequest request = captor.getValue();
            assertEquals("POST", request.method());
            assertEquals(URI.create("https://coveralls.example/webhook?repo_token=s3cr3t"), request.uri());
            assertEquals("application/x-www-form-urlencoded",
                    request.headers().firstValue("Content-Type").orElseThrow());
        }

        @Test
        @DisplayName("form body carries build number and status marker")
        void formBody() {
            assertEquals("payload[build_num]=a1b2c3d&payload[status]=done",
                    ResultFinalizer.formBody("a1b2c3d", "done"));
        }

        @Test
        @DisplayName("status markers")
        void markers() {
            assertEquals("done", StatusMarker.of(OverallStatus.SUCCESS));
            assertEquals("failed", StatusMarker.of(OverallStatus.PARTIAL_FAILURE));
            assertEquals("aborted", StatusMarker.of(OverallStatus.ABORTED));
            assertThrows(IllegalArgumentException.class, () -> StatusMarker.of(OverallStatus.PENDING));
        }

        @Test
        @DisplayName("missing token fails without calling the service")
        void missingToken() throws Exception {
            env = Map.of();

            var ex = assertThrows(FinalizationException.class,
                    () -> finalizer.finalize(IDENTITY, OverallStatus.SUCCESS));

            assertEquals(0, ex.attempts());
            verify(httpClient, never()).send(any(), any());
        }
    }

    @Nested
    @DisplayName("retry")
    class Retry {

        @Test
        @DisplayName("connection refused then success is acknowledged on attempt 2")
        void retriesTransportError() throws Exception {
            HttpResponse<String> ok = response(200, "ok");
            doThrow(new ConnectException("Connection refused"))
                    .doReturn(ok)
                    .when(httpClient).send(any(), any());

            var ack = finalizer.finalize(IDENTITY, OverallStatus.PARTIAL_FAILURE);

            assertEquals(2, ack.attempts());
            verify(httpClient, times(2)).send(any(), any());
        }

        @Test
        @DisplayName("5xx twice gives up after two attempts")
        void givesUpAfterSecondFailure() throws Exception {
            doReturn(response(503, "unavailable")).when(httpClient).send(any(), any());

            var ex = assertThrows(FinalizationException.class,
                    () -> finalizer.finalize(IDENTITY, OverallStatus.SUCCESS));

            assertEquals(503, ex.httpStatus());
            assertEquals(2, ex.attempts());
            verify(httpClient, times(2)).send(any(), any());
        }

        @Test
        @DisplayName("4xx is not retried")
        void clientErrorNotRetried() throws Exception {
            doReturn(response(422, "invalid repo token")).when(httpClient).send(any(), any());

            var ex = assertThrows(FinalizationException.class,
                    () -> finalizer.finalize(IDENTITY, OverallStatus.SUCCESS));

            assertEquals(422, ex.httpStatus());
            assertTrue(ex.getMessage().contains("invalid repo token"));
            verify(httpClient, times(1)).send(any(), any());
        }

        @Test
        @DisplayName("IOException twice surfaces the transport error")
        void transportErrorTwice() throws Exception {
            doThrow(new IOException("timeout")).when(httpClient).send(any(), any());

            var ex = assertThrows(FinalizationException.class,
                    () -> finalizer.finalize(IDENTITY, OverallStatus.ABORTED));

            assertEquals(0, ex.httpStatus());
            assertTrue(ex.getMessage().contains("timeout"));
        }
    }
}
