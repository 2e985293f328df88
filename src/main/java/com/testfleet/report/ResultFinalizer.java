package com.testfleet.report;

import com.testfleet.core.model.BuildIdentity;
import com.testfleet.core.model.BuildNumberSource;
import com.testfleet.core.model.OverallStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP client for the coverage service's "build finished" webhook.
 *
 * <p>Sends one form-encoded POST per run:
 * <pre>
 * POST &lt;endpoint&gt;?repo_token=&lt;token&gt;
 * payload[build_num]=&lt;build number&gt;&amp;payload[status]=done|failed|aborted
 * </pre>
 * The repository token is never configured directly; it is read from the
 * environment variable whose name is configured, so it stays out of config files
 * and logs.
 *
 * <p>A connection error or a 5xx is retried once after a fixed backoff. A 4xx is
 * the service rejecting the request and is not retried.
 */
public class ResultFinalizer {

    private static final Logger log = LoggerFactory.getLogger(ResultFinalizer.class);

    static final int MAX_ATTEMPTS = 2;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String tokenEnv;
    private final Function<String, String> envLookup;
    private final Duration requestTimeout;
    private final Duration retryBackoff;
    private final BuildNumberSource buildNumberSource;

    public ResultFinalizer(HttpClient httpClient, URI endpoint, String tokenEnv,
                           Function<String, String> envLookup, Duration requestTimeout,
                           Duration retryBackoff, BuildNumberSource buildNumberSource) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.tokenEnv = tokenEnv;
        this.envLookup = envLookup;
        this.requestTimeout = requestTimeout;
        this.retryBackoff = retryBackoff;
        this.buildNumberSource = buildNumberSource;
    }

    /**
     * Reports the final status of a build.
     *
     * @return the acknowledgement of the reporting service
     * @throws FinalizationException if the token is missing, the service rejects the
     *                               call, or both attempts fail
     */
    public FinalizationAck finalize(BuildIdentity identity, OverallStatus status) {
        String token = envLookup.apply(tokenEnv);
        if (token == null || token.isBlank()) {
            throw new FinalizationException("Reporting token not set (environment variable " + tokenEnv + ")", 0, 0);
        }

        String buildNum = identity.buildNumber(buildNumberSource);
        String marker = StatusMarker.of(status);
        var request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "?repo_token=" + encode(token)))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(buildNum, marker)))
                .build();

        log.info("Finalizing build {} as '{}' at {}", buildNum, marker, endpoint);

        int lastStatus = 0;
        String lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                lastStatus = response.statusCode();
                if (lastStatus < 300) {
                    log.info("Reporting service acknowledged build {} (HTTP {}, attempt {})",
                            buildNum, lastStatus, attempt);
                    return new FinalizationAck(lastStatus, response.body(), attempt);
                }
                if (lastStatus < 500) {
                    throw new FinalizationException("Reporting service rejected build %s (HTTP %d): %s"
                            .formatted(buildNum, lastStatus, response.body()), lastStatus, attempt);
                }
                lastError = "HTTP " + lastStatus;
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FinalizationException("Interrupted while finalizing build " + buildNum,
                        lastStatus, attempt, e);
            }

            if (attempt < MAX_ATTEMPTS) {
                log.warn("Finalization attempt {} failed ({}), retrying in {}ms",
                        attempt, lastError, retryBackoff.toMillis());
                pause();
            }
        }
        throw new FinalizationException("Finalization of build %s failed after %d attempts: %s"
                .formatted(buildNum, MAX_ATTEMPTS, lastError), lastStatus, MAX_ATTEMPTS);
    }

    static String formBody(String buildNum, String marker) {
        return "payload[build_num]=" + encode(buildNum) + "&payload[status]=" + encode(marker);
    }

    private void pause() {
        try {
            Thread.sleep(retryBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FinalizationException("Interrupted while waiting to retry finalization", 0, 1, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
