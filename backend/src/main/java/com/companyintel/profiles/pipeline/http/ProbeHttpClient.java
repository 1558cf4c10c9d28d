package com.companyintel.profiles.pipeline.http;

import com.companyintel.profiles.config.PipelineProperties;
import com.companyintel.profiles.pipeline.model.HttpProbeResult;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Existence checks for remote resources. Every probe is a single HEAD request bounded by
 * the configured probe timeout; failures come back as result values, never as exceptions.
 */
@Service
public class ProbeHttpClient {
    private final PipelineProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;

    public ProbeHttpClient(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getLogo().getProbeTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(Math.max(1, properties.getConcurrency() * 2));
    }

    public HttpProbeResult head(String url) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, ReasonCodes.PROBE_INVALID_URL, "URL missing host or malformed");
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getLogo().getProbeTimeoutSeconds()))
                .header("User-Agent", PipelineProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", "image/*,*/*;q=0.8")
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            return new HttpProbeResult(
                url,
                response.statusCode(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, ReasonCodes.PROBE_TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, ReasonCodes.PROBE_IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, ReasonCodes.PROBE_INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, ReasonCodes.PROBE_HTTP_ERROR, e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private HttpProbeResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpProbeResult(
            url,
            0,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
