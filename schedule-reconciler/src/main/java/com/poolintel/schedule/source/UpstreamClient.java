package com.poolintel.schedule.source;

import com.poolintel.schedule.config.ReconcilerProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin HTTP client for every upstream schedule source.
 *
 * Each call sleeps for the configured rate-limit delay first; these are public city
 * endpoints. Non-200 responses and transport failures surface as IOException, which the
 * "upstream" Resilience4j retry instance retries with exponential backoff.
 */
@Service
@Slf4j
public class UpstreamClient {

    private final ReconcilerProperties.Http http;
    private final HttpClient httpClient;

    public UpstreamClient(ReconcilerProperties properties) {
        this.http = properties.getHttp();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(http.getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * GET a text payload, decoded with BOM detection.
     *
     * @throws IOException on transport failure or a non-200 status
     */
    @Retry(name = "upstream")
    public String fetchText(String url) throws IOException {
        return PayloadDecoder.decode(send(url));
    }

    /**
     * GET a payload as raw bytes, for binary formats such as XLSX workbooks.
     *
     * @throws IOException on transport failure or a non-200 status
     */
    @Retry(name = "upstream")
    public byte[] fetchBytes(String url) throws IOException {
        return send(url);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private byte[] send(String url) throws IOException {
        log.debug("GET {}", url);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(http.getTimeoutSeconds()))
                .header("User-Agent", http.getUserAgent())
                .GET()
                .build();

        try {
            sleepMs(http.getRateLimitDelayMs());
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() != 200) {
                throw new IOException("GET " + url + " failed: HTTP " + response.statusCode());
            }
            log.debug("GET {} returned {} bytes", url, response.body().length);
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + url);
        }
    }

    private void sleepMs(long ms) throws InterruptedException {
        if (ms > 0) Thread.sleep(ms);
    }
}
