package com.metbull.sync.reconcile.http;

import com.metbull.sync.config.SyncProperties;
import com.metbull.sync.reconcile.model.FetchFailure;
import com.metbull.sync.reconcile.model.PageFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fetches one page of the catalog listing, newest records first. Failures come back
 * as a classified {@link PageFetchResult}; nothing is thrown to the caller.
 */
@Service
public class CatalogPageFetcher {
    private static final Logger log = LoggerFactory.getLogger(CatalogPageFetcher.class);

    public static final Map<String, String> TABLE_RENDERING = Map.of(
        "pnt", "Normal table",
        "map", "ge"
    );

    private final SyncProperties properties;
    private final HttpClient client;

    public CatalogPageFetcher(SyncProperties properties) {
        this.properties = properties;
        this.client = buildClient(properties);
    }

    public PageFetchResult fetchPage(int page) {
        return fetchPage(page, Map.of());
    }

    public PageFetchResult fetchPage(int page, Map<String, String> renderHints) {
        Instant startedAt = Instant.now();
        String url = pageUrl(page, renderHints);
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.8")
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            Duration elapsed = Duration.between(startedAt, Instant.now());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                return PageFetchResult.failed(page, url, status, elapsed, FetchFailure.HTTP_ERROR, "http_" + status);
            }
            Charset charset = charsetOf(response.headers().firstValue("Content-Type").orElse(null));
            byte[] bytes = response.body();
            String body = bytes == null ? "" : new String(bytes, charset);
            return PageFetchResult.success(page, url, status, body, elapsed);
        } catch (HttpTimeoutException e) {
            return failure(page, url, startedAt, FetchFailure.TIMEOUT, e);
        } catch (IOException e) {
            return failure(page, url, startedAt, FetchFailure.NETWORK_ERROR, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(page, url, startedAt, FetchFailure.NETWORK_ERROR, e);
        } catch (Exception e) {
            return failure(page, url, startedAt, FetchFailure.HTTP_ERROR, e);
        }
    }

    public String pageUrl(int page, Map<String, String> renderHints) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("sea", "*");
        params.put("sfor", "names");
        params.put("srt", "year");
        params.put("dir", "desc");
        params.put("lrec", Integer.toString(properties.getRecordsPerPage()));
        params.put("page", Integer.toString(Math.max(0, page)));
        if (renderHints != null) {
            params.putAll(renderHints);
        }
        StringBuilder url = new StringBuilder(properties.getCatalogUrl());
        url.append(properties.getCatalogUrl().contains("?") ? '&' : '?');
        boolean first = true;
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!first) {
                url.append('&');
            }
            url.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
            first = false;
        }
        return url.toString();
    }

    private PageFetchResult failure(int page, String url, Instant startedAt, FetchFailure kind, Exception e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return PageFetchResult.failed(page, url, 0, Duration.between(startedAt, Instant.now()), kind, message);
    }

    private static HttpClient buildClient(SyncProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1);
        if (properties.isInsecureTls()) {
            // The catalog host serves a chain the default trust store rejects.
            log.warn("Certificate validation is disabled for requests to {}", properties.getCatalogUrl());
            builder.sslContext(InsecureTls.trustAllContext());
        }
        return builder.build();
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        for (String part : contentType.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = trimmed.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    log.debug("unknown charset '{}', falling back to UTF-8", name);
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
