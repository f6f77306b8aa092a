package com.rewardpick.catalog.service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Downloads the shared catalog spreadsheet as CSV. The Sheets export endpoint is tried first;
 * plain Drive uploads are reached through the Drive download endpoint.
 */
@Component
public class RemoteCatalogClient {

    private static final Logger log = LoggerFactory.getLogger(RemoteCatalogClient.class);

    private final RemoteCatalogProperties properties;
    private final HttpClient httpClient;

    public RemoteCatalogClient(RemoteCatalogProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(Math.max(properties.getConnectTimeoutMs(), 1000)))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    public boolean isEnabled() {
        return properties.isEnabled() && !safe(properties.getFileId()).isBlank();
    }

    /**
     * @throws RemoteFetchException when neither endpoint returns a non-empty CSV body
     */
    public byte[] fetchLatestFile() {
        String fileId = safe(properties.getFileId());
        if (fileId.isBlank()) {
            throw new RemoteFetchException("catalog.remote.file-id is not configured");
        }

        try {
            return download(toUri(trimSlash(properties.getSheetsBaseUrl()) + "/" + encode(fileId) + "/export?format=csv"));
        } catch (RemoteFetchException exception) {
            log.warn("Sheets export failed, trying Drive download (fileId={}): {}", fileId, exception.getReason());
        }

        return download(toUri(trimSlash(properties.getDriveBaseUrl()) + "?export=download&id=" + encode(fileId)));
    }

    /**
     * @throws RemoteFetchException unless {@code raw} is an absolute http(s) URL with a host
     */
    static URI toUri(String raw) {
        URI uri;
        try {
            uri = URI.create(raw);
        } catch (IllegalArgumentException exception) {
            throw new RemoteFetchException("Invalid catalog URL '" + raw + "': " + exception.getMessage(), exception);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new RemoteFetchException("Invalid catalog URL '" + raw + "': only http and https are supported");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new RemoteFetchException("Invalid catalog URL '" + raw + "': host is missing");
        }
        return uri;
    }

    private byte[] download(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
            .GET()
            .timeout(Duration.ofMillis(Math.max(properties.getReadTimeoutMs(), 3000)))
            .header("Accept", "text/csv, */*")
            .header("User-Agent", "rewardpick-backend/1.0")
            .build();

        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException | InterruptedException exception) {
            if (exception instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new RemoteFetchException("Failed to download catalog from " + uri.getHost() + ": " + exception.getMessage(), exception);
        }

        if (response.statusCode() != 200) {
            throw new RemoteFetchException("Catalog download from " + uri.getHost() + " returned status " + response.statusCode());
        }

        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new RemoteFetchException("Catalog download from " + uri.getHost() + " returned an empty body");
        }
        if (looksLikeHtml(body)) {
            // Drive answers with a sign-in or virus-scan page instead of the file
            throw new RemoteFetchException("Catalog download from " + uri.getHost() + " returned an HTML page instead of CSV");
        }

        log.info("Catalog downloaded (host={}, bytes={})", uri.getHost(), body.length);
        return body;
    }

    private boolean looksLikeHtml(byte[] body) {
        String head = new String(body, 0, Math.min(body.length, 256), StandardCharsets.UTF_8).trim().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    private String trimSlash(String value) {
        String normalized = safe(value);
        return normalized.endsWith("/") ? normalized.substring(0, normalized.length() - 1) : normalized;
    }

    private String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private String safe(String value) {
        return value == null ? "" : value.trim();
    }
}
