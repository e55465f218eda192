package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.mapping.MappingFileParser;
import com.designcontext.simplifier.mapping.MappingParseException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Mappings fetched by HTTP GET. The body is either a bare array of mapping entries or
 * {@code {"mappings": [...]}}.
 */
public class RemoteMappingSource implements MappingSource {
    private static final Logger log = LoggerFactory.getLogger(RemoteMappingSource.class);

    private final URI uri;
    private final Duration timeout;
    private final HttpClient client;
    private final MappingFileParser parser = new MappingFileParser();

    public RemoteMappingSource(String url, Duration timeout) {
        this(URI.create(url), timeout, HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public RemoteMappingSource(URI uri, Duration timeout, HttpClient client) {
        this.uri = uri;
        this.timeout = timeout;
        this.client = client;
    }

    @Override
    public MappingDocument load() {
        log.info("Fetching variable mappings from: {}", uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MappingSourceException("Error fetching remote mappings from " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MappingSourceException("Interrupted while fetching remote mappings from " + uri, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new MappingSourceException("Failed to fetch mappings from " + uri + ": HTTP " + response.statusCode());
        }
        try {
            return parser.parse(response.body(), uri.toString());
        } catch (MappingParseException e) {
            throw new MappingSourceException("Invalid mapping format from remote source " + uri, e);
        }
    }

    @Override
    public String describe() {
        return uri.toString();
    }
}
