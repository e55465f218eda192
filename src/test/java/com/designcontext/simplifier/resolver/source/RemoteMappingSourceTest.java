package com.designcontext.simplifier.resolver.source;

import com.designcontext.simplifier.mapping.MappingDocument;
import com.designcontext.simplifier.mapping.VariableMapping;
import com.designcontext.simplifier.resolver.MappingCache;
import com.designcontext.simplifier.resolver.MappingSet;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests RemoteMappingSource against a local HTTP server.
 */
class RemoteMappingSourceTest {

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        respond("/array", 200, """
                [{"id": "VariableID:1:2", "name": "Surface/Inverse"}, {"id": "3:4", "name": "Text/Primary"}]
                """);
        respond("/wrapped", 200, """
                {"mappings": [{"id": "VariableID:5:6", "name": "Border/Subtle", "description": "Hairlines"}]}
                """);
        respond("/broken", 200, "{not json");
        respond("/missing", 404, "{\"error\": \"not found\"}");
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void testBareArrayBody() {
        MappingDocument doc = source("/array").load();

        assertThat(doc.getVariableMappings())
                .extracting(VariableMapping::getName)
                .containsExactly("Surface/Inverse", "Text/Primary");
    }

    @Test
    void testWrappedBody() {
        MappingDocument doc = source("/wrapped").load();

        assertThat(doc.getVariableMappings()).hasSize(1);
        assertThat(doc.getVariableMappings().get(0).getDescription()).isEqualTo("Hairlines");
    }

    @Test
    void testHttpErrorRaisesSourceException() {
        assertThatThrownBy(() -> source("/missing").load())
                .isInstanceOf(MappingSourceException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    void testMalformedBodyRaisesSourceException() {
        assertThatThrownBy(() -> source("/broken").load())
                .isInstanceOf(MappingSourceException.class)
                .hasMessageContaining("Invalid mapping format");
    }

    @Test
    void testCacheFailsOpenWhenRemoteIsDown() {
        MappingSource down = source("/missing");
        MappingCache cache = new MappingCache(null, down, null,
                Duration.ofSeconds(10), Duration.ofMinutes(5), Clock.systemUTC());

        MappingSet set = cache.current();

        assertThat(set.isEmpty()).isTrue();
    }

    private RemoteMappingSource source(String path) {
        return new RemoteMappingSource(baseUrl + path, Duration.ofSeconds(5));
    }

    private void respond(String path, int status, String body) {
        server.createContext(path, exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }
}
