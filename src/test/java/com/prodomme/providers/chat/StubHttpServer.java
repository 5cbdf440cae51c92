package com.prodomme.providers.chat;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;

/**
 * Loopback HTTP server that answers every request with a canned response and
 * remembers the last request it saw.
 */
final class StubHttpServer implements AutoCloseable {

    private final HttpServer server;
    private volatile int status = 200;
    private volatile String responseBody = "{}";
    private volatile String lastPath;
    private volatile String lastBody;
    private volatile Headers lastHeaders;
    private volatile int requestCount;

    StubHttpServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                lastBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            lastPath = exchange.getRequestURI().getPath();
            lastHeaders = exchange.getRequestHeaders();
            requestCount++;
            byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    void respond(int status, String body) {
        this.status = status;
        this.responseBody = body;
    }

    String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    String lastPath() {
        return lastPath;
    }

    String lastBody() {
        return lastBody;
    }

    String lastHeader(String name) {
        return lastHeaders != null ? lastHeaders.getFirst(name) : null;
    }

    int requestCount() {
        return requestCount;
    }

    /**
     * A loopback URL nothing listens on.
     */
    static String refusedBaseUrl() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 0, InetAddress.getByName("127.0.0.1"))) {
            port = socket.getLocalPort();
        }
        return "http://127.0.0.1:" + port;
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
