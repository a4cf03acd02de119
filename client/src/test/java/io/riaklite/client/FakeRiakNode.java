package io.riaklite.client;

import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Undertow server that answers like a Riak node's HTTP interface, for tests.
 *
 * Path layout:
 *   - GET  /ping                  body from {@link #pingBody}
 *   - GET  /riak?buckets=true     {"buckets": [...]} from {@link #bucketsJson}
 *   - POST /mapred                records the job, answers {@link #mapredStatus}/{@link #mapredBody}
 *   - GET  /slow                  sleeps {@link #slowMillis} before answering
 *
 * Request headers of the last request are kept in {@link #lastHeaders}.
 */
final class FakeRiakNode {

    volatile String pingBody = "OK";
    volatile String bucketsJson = "{\"buckets\": []}";
    volatile int mapredStatus = 200;
    volatile String mapredBody = "[]";
    volatile long slowMillis = 1_000;

    volatile String lastJob;
    final Map<String, String> lastHeaders = new ConcurrentHashMap<>();

    private final Undertow server;

    FakeRiakNode() {
        this.server = Undertow.builder()
                .addHttpListener(0, "127.0.0.1")
                .setHandler(this::handle)
                .build();
    }

    FakeRiakNode start() {
        server.start();
        return this;
    }

    void stop() {
        server.stop();
    }

    int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    private void handle(HttpServerExchange ex) throws Exception {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        lastHeaders.clear();
        ex.getRequestHeaders().forEach(h -> lastHeaders.put(h.getHeaderName().toString().toLowerCase(), h.getFirst()));

        if ("/ping".equals(path) && "GET".equals(method)) {
            send(ex, 200, "text/plain", pingBody);
        } else if ("/riak".equals(path) && "GET".equals(method)
                && "true".equals(first(ex, "buckets"))) {
            send(ex, 200, "application/json", bucketsJson);
        } else if ("/mapred".equals(path) && "POST".equals(method)) {
            ex.getRequestReceiver().receiveFullString((exchange, body) -> {
                lastJob = body;
                send(exchange, mapredStatus, "application/json", mapredBody);
            });
        } else if ("/slow".equals(path)) {
            if (ex.isInIoThread()) {
                ex.dispatch(this::handle);
                return;
            }
            Thread.sleep(slowMillis);
            send(ex, 200, "text/plain", "late");
        } else {
            send(ex, 404, "text/plain", "not found");
        }
    }

    private static String first(HttpServerExchange ex, String param) {
        var values = ex.getQueryParameters().get(param);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    private static void send(HttpServerExchange ex, int status, String contentType, String body) {
        ex.setStatusCode(status);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        ex.getResponseHeaders().put(new HttpString("Server"), "fake-riak");
        ex.getResponseSender().send(body);
    }
}
