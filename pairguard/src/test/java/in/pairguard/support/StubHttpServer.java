package in.pairguard.support;

import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Embedded Undertow server answering canned JSON per path and recording requests.
 */
public final class StubHttpServer implements AutoCloseable {

    public record Recorded(String method, String path, String authorization, String body) {}

    private record Reply(int status, String body) {}

    private final Map<String, Reply> replies = new ConcurrentHashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final Undertow server;

    public StubHttpServer() {
        server = Undertow.builder()
            .addHttpListener(0, "127.0.0.1")
            .setHandler(new BlockingHandler(this::handle))
            .build();
        server.start();
    }

    public StubHttpServer reply(String path, int status, String body) {
        replies.put(path, new Reply(status, body));
        return this;
    }

    public String baseUrl() {
        InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return "http://127.0.0.1:" + address.getPort();
    }

    public List<Recorded> requests() {
        return requests;
    }

    private void handle(HttpServerExchange exchange) throws Exception {
        String body = new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(
            exchange.getRequestMethod().toString(),
            exchange.getRequestPath(),
            exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION),
            body));

        Reply reply = replies.getOrDefault(exchange.getRequestPath(), new Reply(404, "{\"error\":\"not_found\"}"));
        exchange.setStatusCode(reply.status());
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(reply.body());
    }

    @Override
    public void close() {
        server.stop();
    }
}
