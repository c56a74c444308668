package in.pairguard.infrastructure.connection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.pairguard.application.port.output.ConnectionOperationException;
import in.pairguard.application.port.output.WatchedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * WatchedConnection backed by the WhatsApp bot's control API.
 *
 * Endpoints:
 * - GET  /whatsapp/health  - {"connected": bool}
 * - POST /disconnect       - tear down the socket and flush the session
 * - POST /connect          - initialise a new socket
 * - POST /pairing-code     - {"phoneNumber": "..."} -> {"success": true, "code": "..."}
 */
public class HttpWatchedConnection implements WatchedConnection {
    private static final Logger log = LoggerFactory.getLogger(HttpWatchedConnection.class);

    private final String baseUrl;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public HttpWatchedConnection(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public boolean isReady() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/whatsapp/health"))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Bot health endpoint returned HTTP {}", response.statusCode());
                return false;
            }
            return objectMapper.readTree(response.body()).path("connected").asBoolean(false);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.debug("Bot health endpoint unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void disconnect() {
        post("disconnect", "/disconnect", objectMapper.createObjectNode());
    }

    @Override
    public void connect() {
        post("connect", "/connect", objectMapper.createObjectNode());
    }

    @Override
    public String requestPairingCode(String identity) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("phoneNumber", identity);

        JsonNode response = post("requestPairingCode", "/pairing-code", body);
        String code = response.path("code").asText("");
        if (code.isEmpty()) {
            throw new ConnectionOperationException("requestPairingCode", "Response missing pairing code");
        }
        return code;
    }

    private JsonNode post(String operation, String path, ObjectNode body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            JsonNode json = response.body() == null || response.body().isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(response.body());

            if (response.statusCode() / 100 != 2 || !json.path("success").asBoolean(true)) {
                String error = json.path("error").asText("HTTP " + response.statusCode());
                log.error("Bot {} failed: {}", operation, error);
                throw new ConnectionOperationException(operation, error);
            }
            return json;

        } catch (ConnectionOperationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionOperationException(operation, "Interrupted", e);
        } catch (Exception e) {
            throw new ConnectionOperationException(operation, e.getMessage(), e);
        }
    }
}
