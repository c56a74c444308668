package in.pairguard.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.pairguard.application.health.HealthCheckScheduler;
import in.pairguard.application.health.RecoveryResult;
import in.pairguard.domain.health.HealthStatus;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP handler for health monitor administration endpoints.
 *
 * Provides REST API for:
 * - GET  /api/health-monitor/status  - Current supervisor status (read-only)
 * - POST /api/health-monitor/check   - Run a health check now
 * - POST /api/health-monitor/pairing - Force a re-pairing attempt
 * - POST /api/health-monitor/reset   - Reset counters and pairing state
 *
 * POST endpoints block until the supervisor is free, so they run on a worker thread.
 */
public final class HealthMonitorHandler {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitorHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final HealthCheckScheduler supervisor;

    public HealthMonitorHandler(HealthCheckScheduler supervisor) {
        this.supervisor = supervisor;
    }

    /**
     * GET /api/health-monitor/status
     */
    public void getStatus(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, supervisor.getStatus());
            log.debug("GET /api/health-monitor/status → 200 OK");
        } catch (Exception e) {
            log.error("Failed to get health monitor status: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get status: " + e.getMessage());
        }
    }

    /**
     * POST /api/health-monitor/check
     */
    public void forceCheck(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::forceCheck);
            return;
        }
        try {
            log.info("POST /api/health-monitor/check - manual health check requested");
            HealthStatus status = supervisor.forceCheck();
            sendJson(exchange, StatusCodes.OK, status);
        } catch (Exception e) {
            log.error("Failed to run health check: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to run health check: " + e.getMessage());
        }
    }

    /**
     * POST /api/health-monitor/pairing
     *
     * Responds 200 with the new code on success, 502 when the recovery attempt failed.
     */
    public void forcePairing(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::forcePairing);
            return;
        }
        try {
            log.info("POST /api/health-monitor/pairing - manual re-pairing requested");
            RecoveryResult result = supervisor.forcePairing();

            Map<String, Object> body = new LinkedHashMap<>();
            boolean success = result != null && result.isSuccess();
            body.put("success", success);
            if (success) {
                body.put("pairingCode", result.pairingCode());
                body.put("operatorNotified", result.operatorNotified());
            } else {
                body.put("error", result != null ? result.error().getMessage() : "Recovery could not be started");
            }
            body.put("status", supervisor.getStatus());

            sendJson(exchange, success ? StatusCodes.OK : StatusCodes.BAD_GATEWAY, body);
        } catch (Exception e) {
            log.error("Failed to force pairing: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to force pairing: " + e.getMessage());
        }
    }

    /**
     * POST /api/health-monitor/reset
     */
    public void reset(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::reset);
            return;
        }
        try {
            log.info("POST /api/health-monitor/reset - state reset requested");
            sendJson(exchange, StatusCodes.OK, supervisor.reset());
        } catch (Exception e) {
            log.error("Failed to reset health monitor: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to reset: " + e.getMessage());
        }
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, Map.of("status", "ok", "monitorRunning", supervisor.isRunning()));
        } catch (Exception e) {
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
