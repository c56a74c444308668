package in.pairguard.infrastructure.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.pairguard.application.port.output.NotificationChannel;
import in.pairguard.application.port.output.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * NotificationChannel over the Slack Web API.
 *
 * Uses conversations.open to get a DM channel for a user id and
 * chat.postMessage to post into it. Requires a bot token with
 * im:write and chat:write scopes.
 */
public class SlackNotificationChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(SlackNotificationChannel.class);

    public static final String DEFAULT_API_URL = "https://slack.com/api";

    private final String apiUrl;
    private final String botToken;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public SlackNotificationChannel(String apiUrl, String botToken) {
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.botToken = botToken;
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Override
    public String openConversation(String target) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("users", target);

        JsonNode response = call(target, "conversations.open", body);
        JsonNode channelId = response.path("channel").path("id");
        if (channelId.isMissingNode() || channelId.asText().isEmpty()) {
            throw new NotificationException(target, "Failed to open DM conversation with user");
        }
        return channelId.asText();
    }

    @Override
    public void postMessage(String channelHandle, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("channel", channelHandle);
        body.put("text", text);
        body.put("mrkdwn", true);

        JsonNode response = call(channelHandle, "chat.postMessage", body);
        log.debug("Slack message posted to {} (ts={})", channelHandle, response.path("ts").asText());
    }

    private JsonNode call(String target, String method, ObjectNode body) {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + "/" + method))
                .timeout(Duration.ofSeconds(15))
                .header("Content-Type", "application/json; charset=utf-8")
                .header("Authorization", "Bearer " + botToken)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                log.error("Slack {} failed: HTTP {} - {}", method, response.statusCode(), response.body());
                throw new NotificationException(target, method + " failed: HTTP " + response.statusCode());
            }

            JsonNode json = objectMapper.readTree(response.body());
            if (!json.path("ok").asBoolean(false)) {
                String error = json.path("error").asText("unknown_error");
                log.error("Slack {} error: {}", method, error);
                throw new NotificationException(target, method + " failed: " + error);
            }
            return json;

        } catch (NotificationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(target, method + " interrupted", e);
        } catch (Exception e) {
            throw new NotificationException(target, method + " failed: " + e.getMessage(), e);
        }
    }
}
