package in.pairguard.infrastructure.slack;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.pairguard.application.port.output.NotificationException;
import in.pairguard.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SlackNotificationChannelTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private StubHttpServer slack;
    private SlackNotificationChannel channel;

    @BeforeEach
    void setUp() {
        slack = new StubHttpServer();
        channel = new SlackNotificationChannel(slack.baseUrl() + "/", "xoxb-test");
    }

    @AfterEach
    void tearDown() {
        slack.close();
    }

    @Test
    void testOpenConversationReturnsChannelId() throws Exception {
        slack.reply("/conversations.open", 200, "{\"ok\":true,\"channel\":{\"id\":\"D0123\"}}");

        assertEquals("D0123", channel.openConversation("U0OPS"));

        StubHttpServer.Recorded request = slack.requests().get(0);
        assertEquals("POST", request.method());
        assertEquals("Bearer xoxb-test", request.authorization());
        assertEquals("U0OPS", mapper.readTree(request.body()).path("users").asText());
    }

    @Test
    void testPostMessageSendsMarkdown() throws Exception {
        slack.reply("/chat.postMessage", 200, "{\"ok\":true,\"ts\":\"1700000000.0001\"}");

        channel.postMessage("D0123", "*Pairing Code:* `ABCD-1234`");

        JsonNode body = mapper.readTree(slack.requests().get(0).body());
        assertEquals("D0123", body.path("channel").asText());
        assertEquals("*Pairing Code:* `ABCD-1234`", body.path("text").asText());
        assertTrue(body.path("mrkdwn").asBoolean());
    }

    @Test
    void testOkFalseIsAFailure() {
        slack.reply("/conversations.open", 200, "{\"ok\":false,\"error\":\"user_not_found\"}");

        NotificationException e = assertThrows(NotificationException.class,
            () -> channel.openConversation("U0NOPE"));
        assertTrue(e.getMessage().contains("user_not_found"));
    }

    @Test
    void testMissingChannelIdIsAFailure() {
        slack.reply("/conversations.open", 200, "{\"ok\":true}");

        assertThrows(NotificationException.class, () -> channel.openConversation("U0OPS"));
    }

    @Test
    void testHttpErrorIsAFailure() {
        slack.reply("/chat.postMessage", 500, "oops");

        NotificationException e = assertThrows(NotificationException.class,
            () -> channel.postMessage("D0123", "hi"));
        assertTrue(e.getMessage().contains("HTTP 500"));
    }
}
