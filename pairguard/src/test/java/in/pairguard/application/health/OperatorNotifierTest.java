package in.pairguard.application.health;

import in.pairguard.application.port.output.NotificationChannel;
import in.pairguard.application.port.output.NotificationException;
import in.pairguard.support.RecordingListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OperatorNotifier.
 */
@ExtendWith(MockitoExtension.class)
class OperatorNotifierTest {

    @Mock
    private NotificationChannel channel;

    private RecordingListener listener;
    private OperatorNotifier notifier;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        SupervisorEvents events = new SupervisorEvents();
        events.addListener(listener);
        notifier = new OperatorNotifier(channel, events);
    }

    @Test
    void testPostsCodeToOpenedConversation() {
        when(channel.openConversation("U0OPS")).thenReturn("D42");

        assertTrue(notifier.notify("U0OPS", "ABCD-1234", Duration.ofHours(8)));

        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(channel).postMessage(eq("D42"), text.capture());
        assertTrue(text.getValue().contains("`ABCD-1234`"));
        assertTrue(text.getValue().contains("Linked Devices"));
        assertTrue(text.getValue().contains("wait up to 8 hours"));
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    void testBlankTargetSkipsDelivery() {
        assertFalse(notifier.notify("  ", "ABCD-1234", Duration.ofHours(8)));
        verifyNoInteractions(channel);
        assertTrue(listener.errors.isEmpty());
    }

    @Test
    void testMissingChannelSkipsDelivery() {
        OperatorNotifier unconfigured = new OperatorNotifier(null, new SupervisorEvents());
        assertFalse(unconfigured.notify("U0OPS", "ABCD-1234", Duration.ofHours(8)));
    }

    @Test
    void testBlankConversationHandleIsAFailure() {
        when(channel.openConversation("U0OPS")).thenReturn("");

        assertFalse(notifier.notify("U0OPS", "ABCD-1234", Duration.ofHours(8)));

        verify(channel, never()).postMessage(anyString(), anyString());
        assertEquals(1, listener.errors.size());
        assertInstanceOf(NotificationException.class, listener.errors.get(0));
    }

    @Test
    void testPostFailureIsReportedNotThrown() {
        when(channel.openConversation("U0OPS")).thenReturn("D42");
        doThrow(new NotificationException("D42", "channel_not_found")).when(channel).postMessage(eq("D42"), anyString());

        assertFalse(notifier.notify("U0OPS", "ABCD-1234", Duration.ofHours(8)));
        assertEquals(1, listener.errors.size());
    }

    @Test
    void testMessageDescribesShortWindowInMinutes() {
        String text = OperatorNotifier.formatMessage("QWER-TYUI", Duration.ofMinutes(30));
        assertTrue(text.contains("wait up to 30 minutes"));
    }
}
