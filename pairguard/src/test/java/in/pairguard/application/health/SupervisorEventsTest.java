package in.pairguard.application.health;

import in.pairguard.domain.health.SkipReason;
import in.pairguard.support.RecordingListener;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorEventsTest {

    @Test
    void testSignalsReachEveryListener() {
        SupervisorEvents events = new SupervisorEvents();
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();
        events.addListener(first);
        events.addListener(second);

        events.onPairingSkipped(SkipReason.COOLDOWN);
        events.onUnhealthy(3);

        assertEquals(1, first.skipped.size());
        assertEquals(1, second.skipped.size());
        assertEquals(3, second.unhealthy.get(0));
    }

    @Test
    void testThrowingListenerDoesNotStopOthers() {
        SupervisorEvents events = new SupervisorEvents();
        RecordingListener recorder = new RecordingListener();
        events.addListener(new SupervisorListener() {
            @Override
            public void onHealthy() {
                throw new IllegalStateException("broken dashboard");
            }
        });
        events.addListener(recorder);

        assertDoesNotThrow(events::onHealthy);
        assertEquals(1, recorder.healthy);
    }

    @Test
    void testRemovedListenerGetsNothing() {
        SupervisorEvents events = new SupervisorEvents();
        RecordingListener recorder = new RecordingListener();
        events.addListener(recorder);
        events.removeListener(recorder);
        events.addListener(null);

        events.onPairingRequested("ABCD-1234");

        assertTrue(recorder.pairingCodes.isEmpty());
    }
}
