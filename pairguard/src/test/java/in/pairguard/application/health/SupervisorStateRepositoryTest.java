package in.pairguard.application.health;

import in.pairguard.application.port.output.KeyValueStore;
import in.pairguard.application.port.output.StateStoreException;
import in.pairguard.domain.health.PairingState;
import in.pairguard.domain.health.SupervisorState;
import in.pairguard.infrastructure.persistence.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SupervisorStateRepositoryTest {

    private static final Instant REQUESTED = Instant.parse("2026-03-01T09:30:00Z");

    private InMemoryKeyValueStore store;
    private SupervisorStateRepository repository;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        repository = new SupervisorStateRepository(store);
    }

    @Test
    void testEmptyStoreLoadsInitialState() {
        SupervisorState state = repository.load();

        assertEquals(PairingState.IDLE, state.pairingState());
        assertEquals(0, state.consecutiveFailures());
        assertNull(state.lastPairingRequestTime());
    }

    @Test
    void testSaveWritesThreeKeys() {
        SupervisorState state = SupervisorState.initial()
            .withConsecutiveFailures(3)
            .enter(PairingState.COOLDOWN, REQUESTED);

        assertTrue(repository.save(state));

        assertEquals("cooldown", store.get(SupervisorStateRepository.KEY_PAIRING_STATE).orElseThrow());
        assertEquals("2026-03-01T09:30:00Z", store.get(SupervisorStateRepository.KEY_LAST_PAIRING_REQUEST).orElseThrow());
        assertEquals("3", store.get(SupervisorStateRepository.KEY_CONSECUTIVE_FAILURES).orElseThrow());
    }

    @Test
    void testSavedStateLoadsBack() {
        SupervisorState saved = SupervisorState.initial()
            .withConsecutiveFailures(2)
            .enter(PairingState.PAIRING_REQUESTED, REQUESTED);
        repository.save(saved);

        SupervisorState loaded = new SupervisorStateRepository(store).load();

        assertTrue(saved.samePersistentState(loaded));
    }

    @Test
    void testMissingRequestTimeDeletesKey() {
        store.set(SupervisorStateRepository.KEY_LAST_PAIRING_REQUEST, REQUESTED.toString());

        repository.save(SupervisorState.initial());

        assertTrue(store.get(SupervisorStateRepository.KEY_LAST_PAIRING_REQUEST).isEmpty());
    }

    @Test
    void testCorruptValuesFallBackPerKey() {
        store.set(SupervisorStateRepository.KEY_PAIRING_STATE, "rebooting");
        store.set(SupervisorStateRepository.KEY_LAST_PAIRING_REQUEST, "yesterday");
        store.set(SupervisorStateRepository.KEY_CONSECUTIVE_FAILURES, "7");

        SupervisorState state = repository.load();

        assertEquals(PairingState.IDLE, state.pairingState());
        assertNull(state.lastPairingRequestTime());
        assertEquals(7, state.consecutiveFailures());
    }

    @Test
    void testNegativeOrGarbageFailureCountReadsAsZero() {
        store.set(SupervisorStateRepository.KEY_CONSECUTIVE_FAILURES, "-4");
        assertEquals(0, repository.load().consecutiveFailures());

        store.set(SupervisorStateRepository.KEY_CONSECUTIVE_FAILURES, "many");
        assertEquals(0, repository.load().consecutiveFailures());
    }

    @Test
    void testReadFailureYieldsInitialState() {
        KeyValueStore broken = mock(KeyValueStore.class);
        when(broken.get(anyString())).thenThrow(new StateStoreException("pairing_state", "connection refused", null));

        SupervisorState state = new SupervisorStateRepository(broken).load();

        assertEquals(SupervisorState.initial(), state);
    }

    @Test
    void testWriteFailureReturnsFalse() {
        KeyValueStore broken = mock(KeyValueStore.class);
        doThrow(new StateStoreException("pairing_state", "read-only", null)).when(broken).set(anyString(), anyString());

        assertFalse(new SupervisorStateRepository(broken).save(SupervisorState.initial()));
    }
}
