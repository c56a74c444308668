package in.pairguard.infrastructure.persistence;

import in.pairguard.application.port.output.KeyValueStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local KeyValueStore, used when no database is configured.
 * State does not survive a restart.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        values.put(key, value);
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    /**
     * Copy of the current contents.
     */
    public Map<String, String> snapshot() {
        return Map.copyOf(values);
    }
}
