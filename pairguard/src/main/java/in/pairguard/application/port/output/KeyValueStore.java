package in.pairguard.application.port.output;

import java.util.Optional;

/**
 * Flat string key/value storage for state that must survive a restart.
 *
 * Operations signal failure with {@link StateStoreException}.
 */
public interface KeyValueStore {

    /**
     * Get a value.
     */
    Optional<String> get(String key);

    /**
     * Insert or replace a value.
     */
    void set(String key, String value);

    /**
     * Delete a value. Deleting a missing key is not an error.
     */
    void delete(String key);
}
