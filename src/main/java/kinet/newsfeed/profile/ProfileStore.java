package kinet.newsfeed.profile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable byte storage for profiles. Keys are already store-safe.
 */
public interface ProfileStore {
    Optional<byte[]> get(String key) throws IOException;

    /** Replaces the entry so that readers see either the old or the new bytes, never a mix. */
    void put(String key, byte[] value) throws IOException;

    boolean delete(String key) throws IOException;

    List<String> keys() throws IOException;
}
