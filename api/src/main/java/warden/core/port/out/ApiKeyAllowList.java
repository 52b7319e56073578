package warden.core.port.out;

import io.smallrye.mutiny.Uni;

/**
 * Port for deciding whether a presented API key is accepted.
 */
public interface ApiKeyAllowList {

    /**
     * Check a presented key.
     *
     * @param key the key exactly as presented
     * @return true if accepted, false if unknown or revoked; a failure when the
     *         oracle itself cannot answer
     */
    Uni<Boolean> isAllowed(String key);
}
