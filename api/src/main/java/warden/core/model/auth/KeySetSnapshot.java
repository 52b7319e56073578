package warden.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jose4j.jwk.JsonWebKey;

/**
 * Immutable view of a published key set at the moment it was fetched.
 *
 * <p>Keys without a key id, or whose {@code use} is something other than {@code sig},
 * are dropped. When a key id appears twice the first entry wins.
 *
 * @param keys      signing keys by key id
 * @param fetchedAt when the key set was fetched
 */
public record KeySetSnapshot(Map<String, JsonWebKey> keys, Instant fetchedAt) {

    public KeySetSnapshot {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        keys = keys == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    /**
     * Build a snapshot from the keys of a published key set.
     */
    public static KeySetSnapshot of(Collection<? extends JsonWebKey> publishedKeys, Instant fetchedAt) {
        var byId = new LinkedHashMap<String, JsonWebKey>();
        for (JsonWebKey key : publishedKeys) {
            if (key.getKeyId() == null || !isSigningKey(key)) {
                continue;
            }
            byId.putIfAbsent(key.getKeyId(), key);
        }
        return new KeySetSnapshot(byId, fetchedAt);
    }

    private static boolean isSigningKey(JsonWebKey key) {
        return key.getUse() == null || "sig".equals(key.getUse());
    }

    public Optional<JsonWebKey> find(String keyId) {
        return Optional.ofNullable(keys.get(keyId));
    }

    public int size() {
        return keys.size();
    }

    /**
     * Check whether this snapshot is older than the given time to live.
     *
     * @param ttl maximum age
     * @param now the current instant
     * @return true when {@code now - fetchedAt > ttl}
     */
    public boolean isStale(Duration ttl, Instant now) {
        return Duration.between(fetchedAt, now).compareTo(ttl) > 0;
    }
}
