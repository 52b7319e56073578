package warden.core.service.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.model.auth.KeySetSnapshot;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.KeySetSource;

/**
 * Time-to-live cache of the verification key set, refreshed on read.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #initialize(Duration)} performs a blocking first fetch; failure is fatal</li>
 *   <li>{@link #snapshot()} returns the current key set, fetching a new one first when
 *       the current one is older than the TTL</li>
 *   <li>a failed refresh is logged and the stale key set is returned, so an upstream
 *       outage does not reject tokens signed with already-known keys</li>
 * </ul>
 *
 * <p>Thread-safety: the snapshot is held in an {@link AtomicReference}. Readers never
 * block, and the network call happens before the reference is swapped, so readers
 * see either the old or the new key set in full. Refreshes are not coalesced: several
 * readers hitting an expired TTL at once may each start a fetch. Such fetches are
 * idempotent and an older result never replaces a newer one.
 */
public class KeySetCacheService {

    private static final Logger LOG = Logger.getLogger(KeySetCacheService.class);

    private final KeySetSource source;
    private final Duration ttl;
    private final AuthMetrics metrics;
    private final AtomicReference<KeySetSnapshot> current = new AtomicReference<>();

    public KeySetCacheService(KeySetSource source, Duration ttl, AuthMetrics metrics) {
        this.source = source;
        this.ttl = ttl;
        this.metrics = metrics;
    }

    /**
     * Fetch the key set for the first time, blocking the caller.
     *
     * @param timeout maximum time to wait
     * @throws KeySetUnavailableException if the fetch fails or times out
     */
    public void initialize(Duration timeout) {
        LOG.infov("Fetching initial key set from {0}", source.describe());
        try {
            var snapshot = fetch().await().atMost(timeout);
            LOG.infov("Loaded {0} signing keys from {1}", snapshot.size(), source.describe());
        } catch (KeySetUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KeySetUnavailableException("Initial key set fetch from " + source.describe() + " failed", e);
        }
    }

    /**
     * Current key set, refreshed first when older than the TTL.
     *
     * @return the snapshot; a failure only when no key set was ever loaded
     */
    public Uni<KeySetSnapshot> snapshot() {
        return Uni.createFrom().deferred(() -> {
            var snapshot = current.get();
            if (snapshot == null) {
                return Uni.createFrom()
                        .<KeySetSnapshot>failure(new KeySetUnavailableException(
                                "Key set has not been loaded from " + source.describe()));
            }
            if (!snapshot.isStale(ttl, Instant.now())) {
                return Uni.createFrom().<KeySetSnapshot>item(snapshot);
            }

            LOG.debugv("Key set fetched at {0} is stale, refreshing", snapshot.fetchedAt());
            return fetch().onFailure().recoverWithItem(error -> {
                LOG.errorv(
                        error,
                        "Failed to refresh key set from {0}, keeping keys fetched at {1}",
                        source.describe(),
                        snapshot.fetchedAt());
                return current.get();
            });
        });
    }

    /**
     * The snapshot currently held, without triggering a refresh.
     */
    public KeySetSnapshot peek() {
        return current.get();
    }

    public Duration ttl() {
        return ttl;
    }

    private Uni<KeySetSnapshot> fetch() {
        return source.fetch()
                .map(keys -> KeySetSnapshot.of(keys, Instant.now()))
                .map(this::install)
                .invoke(() -> metrics.recordKeySetRefresh(true))
                .onFailure()
                .invoke(() -> metrics.recordKeySetRefresh(false));
    }

    private KeySetSnapshot install(KeySetSnapshot fresh) {
        var installed = current.accumulateAndGet(
                fresh, (old, candidate) -> old == null || candidate.fetchedAt().isAfter(old.fetchedAt()) ? candidate : old);
        LOG.debugv("Installed key set with {0} keys from {1}", installed.size(), source.describe());
        return installed;
    }
}
