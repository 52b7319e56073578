package warden.adapter.in.bootstrap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import warden.core.config.JwtConfig;
import warden.core.service.auth.KeySetCacheService;
import warden.core.service.auth.KeySetUnavailableException;

/**
 * Loads the verification key set on application startup.
 *
 * <h2>Failure Behavior</h2>
 * <ul>
 *   <li>If bearer verification is disabled: nothing is fetched</li>
 *   <li>If no key set location is configured: startup FAILS</li>
 *   <li>If the first fetch fails or times out: startup FAILS</li>
 * </ul>
 *
 * <p>Only this first fetch is fatal; later refresh failures keep the previous keys.
 */
@ApplicationScoped
public class KeySetInitializer {

    private static final Logger LOG = Logger.getLogger(KeySetInitializer.class);

    private final KeySetCacheService keySetCache;
    private final JwtConfig config;

    @Inject
    public KeySetInitializer(KeySetCacheService keySetCache, JwtConfig config) {
        this.keySetCache = keySetCache;
        this.config = config;
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.debug("Bearer token verification is disabled");
            return;
        }

        if (config.jwksUri().isEmpty() && config.discoveryUri().isEmpty()) {
            LOG.error("Bearer token verification is enabled but no key set location is configured");
            throw new KeySetUnavailableException(
                    "warden.jwt.enabled=true requires warden.jwt.jwks-uri or warden.jwt.discovery-uri");
        }

        try {
            keySetCache.initialize(config.fetchTimeout());
        } catch (KeySetUnavailableException e) {
            LOG.errorv(e, "Initial key set fetch failed, refusing to start: {0}", e.getMessage());
            throw e;
        }
    }
}
