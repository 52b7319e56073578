package warden.adapter.out.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import warden.core.config.JwtConfig;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.KeySetSource;
import warden.core.service.auth.KeySetCacheService;

/**
 * Produces the key set cache for injection into core services.
 * This binds the core cache to the HTTP key set source and the configured TTL.
 */
@ApplicationScoped
public class KeySetCacheProducer {

    private final JwtConfig jwtConfig;

    @Inject
    public KeySetCacheProducer(JwtConfig jwtConfig) {
        this.jwtConfig = jwtConfig;
    }

    @Produces
    @Singleton
    public KeySetCacheService keySetCache(KeySetSource source, AuthMetrics metrics) {
        return new KeySetCacheService(source, jwtConfig.ttl(), metrics);
    }
}
