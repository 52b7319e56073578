package warden.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for authentication metrics.
 *
 * <p>Configuration prefix: {@code warden.metrics}
 */
@ConfigMapping(prefix = "warden.metrics")
public interface MetricsConfig {

    /**
     * Record authentication counters.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();
}
