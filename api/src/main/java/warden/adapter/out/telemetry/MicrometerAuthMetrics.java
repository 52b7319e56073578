package warden.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import warden.core.config.MetricsConfig;
import warden.core.model.auth.CredentialScheme;
import warden.core.model.error.AuthErrorKind;
import warden.core.port.out.AuthMetrics;

/**
 * Records authentication metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers need not check
 * configuration.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code warden.auth.accepted} - accepted credentials by scheme</li>
 *   <li>{@code warden.auth.rejected} - rejected requests by scheme, kind and status</li>
 *   <li>{@code warden.jwks.refresh} - key set fetches by outcome</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerAuthMetrics implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerAuthMetrics(MeterRegistry registry, MetricsConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAccepted(CredentialScheme scheme) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.accepted")
                .description("Credentials accepted")
                .tag("scheme", scheme.tagValue())
                .register(registry)
                .increment();
    }

    @Override
    public void recordRejected(CredentialScheme scheme, AuthErrorKind kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.auth.rejected")
                .description("Requests rejected by authentication")
                .tag("scheme", scheme.tagValue())
                .tag("kind", kind.wireName())
                .tag("status", String.valueOf(kind.statusCode()))
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeySetRefresh(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("warden.jwks.refresh")
                .description("Key set fetches")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }
}
