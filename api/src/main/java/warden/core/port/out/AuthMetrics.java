package warden.core.port.out;

import warden.core.model.auth.CredentialScheme;
import warden.core.model.error.AuthErrorKind;

/**
 * Port interface for recording authentication metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface AuthMetrics {

    /**
     * Record an accepted credential.
     *
     * @param scheme the credential scheme
     */
    void recordAccepted(CredentialScheme scheme);

    /**
     * Record a rejected request.
     *
     * @param scheme the credential scheme
     * @param kind   the error kind
     */
    void recordRejected(CredentialScheme scheme, AuthErrorKind kind);

    /**
     * Record the outcome of a key set refresh.
     *
     * @param success true if the fetch replaced the snapshot
     */
    void recordKeySetRefresh(boolean success);
}
