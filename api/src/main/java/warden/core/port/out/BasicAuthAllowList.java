package warden.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port for authenticating Basic-auth username/password pairs.
 */
public interface BasicAuthAllowList {

    /**
     * Check a presented pair.
     *
     * @param username the presented username
     * @param password the presented password, empty when the header carried none
     * @return true if the pair is accepted; a failure when the oracle cannot answer
     */
    Uni<Boolean> authenticate(String username, Optional<String> password);
}
