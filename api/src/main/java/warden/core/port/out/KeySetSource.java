package warden.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;
import org.jose4j.jwk.JsonWebKey;

/**
 * Port for fetching the published verification key set.
 *
 * <p>Implementations fetch and parse the remote document on every call; caching
 * belongs to the caller.
 */
public interface KeySetSource {

    /**
     * Fetch and parse the key set.
     *
     * @return the published keys, or a failure when the endpoint is unreachable,
     *         answers with a non-200 status or returns a document that is not a key set
     */
    Uni<List<JsonWebKey>> fetch();

    /**
     * Human-readable location of the key set, for log output.
     */
    String describe();
}
