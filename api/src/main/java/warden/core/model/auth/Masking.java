package warden.core.model.auth;

/**
 * Masks secrets for log output.
 */
public final class Masking {

    private static final int VISIBLE_PREFIX = 4;

    private Masking() {}

    /**
     * Keep a short prefix of long secrets so operators can correlate keys, hide the rest.
     */
    public static String mask(String secret) {
        if (secret == null) {
            return "null";
        }
        if (secret.length() <= VISIBLE_PREFIX * 2) {
            return "****";
        }
        return secret.substring(0, VISIBLE_PREFIX) + "****";
    }
}
