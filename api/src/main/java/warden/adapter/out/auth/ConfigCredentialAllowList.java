package warden.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import warden.core.config.CredentialConfig;
import warden.core.port.out.ApiKeyAllowList;
import warden.core.port.out.BasicAuthAllowList;

/**
 * Allow-lists for API keys and Basic-auth users read from static configuration.
 *
 * <p>Secrets are compared in constant time. A Basic-auth pair without a password
 * is never accepted, even for a user configured with an empty password.
 */
@ApplicationScoped
public class ConfigCredentialAllowList implements ApiKeyAllowList, BasicAuthAllowList {

    private static final Logger LOG = Logger.getLogger(ConfigCredentialAllowList.class);

    private final List<byte[]> apiKeys;
    private final Map<String, byte[]> users;

    @Inject
    public ConfigCredentialAllowList(CredentialConfig config) {
        this(config.apiKey().keys().orElse(List.of()), config.basic().users());
    }

    ConfigCredentialAllowList(List<String> apiKeys, Map<String, String> users) {
        this.apiKeys = apiKeys.stream().filter(key -> !key.isEmpty()).map(ConfigCredentialAllowList::bytes).toList();
        this.users = users.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> bytes(e.getValue())));
        LOG.infov("Loaded {0} API keys and {1} Basic-auth users from configuration", this.apiKeys.size(), this.users.size());
    }

    @Override
    public Uni<Boolean> isAllowed(String key) {
        var presented = bytes(key);
        boolean allowed = false;
        for (byte[] candidate : apiKeys) {
            // No early exit on a match.
            allowed |= MessageDigest.isEqual(candidate, presented);
        }
        return Uni.createFrom().item(allowed);
    }

    @Override
    public Uni<Boolean> authenticate(String username, Optional<String> password) {
        var expected = users.get(username);
        if (expected == null || password.isEmpty()) {
            return Uni.createFrom().item(false);
        }
        return Uni.createFrom().item(MessageDigest.isEqual(expected, bytes(password.get())));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
