package warden.adapter.out.auth;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.DecodeException;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey;
import org.jose4j.jwk.JsonWebKeySet;
import org.jose4j.lang.JoseException;

import warden.core.config.JwtConfig;
import warden.core.port.out.KeySetSource;
import warden.core.service.auth.KeySetUnavailableException;

/**
 * Fetches the published key set over HTTP with the Vert.x web client.
 *
 * <p>The key set location is either configured directly ({@code warden.jwt.jwks-uri})
 * or read from the {@code jwks_uri} field of an OpenID Connect discovery document
 * ({@code warden.jwt.discovery-uri}). A discovered location is resolved once and
 * reused for later fetches.
 */
@ApplicationScoped
public class HttpKeySetSource implements KeySetSource {

    private static final Logger LOG = Logger.getLogger(HttpKeySetSource.class);

    private final WebClient webClient;
    private final Optional<URI> jwksUri;
    private final Optional<URI> discoveryUri;
    private final Duration timeout;
    private final AtomicReference<URI> resolved = new AtomicReference<>();

    @Inject
    public HttpKeySetSource(Vertx vertx, JwtConfig config) {
        this(WebClient.create(vertx), config.jwksUri(), config.discoveryUri(), config.fetchTimeout());
    }

    HttpKeySetSource(WebClient webClient, Optional<URI> jwksUri, Optional<URI> discoveryUri, Duration timeout) {
        this.webClient = webClient;
        this.jwksUri = jwksUri;
        this.discoveryUri = discoveryUri;
        this.timeout = timeout;
        jwksUri.ifPresent(resolved::set);
    }

    @Override
    public Uni<List<JsonWebKey>> fetch() {
        return keySetLocation().flatMap(this::fetchKeySet);
    }

    @Override
    public String describe() {
        var location = resolved.get();
        if (location != null) {
            return location.toString();
        }
        return discoveryUri.map(uri -> "discovery " + uri).orElse("<no key set location configured>");
    }

    private Uni<URI> keySetLocation() {
        var location = resolved.get();
        if (location != null) {
            return Uni.createFrom().item(location);
        }
        if (discoveryUri.isEmpty()) {
            return Uni.createFrom()
                    .failure(new KeySetUnavailableException(
                            "Neither warden.jwt.jwks-uri nor warden.jwt.discovery-uri is configured"));
        }

        var discovery = discoveryUri.get();
        LOG.infov("Resolving key set location from discovery document {0}", discovery);
        return get(discovery).map(response -> {
            var body = requireOk(response, discovery);
            String discovered;
            try {
                discovered = body.toJsonObject().getString("jwks_uri");
            } catch (DecodeException | ClassCastException e) {
                throw new KeySetUnavailableException("Discovery document at " + discovery + " is not valid JSON", e);
            }
            if (discovered == null || discovered.isBlank()) {
                throw new KeySetUnavailableException("Discovery document at " + discovery + " has no jwks_uri");
            }
            var uri = URI.create(discovered);
            resolved.set(uri);
            LOG.infov("Discovered key set location {0}", uri);
            return uri;
        });
    }

    private Uni<List<JsonWebKey>> fetchKeySet(URI location) {
        LOG.debugv("Fetching key set from {0}", location);
        return get(location).map(response -> {
            var body = requireOk(response, location);
            try {
                return new JsonWebKeySet(body.toString()).getJsonWebKeys();
            } catch (JoseException e) {
                throw new KeySetUnavailableException("Failed to parse key set from " + location + ": " + e.getMessage(), e);
            }
        });
    }

    private Uni<HttpResponse<Buffer>> get(URI uri) {
        return webClient
                .getAbs(uri.toString())
                .timeout(timeout.toMillis())
                .putHeader("Accept", "application/json")
                .send()
                .onFailure()
                .transform(error -> new KeySetUnavailableException(
                        "Request to " + uri + " failed: " + error.getMessage(), error));
    }

    private Buffer requireOk(HttpResponse<Buffer> response, URI uri) {
        if (response.statusCode() != 200) {
            throw new KeySetUnavailableException(uri + " returned status " + response.statusCode());
        }
        var body = response.body();
        if (body == null) {
            throw new KeySetUnavailableException(uri + " returned an empty body");
        }
        return body;
    }
}
