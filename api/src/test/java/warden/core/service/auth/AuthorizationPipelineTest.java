package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.in.rest.JacksonCustomizer;
import warden.core.config.CredentialConfig;
import warden.core.config.JwtConfig;
import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.CredentialScheme;
import warden.core.model.auth.KeySetSnapshot;
import warden.core.model.auth.Principal;
import warden.core.model.auth.Principal.ApiKeyPrincipal;
import warden.core.model.auth.Principal.BasicAuthPrincipal;
import warden.core.model.auth.Principal.BearerPrincipal;
import warden.core.model.auth.StandardClaims;
import warden.core.model.error.AuthError;
import warden.core.model.error.AuthErrorKind;
import warden.core.port.out.ApiKeyAllowList;
import warden.core.port.out.AuthMetrics;
import warden.core.port.out.BasicAuthAllowList;

@DisplayName("AuthorizationPipeline")
class AuthorizationPipelineTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final String API_KEY = "k-0123456789abcdef";

    private static KeyPair keyPair;

    private ApiKeyAllowList apiKeys;
    private BasicAuthAllowList basicUsers;
    private KeySetCacheService keySetCache;
    private AuthMetrics metrics;
    private JwtConfig jwtConfig;
    private CredentialConfig credentialConfig;

    @BeforeAll
    static void setUpKeys() {
        keyPair = TestTokens.rsaKeyPair();
    }

    @BeforeEach
    void setUp() {
        apiKeys = mock(ApiKeyAllowList.class);
        basicUsers = mock(BasicAuthAllowList.class);
        keySetCache = mock(KeySetCacheService.class);
        metrics = mock(AuthMetrics.class);

        credentialConfig = mock(CredentialConfig.class);
        var apiKeyConfig = mock(CredentialConfig.ApiKey.class);
        when(credentialConfig.apiKey()).thenReturn(apiKeyConfig);
        when(apiKeyConfig.header()).thenReturn("x-api-key");

        jwtConfig = mock(JwtConfig.class);
        when(jwtConfig.enabled()).thenReturn(true);
        when(jwtConfig.audiences()).thenReturn(Optional.of(Set.of("orders")));
        when(jwtConfig.issuers()).thenReturn(Optional.of(Set.of(TestTokens.ISSUER)));
        when(jwtConfig.validateNotBefore()).thenReturn(true);
        when(jwtConfig.clockSkew()).thenReturn(Duration.ofSeconds(30));
        when(jwtConfig.rolesClaim()).thenReturn("roles");

        var jwk = TestTokens.publicJwk(keyPair, TestTokens.KEY_ID, AlgorithmIdentifiers.RSA_USING_SHA256);
        when(keySetCache.snapshot())
                .thenReturn(Uni.createFrom().item(KeySetSnapshot.of(List.of(jwk), Instant.now())));
    }

    private AuthorizationPipeline pipeline() {
        return new AuthorizationPipeline(
                credentialConfig,
                jwtConfig,
                apiKeys,
                basicUsers,
                keySetCache,
                new JwtVerifier(JacksonCustomizer.configure(new ObjectMapper())),
                metrics);
    }

    private static Map<String, List<String>> headers(String name, String value) {
        return Map.of(name, List.of(value));
    }

    private static String basic(String userPass) {
        return "Basic " + Base64.getEncoder().encodeToString(userPass.getBytes(StandardCharsets.UTF_8));
    }

    private static String bearer(List<String> roles) {
        var claims = TestTokens.claims(Instant.now().plusSeconds(3600), Map.of("roles", roles));
        claims.setAudience("orders");
        return "Bearer " + TestTokens.sign(claims, keyPair, TestTokens.KEY_ID);
    }

    private static AuthError rejection(AuthDecision<?> decision) {
        return assertInstanceOf(AuthDecision.Rejected.class, decision).error();
    }

    private static Object acceptedValue(AuthDecision<?> decision) {
        return assertInstanceOf(AuthDecision.Accepted.class, decision).value();
    }

    @Nested
    @DisplayName("API key")
    class ApiKeyTests {

        @Test
        @DisplayName("should accept an allow-listed key")
        void shouldAcceptAllowListedKey() {
            when(apiKeys.isAllowed(API_KEY)).thenReturn(Uni.createFrom().item(true));

            var decision = pipeline().authenticateApiKey(headers("x-api-key", API_KEY)).await().atMost(WAIT);

            var principal = assertInstanceOf(ApiKeyPrincipal.class, acceptedValue(decision));
            assertEquals(API_KEY, principal.key());
            verify(metrics).recordAccepted(CredentialScheme.API_KEY);
        }

        @Test
        @DisplayName("should find the header case-insensitively")
        void shouldMatchHeaderCaseInsensitively() {
            when(apiKeys.isAllowed(API_KEY)).thenReturn(Uni.createFrom().item(true));

            var decision = pipeline().authenticateApiKey(headers("X-API-Key", API_KEY)).await().atMost(WAIT);

            assertTrue(decision.isAccepted());
        }

        @Test
        @DisplayName("should reject a missing key with 401 MISSING_CREDENTIAL")
        void shouldRejectMissingKey() {
            var decision = pipeline().authenticateApiKey(Map.of()).await().atMost(WAIT);

            var error = rejection(decision);
            assertEquals(AuthErrorKind.MISSING_CREDENTIAL, error.kind());
            assertEquals(401, error.statusCode());
            verify(apiKeys, never()).isAllowed(any());
            verify(metrics).recordRejected(CredentialScheme.API_KEY, AuthErrorKind.MISSING_CREDENTIAL);
        }

        @Test
        @DisplayName("should reject a key not on the allow-list with 403 INVALID_CREDENTIAL")
        void shouldRejectUnknownKey() {
            when(apiKeys.isAllowed("unknown")).thenReturn(Uni.createFrom().item(false));

            var error = rejection(
                    pipeline().authenticateApiKey(headers("x-api-key", "unknown")).await().atMost(WAIT));

            assertEquals(AuthErrorKind.INVALID_CREDENTIAL, error.kind());
            assertEquals(403, error.statusCode());
        }

        @Test
        @DisplayName("should report an allow-list failure as INTERNAL")
        void shouldReportOracleFailure() {
            when(apiKeys.isAllowed(API_KEY))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("store down")));

            var error = rejection(
                    pipeline().authenticateApiKey(headers("x-api-key", API_KEY)).await().atMost(WAIT));

            assertEquals(AuthErrorKind.INTERNAL, error.kind());
        }

        @Test
        @DisplayName("optional mode should accept a request without a key")
        void optionalShouldAcceptAbsentKey() {
            var decision = pipeline().authenticateApiKeyOptional(Map.of()).await().atMost(WAIT);

            assertEquals(Optional.empty(), acceptedValue(decision));
            verify(apiKeys, never()).isAllowed(any());
        }

        @Test
        @DisplayName("optional mode should still reject a present but unknown key")
        void optionalShouldRejectUnknownKey() {
            when(apiKeys.isAllowed("unknown")).thenReturn(Uni.createFrom().item(false));

            var decision = pipeline()
                    .authenticateApiKeyOptional(headers("x-api-key", "unknown"))
                    .await()
                    .atMost(WAIT);

            assertEquals(AuthErrorKind.INVALID_CREDENTIAL, rejection(decision).kind());
        }
    }

    @Nested
    @DisplayName("Basic auth")
    class BasicAuthTests {

        @Test
        @DisplayName("should accept a configured user")
        void shouldAcceptUser() {
            when(basicUsers.authenticate("alice", Optional.of("s3cret"))).thenReturn(Uni.createFrom().item(true));

            var decision = pipeline()
                    .authenticateBasic(headers("Authorization", basic("alice:s3cret")))
                    .await()
                    .atMost(WAIT);

            var principal = assertInstanceOf(BasicAuthPrincipal.class, acceptedValue(decision));
            assertEquals("alice", principal.name());
        }

        @Test
        @DisplayName("should reject a wrong password with INVALID_CREDENTIAL")
        void shouldRejectWrongPassword() {
            when(basicUsers.authenticate("alice", Optional.of("wrong"))).thenReturn(Uni.createFrom().item(false));

            var error = rejection(pipeline()
                    .authenticateBasic(headers("authorization", basic("alice:wrong")))
                    .await()
                    .atMost(WAIT));

            assertEquals(AuthErrorKind.INVALID_CREDENTIAL, error.kind());
        }

        @Test
        @DisplayName("should reject invalid base64 with DECODE_FAILURE before the allow-list")
        void shouldRejectInvalidBase64() {
            var error = rejection(pipeline()
                    .authenticateBasic(headers("Authorization", "Basic %%%"))
                    .await()
                    .atMost(WAIT));

            assertEquals(AuthErrorKind.DECODE_FAILURE, error.kind());
            verify(basicUsers, never()).authenticate(any(), any());
        }

        @Test
        @DisplayName("optional mode should accept a request without Authorization")
        void optionalShouldAcceptAbsentHeader() {
            var decision = pipeline().authenticateBasicOptional(Map.of()).await().atMost(WAIT);

            assertEquals(Optional.empty(), acceptedValue(decision));
        }
    }

    @Nested
    @DisplayName("Bearer token")
    class BearerTests {

        @Test
        @DisplayName("should accept a valid token")
        void shouldAcceptValidToken() {
            var decision = pipeline()
                    .authenticateBearer(headers("Authorization", bearer(List.of("user"))), StandardClaims.class)
                    .await()
                    .atMost(WAIT);

            var principal = assertInstanceOf(BearerPrincipal.class, acceptedValue(decision));
            assertEquals(TestTokens.SUBJECT, principal.name());
            verify(metrics).recordAccepted(CredentialScheme.BEARER);
        }

        @Test
        @DisplayName("should accept a token carrying any required role")
        void shouldAcceptRequiredRole() {
            var decision = pipeline()
                    .authenticateBearer(
                            headers("Authorization", bearer(List.of("user", "admin"))),
                            StandardClaims.class,
                            List.of("admin"))
                    .await()
                    .atMost(WAIT);

            assertTrue(decision.isAccepted());
        }

        @Test
        @DisplayName("should reject a token lacking the required role with INSUFFICIENT_ROLE")
        void shouldRejectMissingRole() {
            var error = rejection(pipeline()
                    .authenticateBearer(
                            headers("Authorization", bearer(List.of("user"))), StandardClaims.class, List.of("admin"))
                    .await()
                    .atMost(WAIT));

            assertEquals(AuthErrorKind.INSUFFICIENT_ROLE, error.kind());
            verify(metrics).recordRejected(CredentialScheme.BEARER, AuthErrorKind.INSUFFICIENT_ROLE);
        }

        @Test
        @DisplayName("should reject a Basic header as MALFORMED_CREDENTIAL")
        void shouldRejectBasicHeader() {
            var error = rejection(pipeline()
                    .authenticateBearer(headers("Authorization", basic("a:b")), StandardClaims.class)
                    .await()
                    .atMost(WAIT));

            assertEquals(AuthErrorKind.MALFORMED_CREDENTIAL, error.kind());
            verify(keySetCache, never()).snapshot();
        }

        @Test
        @DisplayName("should report an unavailable key set as INTERNAL")
        void shouldReportUnavailableKeySet() {
            when(keySetCache.snapshot())
                    .thenReturn(Uni.createFrom().failure(new KeySetUnavailableException("not loaded")));

            var error = rejection(pipeline()
                    .authenticateBearer(headers("Authorization", bearer(List.of())), StandardClaims.class)
                    .await()
                    .atMost(WAIT));

            assertEquals(AuthErrorKind.INTERNAL, error.kind());
            assertEquals(500, error.statusCode());
        }

        @Test
        @DisplayName("should report disabled verification as INTERNAL")
        void shouldReportDisabledVerification() {
            when(jwtConfig.enabled()).thenReturn(false);

            var error = rejection(pipeline()
                    .authenticateBearer(headers("Authorization", bearer(List.of())), StandardClaims.class)
                    .await()
                    .atMost(WAIT));

            assertEquals(AuthErrorKind.INTERNAL, error.kind());
            verify(keySetCache, never()).snapshot();
        }

        @Test
        @DisplayName("optional mode should accept a request without Authorization")
        void optionalShouldAcceptAbsentHeader() {
            var decision = pipeline()
                    .authenticateBearerOptional(Map.of(), StandardClaims.class, List.of())
                    .await()
                    .atMost(WAIT);

            assertEquals(Optional.empty(), acceptedValue(decision));
        }

        @Test
        @DisplayName("optional mode should wrap an accepted principal")
        void optionalShouldWrapPrincipal() {
            var decision = pipeline()
                    .authenticateBearerOptional(
                            headers("Authorization", bearer(List.of())), StandardClaims.class, List.of())
                    .await()
                    .atMost(WAIT);

            var value = (Optional<?>) acceptedValue(decision);
            assertInstanceOf(Principal.class, value.orElseThrow());
        }
    }

    @Nested
    @DisplayName("header()")
    class HeaderLookupTests {

        @Test
        @DisplayName("should return the first value")
        void shouldReturnFirstValue() {
            assertEquals("one", AuthorizationPipeline.header(Map.of("X-Test", List.of("one", "two")), "x-test"));
        }

        @Test
        @DisplayName("should return null for absent or empty headers")
        void shouldReturnNullWhenAbsent() {
            assertNull(AuthorizationPipeline.header(Map.of(), "x-test"));
            assertNull(AuthorizationPipeline.header(Map.of("x-test", List.of()), "x-test"));
            assertNull(AuthorizationPipeline.header(null, "x-test"));
        }
    }
}
