package warden.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import warden.core.model.auth.AuthDecision;
import warden.core.model.auth.RawCredential.ApiKeyValue;
import warden.core.model.auth.RawCredential.BasicAuthPair;
import warden.core.model.auth.RawCredential.BearerTokenValue;
import warden.core.model.error.AuthErrorKind;

@DisplayName("CredentialExtractor")
class CredentialExtractorTest {

    private static String basic(String userPass) {
        return "Basic " + Base64.getEncoder().encodeToString(userPass.getBytes(StandardCharsets.UTF_8));
    }

    private static <T> T accepted(AuthDecision<T> decision) {
        @SuppressWarnings("unchecked")
        var accepted = (AuthDecision.Accepted<T>) assertInstanceOf(AuthDecision.Accepted.class, decision);
        return accepted.value();
    }

    private static AuthErrorKind rejectedKind(AuthDecision<?> decision) {
        return assertInstanceOf(AuthDecision.Rejected.class, decision).error().kind();
    }

    @Nested
    @DisplayName("apiKey()")
    class ApiKeyTests {

        @Test
        @DisplayName("should accept a printable key")
        void shouldAcceptPrintableKey() {
            ApiKeyValue key = accepted(CredentialExtractor.apiKey("k-1234567890"));

            assertEquals("k-1234567890", key.value());
        }

        @Test
        @DisplayName("should report a missing header")
        void shouldReportMissing() {
            assertEquals(AuthErrorKind.MISSING_CREDENTIAL, rejectedKind(CredentialExtractor.apiKey(null)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"key\u0000", "kéy", "line\nbreak", "\u007f"})
        @DisplayName("should reject non-text values as malformed")
        void shouldRejectNonText(String value) {
            assertEquals(AuthErrorKind.MALFORMED_CREDENTIAL, rejectedKind(CredentialExtractor.apiKey(value)));
        }

        @Test
        @DisplayName("should not reveal the key in toString")
        void shouldMaskKey() {
            ApiKeyValue key = accepted(CredentialExtractor.apiKey("k-1234567890"));

            assertFalse(key.toString().contains("1234567890"));
        }
    }

    @Nested
    @DisplayName("basicAuth()")
    class BasicAuthTests {

        @Test
        @DisplayName("should split username and password")
        void shouldSplitUserPass() {
            BasicAuthPair pair = accepted(CredentialExtractor.basicAuth(basic("alice:s3cret")));

            assertEquals("alice", pair.username());
            assertEquals(Optional.of("s3cret"), pair.password());
        }

        @Test
        @DisplayName("should split on the first colon only")
        void shouldSplitOnFirstColon() {
            BasicAuthPair pair = accepted(CredentialExtractor.basicAuth(basic("alice:pa:ss")));

            assertEquals("alice", pair.username());
            assertEquals(Optional.of("pa:ss"), pair.password());
        }

        @Test
        @DisplayName("should yield an absent password without a colon")
        void shouldYieldAbsentPassword() {
            BasicAuthPair pair = accepted(CredentialExtractor.basicAuth(basic("alice")));

            assertEquals("alice", pair.username());
            assertTrue(pair.password().isEmpty());
        }

        @Test
        @DisplayName("should yield an empty password after a trailing colon")
        void shouldYieldEmptyPassword() {
            BasicAuthPair pair = accepted(CredentialExtractor.basicAuth(basic("alice:")));

            assertEquals(Optional.of(""), pair.password());
        }

        @Test
        @DisplayName("should decode UTF-8 credentials")
        void shouldDecodeUtf8() {
            BasicAuthPair pair = accepted(CredentialExtractor.basicAuth(basic("jürgen:päss")));

            assertEquals("jürgen", pair.username());
        }

        @Test
        @DisplayName("should report a missing header")
        void shouldReportMissing() {
            assertEquals(AuthErrorKind.MISSING_CREDENTIAL, rejectedKind(CredentialExtractor.basicAuth(null)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Bearer abc", "basic YWxpY2U6cw==", "BasicYWxpY2U6cw==", "Basic"})
        @DisplayName("should reject other schemes as malformed")
        void shouldRejectOtherSchemes(String header) {
            var decision = CredentialExtractor.basicAuth(header);

            assertEquals(AuthErrorKind.MALFORMED_CREDENTIAL, rejectedKind(decision));
        }

        @Test
        @DisplayName("should name the expected scheme in the detail")
        void shouldNameExpectedScheme() {
            var error = assertInstanceOf(AuthDecision.Rejected.class, CredentialExtractor.basicAuth("Bearer abc"))
                    .error();

            assertEquals("Authorization header is not Basic", error.detail().orElseThrow());
        }

        @Test
        @DisplayName("should report invalid base64 as a decode failure")
        void shouldReportInvalidBase64() {
            assertEquals(AuthErrorKind.DECODE_FAILURE, rejectedKind(CredentialExtractor.basicAuth("Basic !!not-base64!!")));
        }

        @Test
        @DisplayName("should require base64 padding")
        void shouldRejectUnpaddedBase64() {
            // "user:pa" without its trailing "=="
            var error = assertInstanceOf(AuthDecision.Rejected.class, CredentialExtractor.basicAuth("Basic dXNlcjpwYQ"))
                    .error();

            assertEquals(AuthErrorKind.DECODE_FAILURE, error.kind());
            assertTrue(error.detail().orElseThrow().contains("multiple of 4"));
        }

        @Test
        @DisplayName("should accept padded base64")
        void shouldAcceptPaddedBase64() {
            BasicAuthPair pair = accepted(CredentialExtractor.basicAuth("Basic dXNlcjpwYQ=="));

            assertEquals(new BasicAuthPair("user", Optional.of("pa")), pair);
        }

        @Test
        @DisplayName("should report invalid UTF-8 as a decode failure")
        void shouldReportInvalidUtf8() {
            var header = "Basic " + Base64.getEncoder().encodeToString(new byte[] {(byte) 0xC3, (byte) 0x28, ':', 'x'});

            assertEquals(AuthErrorKind.DECODE_FAILURE, rejectedKind(CredentialExtractor.basicAuth(header)));
        }

        @Test
        @DisplayName("should reject non-text header values as malformed")
        void shouldRejectNonText() {
            assertEquals(
                    AuthErrorKind.MALFORMED_CREDENTIAL, rejectedKind(CredentialExtractor.basicAuth("Basic é")));
        }
    }

    @Nested
    @DisplayName("bearerToken()")
    class BearerTokenTests {

        @Test
        @DisplayName("should yield the token after the scheme")
        void shouldYieldToken() {
            BearerTokenValue token = accepted(CredentialExtractor.bearerToken("Bearer aaa.bbb.ccc"));

            assertEquals("aaa.bbb.ccc", token.value());
        }

        @Test
        @DisplayName("should report a missing header")
        void shouldReportMissing() {
            assertEquals(AuthErrorKind.MISSING_CREDENTIAL, rejectedKind(CredentialExtractor.bearerToken(null)));
        }

        @Test
        @DisplayName("should reject a Basic header as malformed")
        void shouldRejectBasic() {
            assertEquals(
                    AuthErrorKind.MALFORMED_CREDENTIAL, rejectedKind(CredentialExtractor.bearerToken(basic("a:b"))));
        }

        @Test
        @DisplayName("should not decode the token")
        void shouldNotDecode() {
            BearerTokenValue token = accepted(CredentialExtractor.bearerToken("Bearer !!opaque!!"));

            assertEquals("!!opaque!!", token.value());
        }
    }
}
