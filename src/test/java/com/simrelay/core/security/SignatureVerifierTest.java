package com.simrelay.core.security;

import com.simrelay.core.error.ForbiddenException;
import com.simrelay.core.error.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class SignatureVerifierTest {

    private SignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        var properties = new RelayProperties();
        properties.setApiKey("key");
        verifier = new SignatureVerifier(properties);
    }

    @Test
    @DisplayName("sign matches the published HMAC-SHA256 example in lower-case hex")
    void knownVector() {
        byte[] body = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);
        assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                SignatureVerifier.sign("key", body));
    }

    @Test
    @DisplayName("verify accepts the exact digest")
    void acceptsExactDigest() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        assertDoesNotThrow(() -> verifier.verify(body, SignatureVerifier.sign("key", body)));
    }

    @Test
    @DisplayName("upper-case hex is not the accepted encoding")
    void rejectsUpperCase() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String upper = SignatureVerifier.sign("key", body).toUpperCase();
        assertThrows(ForbiddenException.class, () -> verifier.verify(body, upper));
    }

    @Test
    @DisplayName("blank signature is Unauthorized")
    void blankSignature() {
        assertThrows(UnauthorizedException.class, () -> verifier.verify(new byte[0], "  "));
    }

    @Test
    @DisplayName("empty key cannot sign")
    void emptyKey() {
        assertThrows(IllegalStateException.class, () -> SignatureVerifier.sign("", new byte[0]));
    }
}
