package com.simrelay.core.security;

import com.simrelay.core.error.ForbiddenException;
import com.simrelay.core.error.UnauthorizedException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signing and verification of raw request bodies under the shared API key.
 */
@Service
public class SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);
    private static final String ALGORITHM = "HmacSHA256";

    private final RelayProperties properties;

    public SignatureVerifier(RelayProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void warnOnDefaultKey() {
        if (properties.isDefaultApiKey()) {
            log.warn("API key is set to the default '{}'. Configure simrelay.api-key (API_KEY) before exposing this server.",
                    RelayProperties.DEFAULT_API_KEY);
        }
    }

    /**
     * @throws UnauthorizedException if {@code signature} is absent or blank
     * @throws ForbiddenException    if it does not equal the hex HMAC of {@code body}
     */
    public void verify(byte[] body, String signature) {
        if (signature == null || signature.isBlank()) {
            throw new UnauthorizedException("Missing signature");
        }
        byte[] expected = sign(properties.getApiKey(), body).getBytes(StandardCharsets.US_ASCII);
        byte[] presented = signature.getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, presented)) {
            log.warn("Rejected snapshot upload with invalid signature ({} byte body)", body.length);
            throw new ForbiddenException("Invalid signature");
        }
    }

    /** Lower-case hex HMAC-SHA256 of {@code body} under {@code key}. */
    public static String sign(String key, byte[] body) {
        if (key == null || key.isEmpty()) {
            throw new IllegalStateException("API key must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
