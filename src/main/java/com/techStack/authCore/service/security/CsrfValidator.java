package com.techStack.authCore.service.security;

import com.techStack.authCore.config.CsrfProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

import static com.techStack.authCore.constants.SecurityConstants.CSRF_MAC_ALGORITHM;
import static com.techStack.authCore.constants.SecurityConstants.CSRF_NONCE_BYTES;
import static com.techStack.authCore.constants.SecurityConstants.SECURITY_MARKER;

/**
 * Stateless double-submit CSRF tokens. A token is {@code nonce.expiresAt.mac}, where the MAC binds
 * the nonce and expiry to the session id under a server secret, so verification needs no lookup.
 */
@Slf4j
@Component
public class CsrfValidator {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec macKey;
    private final Duration tokenTtl;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public CsrfValidator(CsrfProperties csrfProperties, SecureRandom secureRandom, Clock clock) {
        if (StringUtils.isBlank(csrfProperties.getSecret())) {
            throw new IllegalArgumentException("auth.csrf.secret must not be blank");
        }
        this.macKey = new SecretKeySpec(csrfProperties.getSecret().getBytes(StandardCharsets.UTF_8), CSRF_MAC_ALGORITHM);
        this.tokenTtl = csrfProperties.getTokenTtl();
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    public String issue(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        byte[] nonce = new byte[CSRF_NONCE_BYTES];
        secureRandom.nextBytes(nonce);
        String encodedNonce = ENCODER.encodeToString(nonce);
        long expiresAt = clock.instant().plus(tokenTtl).getEpochSecond();
        return encodedNonce + "." + expiresAt + "." + ENCODER.encodeToString(mac(sessionId, encodedNonce, expiresAt));
    }

    public boolean verify(String sessionId, String suppliedToken) {
        if (StringUtils.isAnyBlank(sessionId, suppliedToken)) {
            return false;
        }
        String[] parts = suppliedToken.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty()) {
            log.debug("CSRF token rejected: wrong shape");
            return false;
        }

        long expiresAt;
        byte[] presentedMac;
        try {
            expiresAt = Long.parseLong(parts[1]);
            presentedMac = DECODER.decode(parts[2]);
        } catch (IllegalArgumentException e) {
            log.debug("CSRF token rejected: undecodable ({})", e.getMessage());
            return false;
        }

        if (!MessageDigest.isEqual(mac(sessionId, parts[0], expiresAt), presentedMac)) {
            log.warn(SECURITY_MARKER, "CSRF token rejected: MAC does not match the session");
            return false;
        }
        if (clock.instant().getEpochSecond() >= expiresAt) {
            log.debug("CSRF token rejected: expired at {}", expiresAt);
            return false;
        }
        return true;
    }

    /**
     * Double-submit check: the cookie copy and the header copy must be identical and valid.
     */
    public boolean verify(String sessionId, String cookieToken, String headerToken) {
        if (cookieToken == null || headerToken == null) {
            return false;
        }
        boolean same = MessageDigest.isEqual(
                cookieToken.getBytes(StandardCharsets.UTF_8),
                headerToken.getBytes(StandardCharsets.UTF_8));
        if (!same) {
            log.warn(SECURITY_MARKER, "CSRF cookie and header tokens differ");
            return false;
        }
        return verify(sessionId, headerToken);
    }

    private byte[] mac(String sessionId, String nonce, long expiresAt) {
        try {
            Mac mac = Mac.getInstance(CSRF_MAC_ALGORITHM);
            mac.init(macKey);
            String message = sessionId.length() + ":" + sessionId + "|" + nonce + "|" + expiresAt;
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is unavailable", e);
        }
    }
}
