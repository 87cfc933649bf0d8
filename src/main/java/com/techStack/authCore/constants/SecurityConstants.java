package com.techStack.authCore.constants;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

public final class SecurityConstants {

    private SecurityConstants() {}

    public static final Marker SECURITY_MARKER = MarkerFactory.getMarker("SECURITY");

    // Token
    public static final String TOKEN_TYPE = "Bearer";
    public static final String CLAIM_ROLES = "roles";
    public static final String CLAIM_KIND = "kind";
    public static final String CLAIM_CHAIN_ID = "chainId";
    public static final int MIN_SIGNING_KEY_BYTES = 64;

    // Rate limit scopes
    public static final String SCOPE_LOGIN_IP = "login-ip";
    public static final String SCOPE_LOGIN_IDENTITY = "login-identity";
    public static final String SCOPE_REFRESH = "refresh";

    // Revocation key prefixes
    public static final String SPENT_JTI_PREFIX = "spent-jti:";
    public static final String REVOKED_CHAIN_PREFIX = "revoked-chain:";

    // CSRF
    public static final String CSRF_MAC_ALGORITHM = "HmacSHA256";
    public static final int CSRF_NONCE_BYTES = 32;
}
