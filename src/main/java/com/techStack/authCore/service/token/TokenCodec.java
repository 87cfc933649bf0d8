package com.techStack.authCore.service.token;

import com.techStack.authCore.config.TokenProperties;
import com.techStack.authCore.exception.InvalidSignatureException;
import com.techStack.authCore.exception.KeyUnavailableException;
import com.techStack.authCore.exception.MalformedTokenException;
import com.techStack.authCore.exception.TokenExpiredException;
import com.techStack.authCore.models.SigningKey;
import com.techStack.authCore.models.TokenClaims;
import com.techStack.authCore.models.TokenKind;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static com.techStack.authCore.constants.SecurityConstants.CLAIM_CHAIN_ID;
import static com.techStack.authCore.constants.SecurityConstants.CLAIM_KIND;
import static com.techStack.authCore.constants.SecurityConstants.CLAIM_ROLES;
import static com.techStack.authCore.constants.SecurityConstants.SECURITY_MARKER;

/**
 * Signs and verifies compact JWS tokens ({@code header.payload.signature}, HS512).
 * <p>
 * Verification tries every candidate key in the order given, which is active first and then
 * retiring keys. MAC comparison inside jjwt is constant time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenCodec {

    private final TokenProperties tokenProperties;
    private final Clock clock;

    /**
     * Serializes and signs the claims. The header {@code kid} always names {@code key};
     * {@link TokenClaims#keyId()} is not consulted.
     */
    public String issue(TokenClaims claims, SigningKey key) {
        if (key == null || !key.getStatus().isVerifiable()) {
            throw new KeyUnavailableException("Refusing to sign with a missing or revoked key");
        }

        return Jwts.builder()
                .setHeaderParam(JwsHeader.TYPE, JwsHeader.JWT_TYPE)
                .setHeaderParam(JwsHeader.KEY_ID, key.getKeyId())
                .setId(claims.jti())
                .setSubject(claims.subject())
                .setIssuer(tokenProperties.getIssuer())
                .setIssuedAt(Date.from(claims.issuedAt()))
                .setExpiration(Date.from(claims.expiresAt()))
                .claim(CLAIM_ROLES, List.copyOf(new TreeSet<>(claims.roles())))
                .claim(CLAIM_KIND, claims.kind().getValue())
                .claim(CLAIM_CHAIN_ID, claims.chainId())
                .signWith(key.getSecretKey(), SignatureAlgorithm.HS512)
                .compact();
    }

    public TokenClaims verify(String token, List<SigningKey> candidates, TokenKind expectedKind) {
        TokenClaims claims = verify(token, candidates);
        if (claims.kind() != expectedKind) {
            log.warn(SECURITY_MARKER, "Token {} presented as {} but is a {} token",
                    claims.jti(), expectedKind.getValue(), claims.kind().getValue());
            throw new MalformedTokenException("Unexpected token kind");
        }
        return claims;
    }

    public TokenClaims verify(String token, List<SigningKey> candidates) {
        List<SigningKey> usable = candidates == null ? List.of() : candidates.stream()
                .filter(key -> key.getStatus().isVerifiable())
                .toList();
        if (usable.isEmpty()) {
            log.error(SECURITY_MARKER, "Token verification attempted with no verifiable signing key");
            throw new KeyUnavailableException("No verifiable signing key");
        }
        if (StringUtils.isBlank(token)) {
            throw new MalformedTokenException("Token is empty");
        }
        if (StringUtils.countMatches(token, '.') != 2) {
            throw new MalformedTokenException("Token must have three segments");
        }

        for (SigningKey key : usable) {
            try {
                return toClaims(parse(token, key), key);
            } catch (ExpiredJwtException e) {
                log.debug("Token {} signed with key {} expired at {}",
                        e.getClaims().getId(), key.getKeyId(), e.getClaims().getExpiration());
                throw new TokenExpiredException(e);
            } catch (io.jsonwebtoken.security.SecurityException e) {
                log.trace("Token signature does not match key {}", key.getKeyId());
            } catch (ClaimJwtException e) {
                log.debug("Token rejected on claim check: {}", e.getMessage());
                throw new MalformedTokenException("Token claims are invalid", e);
            } catch (JwtException | IllegalArgumentException e) {
                log.debug("Token could not be parsed: {}", e.getMessage());
                throw new MalformedTokenException("Token is malformed", e);
            }
        }

        log.warn(SECURITY_MARKER, "Token signature matched none of the verifiable keys {}",
                usable.stream().map(SigningKey::getKeyId).collect(Collectors.joining(",")));
        throw new InvalidSignatureException();
    }

    private Jws<Claims> parse(String token, SigningKey key) {
        return Jwts.parserBuilder()
                .setSigningKey(key.getSecretKey())
                .requireIssuer(tokenProperties.getIssuer())
                .setAllowedClockSkewSeconds(tokenProperties.getClockSkew().toSeconds())
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token);
    }

    private TokenClaims toClaims(Jws<Claims> jws, SigningKey key) {
        Claims body = jws.getBody();
        String headerKeyId = jws.getHeader().getKeyId();
        if (headerKeyId != null && !headerKeyId.equals(key.getKeyId())) {
            log.debug("Token header names key {} but verified with {}", headerKeyId, key.getKeyId());
        }

        TokenKind kind = TokenKind.fromValue(body.get(CLAIM_KIND, String.class))
                .orElseThrow(() -> new MalformedTokenException("Unknown token kind"));
        String chainId = body.get(CLAIM_CHAIN_ID, String.class);
        if (body.getSubject() == null || body.getId() == null || chainId == null
                || body.getIssuedAt() == null || body.getExpiration() == null) {
            throw new MalformedTokenException("Token is missing required claims");
        }

        try {
            return TokenClaims.builder()
                    .subject(body.getSubject())
                    .roles(readRoles(body))
                    .issuedAt(body.getIssuedAt().toInstant())
                    .expiresAt(body.getExpiration().toInstant())
                    .kind(kind)
                    .jti(body.getId())
                    .keyId(key.getKeyId())
                    .chainId(chainId)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new MalformedTokenException("Token claims are inconsistent", e);
        }
    }

    private Set<String> readRoles(Claims body) {
        Object raw = body.get(CLAIM_ROLES);
        if (raw == null) {
            return Set.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new MalformedTokenException("Roles claim must be a list");
        }
        return list.stream()
                .map(String::valueOf)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
