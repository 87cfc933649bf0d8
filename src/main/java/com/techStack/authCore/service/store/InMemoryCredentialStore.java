package com.techStack.authCore.service.store;

import com.techStack.authCore.models.Principal;
import com.techStack.authCore.repository.CredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Credential store backed by a map. Used for local runs and tests; production deployments
 * provide their own {@link CredentialStore} bean.
 */
@Slf4j
public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, Principal> principals = new ConcurrentHashMap<>();
    private final PasswordEncoder passwordEncoder;
    private final String decoyHash;

    public InMemoryCredentialStore(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.decoyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public Principal register(String identity, String rawSecret, Set<String> roles) {
        if (StringUtils.isBlank(identity) || StringUtils.isBlank(rawSecret)) {
            throw new IllegalArgumentException("identity and secret must not be blank");
        }
        Principal principal = Principal.builder()
                .id(UUID.randomUUID().toString())
                .identity(normalize(identity))
                .passwordHash(passwordEncoder.encode(rawSecret))
                .roles(roles)
                .build();
        principals.put(principal.identity(), principal);
        log.debug("Registered principal {}", principal.id());
        return principal;
    }

    @Override
    public Mono<Principal> findByIdentity(String identity) {
        return Mono.justOrEmpty(principals.get(normalize(identity)));
    }

    @Override
    public Mono<Boolean> compareSecret(String passwordHash, String candidate) {
        return Mono.fromCallable(() -> candidate != null && passwordEncoder.matches(candidate, passwordHash))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public String decoyHash() {
        return decoyHash;
    }

    private static String normalize(String identity) {
        return identity == null ? "" : identity.trim().toLowerCase(Locale.ROOT);
    }
}
