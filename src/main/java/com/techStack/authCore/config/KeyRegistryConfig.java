package com.techStack.authCore.config;

import com.techStack.authCore.exception.KeyUnavailableException;
import com.techStack.authCore.models.SigningKey;
import com.techStack.authCore.service.token.KeyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Builds the {@link KeyRegistry} from {@code auth.token.signing-keys}. A configuration without a
 * usable key stops the application at startup.
 */
@Slf4j
@Configuration
public class KeyRegistryConfig {

    @Bean
    public KeyRegistry keyRegistry(TokenProperties tokenProperties, Clock clock) {
        List<TokenProperties.SigningKeyDefinition> definitions = tokenProperties.getSigningKeys();
        if (definitions == null || definitions.isEmpty()) {
            throw new KeyUnavailableException("auth.token.signing-keys must define at least one key");
        }

        String activeId = tokenProperties.getActiveKeyId() != null
                ? tokenProperties.getActiveKeyId()
                : definitions.get(definitions.size() - 1).getId();
        Instant now = clock.instant();

        SigningKey active = null;
        List<SigningKey> retiring = new ArrayList<>();
        // later entries are newer, retiring list is newest first
        for (int i = definitions.size() - 1; i >= 0; i--) {
            TokenProperties.SigningKeyDefinition definition = definitions.get(i);
            SigningKey key = SigningKey.active(definition.getId(), decodeSecret(definition.getSecret()), now);
            if (definition.getId().equals(activeId)) {
                active = key;
            } else {
                retiring.add(key.retire(now));
            }
        }
        if (active == null) {
            throw new KeyUnavailableException("auth.token.active-key-id " + activeId + " is not a configured key");
        }
        return new KeyRegistry(active, retiring, clock);
    }

    static byte[] decodeSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Signing key secret must not be blank");
        }
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException e) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }
}
