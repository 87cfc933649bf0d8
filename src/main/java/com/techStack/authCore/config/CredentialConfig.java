package com.techStack.authCore.config;

import com.techStack.authCore.repository.CredentialStore;
import com.techStack.authCore.service.store.InMemoryCredentialStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Slf4j
@Configuration
public class CredentialConfig {

    @Bean
    @ConditionalOnMissingBean
    public PasswordEncoder passwordEncoder(@Value("${auth.credentials.bcrypt-strength:12}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }

    @Bean
    @ConditionalOnMissingBean(CredentialStore.class)
    public InMemoryCredentialStore inMemoryCredentialStore(PasswordEncoder passwordEncoder) {
        log.warn("No CredentialStore bean provided, falling back to the in-memory store");
        return new InMemoryCredentialStore(passwordEncoder);
    }
}
