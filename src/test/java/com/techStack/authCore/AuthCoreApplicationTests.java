package com.techStack.authCore;

import com.techStack.authCore.models.TokenPair;
import com.techStack.authCore.repository.CounterStore;
import com.techStack.authCore.repository.TokenRevocationStore;
import com.techStack.authCore.service.authentication.AuthSessionManager;
import com.techStack.authCore.service.store.InMemoryCounterStore;
import com.techStack.authCore.service.store.InMemoryCredentialStore;
import com.techStack.authCore.service.store.InMemoryTokenRevocationStore;
import com.techStack.authCore.service.token.KeyRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class AuthCoreApplicationTests {

    @Autowired
    private AuthSessionManager sessionManager;

    @Autowired
    private InMemoryCredentialStore credentialStore;

    @Autowired
    private KeyRegistry keyRegistry;

    @Autowired
    private CounterStore counterStore;

    @Autowired
    private TokenRevocationStore revocationStore;

    @Test
    void contextLoads_withInMemoryStoresAndConfiguredKeys() {
        assertThat(counterStore).isInstanceOf(InMemoryCounterStore.class);
        assertThat(revocationStore).isInstanceOf(InMemoryTokenRevocationStore.class);
        assertThat(keyRegistry.active().getKeyId()).isEqualTo("k-test-2");
        assertThat(keyRegistry.verifiable()).hasSize(2);
    }

    @Test
    void loginAndRefresh_shouldWorkEndToEnd() {
        credentialStore.register("bob@example.com", "s3cret-passphrase", Set.of("USER"));

        TokenPair pair = sessionManager.login("bob@example.com", "s3cret-passphrase", "127.0.0.1")
                .block(Duration.ofSeconds(5));
        assertThat(pair).isNotNull();

        StepVerifier.create(sessionManager.refresh(pair.refreshToken()))
                .assertNext(rotated -> assertThat(rotated.chainId()).isEqualTo(pair.chainId()))
                .verifyComplete();
    }
}
