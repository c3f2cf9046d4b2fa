package com.artifactintegrity.config;

import com.artifactintegrity.service.KeyMaterialService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;

/**
 * Infrastructure beans for signing: time source, randomness and environment access.
 * Tests replace these with fixed or mocked instances.
 */
@Configuration
public class SigningConfig {

    /**
     * Clock used for sidecar timestamps (Unix seconds, UTC).
     */
    @Bean
    public Clock signingClock() {
        return Clock.systemUTC();
    }

    /**
     * Strong random source for generated keys.
     */
    @Bean
    public SecureRandom secureRandom() throws NoSuchAlgorithmException {
        return SecureRandom.getInstanceStrong();
    }

    /**
     * Process environment lookup for {@code --key-env} key sources.
     */
    @Bean
    public KeyMaterialService.EnvironmentLookup environmentLookup() {
        return System::getenv;
    }
}
