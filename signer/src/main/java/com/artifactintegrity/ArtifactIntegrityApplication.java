package com.artifactintegrity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main Spring Boot application class for the artifact integrity signer.
 *
 * Runs a single command (sign or verify) and exits with the code the command reports:
 * - HMAC-SHA256 tags over application packages (digest-then-MAC)
 * - HMAC-SHA256 tags over configuration files (direct MAC)
 * - Bare hex or structured JSON signature sidecars
 */
@SpringBootApplication
public class ArtifactIntegrityApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ArtifactIntegrityApplication.class, args)));
    }
}
