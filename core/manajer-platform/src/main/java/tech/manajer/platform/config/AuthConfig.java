package tech.manajer.platform.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for token verification.
 */
@ConfigMapping(prefix = "manajer.auth")
public interface AuthConfig {

    /**
     * Development secret; never use it outside a local environment.
     */
    String DEFAULT_SECRET = "your-very-secure-and-long-secret-key-for-development";

    /**
     * HMAC secret used to verify HS256 tokens.
     * Must be at least 32 bytes long.
     */
    @WithDefault(DEFAULT_SECRET)
    String secret();

    /**
     * Expected issuer of accepted tokens.
     */
    @WithDefault("my-manajer-app")
    String issuer();
}
