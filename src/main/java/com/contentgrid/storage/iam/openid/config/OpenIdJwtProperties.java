package com.contentgrid.storage.iam.openid.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(OpenIdJwtProperties.PREFIX)
public class OpenIdJwtProperties {

    public static final String PREFIX = "contentgrid.storage.iam.openid";

    /**
     * URL of the identity provider's JWKSet. Overridden by {@value JwksUrlResolver#JWKS_URL_VARIABLE}.
     */
    private String jwksUrl;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    /**
     * Tolerance applied when checking the exp, nbf and iat claims.
     */
    private Duration clockSkew = Duration.ZERO;

    /**
     * Load the JWKSet once on startup instead of on first use.
     */
    private boolean prefetch = false;
}
