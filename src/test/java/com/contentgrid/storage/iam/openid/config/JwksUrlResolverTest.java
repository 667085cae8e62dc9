package com.contentgrid.storage.iam.openid.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class JwksUrlResolverTest {

    @Test
    void usesConfiguredUrlWithoutOverride() {
        assertThat(JwksUrlResolver.resolve("https://idp.example/jwks", Map.<String, String>of()::get))
                .hasValue("https://idp.example/jwks");
    }

    @Test
    void overrideTakesPrecedence() {
        var variables = Map.of(JwksUrlResolver.JWKS_URL_VARIABLE, "https://other-idp.example/keys");

        assertThat(JwksUrlResolver.resolve("https://idp.example/jwks", variables::get))
                .hasValue("https://other-idp.example/keys");
        assertThat(JwksUrlResolver.resolve(null, variables::get))
                .hasValue("https://other-idp.example/keys");
    }

    @Test
    void emptyOverrideDisables() {
        var variables = Map.of(JwksUrlResolver.JWKS_URL_VARIABLE, "");

        assertThat(JwksUrlResolver.resolve("https://idp.example/jwks", variables::get)).isEmpty();
    }

    @Test
    void emptyWhenNothingConfigured() {
        assertThat(JwksUrlResolver.resolve(null, Map.<String, String>of()::get)).isEmpty();
        assertThat(JwksUrlResolver.resolve("  ", Map.<String, String>of()::get)).isEmpty();
    }
}
