package com.contentgrid.storage.iam.openid.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.contentgrid.storage.iam.openid.OpenIdJwtValidator;
import com.contentgrid.storage.iam.openid.jwks.JwksConfigurationException;
import com.contentgrid.storage.iam.openid.jwks.JwksKeyStore;
import com.contentgrid.storage.iam.openid.jwks.JwksStatusException;
import com.contentgrid.storage.iam.openid.jwks.PublicKeyStore;
import com.contentgrid.storage.iam.openid.test.security.InMemoryPublicKeyStore;
import com.contentgrid.storage.iam.openid.test.security.TestSigningKey;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.test.util.ReflectionTestUtils;

class OpenIdJwtAutoConfigurationTest {

    private static final WireMockServer wireMockServer = new WireMockServer(
            new WireMockConfiguration().dynamicPort());

    private static final TestSigningKey SIGNING_KEY = TestSigningKey.rsa();

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(OpenIdJwtAutoConfiguration.class));

    @BeforeAll
    static void startWiremock() {
        wireMockServer.start();
        wireMockServer.stubFor(WireMock.get("/idp/jwks")
                .willReturn(WireMock.okJson(SIGNING_KEY.toPublicJWKSet().toString())));
        wireMockServer.stubFor(WireMock.get("/down/jwks")
                .willReturn(WireMock.serverError()));
    }

    @AfterAll
    static void shutdownWiremock() {
        wireMockServer.stop();
    }

    @Test
    void disabledWithoutJwksUrl() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).doesNotHaveBean(OpenIdJwtValidator.class);
            assertThat(context).doesNotHaveBean(PublicKeyStore.class);
        });
    }

    @Test
    void configuredFromProperties() {
        contextRunner
                .withPropertyValues("contentgrid.storage.iam.openid.jwks-url=https://idp.example/jwks")
                .run(context -> {
                    assertThat(context).hasSingleBean(OpenIdJwtValidator.class);
                    assertThat(context).getBean(JwksKeyStore.class).satisfies(keyStore -> {
                        assertThat(keyStore.getEndpoint().getUri()).isEqualTo(URI.create("https://idp.example/jwks"));
                        // keys are loaded on first use
                        assertThat(keyStore.size()).isZero();
                    });
                    assertThat(context.getBean(OpenIdJwtValidator.class).getKeyStore())
                            .isSameAs(context.getBean(PublicKeyStore.class));
                });
    }

    @Test
    void appliesConfiguredTimeoutsToTransport() {
        contextRunner
                .withPropertyValues(
                        "contentgrid.storage.iam.openid.jwks-url=https://idp.example/jwks",
                        "contentgrid.storage.iam.openid.connect-timeout=2s",
                        "contentgrid.storage.iam.openid.read-timeout=1m"
                )
                .run(context -> assertThat(context).getBean(JwksKeyStore.class).satisfies(keyStore -> {
                    var transport = keyStore.getEndpoint().getTransport();
                    assertThat(transport).isInstanceOf(SimpleClientHttpRequestFactory.class);
                    assertThat(ReflectionTestUtils.getField(transport, "connectTimeout")).isEqualTo(2_000);
                    assertThat(ReflectionTestUtils.getField(transport, "readTimeout")).isEqualTo(60_000);
                }));
    }

    @Test
    void overrideVariableTakesPrecedence() {
        contextRunner
                .withPropertyValues(
                        "contentgrid.storage.iam.openid.jwks-url=https://idp.example/jwks",
                        JwksUrlResolver.JWKS_URL_VARIABLE + "=https://override.example/keys"
                )
                .run(context -> assertThat(context).getBean(JwksKeyStore.class)
                        .satisfies(keyStore -> assertThat(keyStore.getEndpoint().getUri())
                                .isEqualTo(URI.create("https://override.example/keys"))));
    }

    @Test
    void overrideVariableAloneEnables() {
        contextRunner
                .withPropertyValues(JwksUrlResolver.JWKS_URL_VARIABLE + "=https://override.example/keys")
                .run(context -> assertThat(context).hasSingleBean(OpenIdJwtValidator.class));
    }

    @Test
    void invalidUrlFailsStartup() {
        contextRunner
                .withPropertyValues("contentgrid.storage.iam.openid.jwks-url=ftp://idp.example/jwks")
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(JwksConfigurationException.class));
    }

    @Test
    void prefetchLoadsKeysOnStartup() {
        contextRunner
                .withPropertyValues(
                        "contentgrid.storage.iam.openid.jwks-url=" + wireMockServer.url("idp/jwks"),
                        "contentgrid.storage.iam.openid.prefetch=true"
                )
                .run(context -> assertThat(context).getBean(JwksKeyStore.class)
                        .satisfies(keyStore -> assertThat(keyStore.keyIds()).containsExactly(SIGNING_KEY.getKeyId())));
    }

    @Test
    void prefetchFailureFailsStartup() {
        contextRunner
                .withPropertyValues(
                        "contentgrid.storage.iam.openid.jwks-url=" + wireMockServer.url("down/jwks"),
                        "contentgrid.storage.iam.openid.prefetch=true"
                )
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(JwksStatusException.class));
    }

    @Test
    void usesProvidedKeyStoreAndClock() {
        var now = Instant.ofEpochSecond(1_700_000_000L);
        var keyStore = new InMemoryPublicKeyStore().withKey(SIGNING_KEY);

        contextRunner
                .withPropertyValues(
                        "contentgrid.storage.iam.openid.jwks-url=https://idp.example/jwks",
                        "contentgrid.storage.iam.openid.clock-skew=30s"
                )
                .withBean(PublicKeyStore.class, () -> keyStore)
                .withBean(Clock.class, () -> Clock.fixed(now, ZoneOffset.UTC))
                .run(context -> {
                    assertThat(context).doesNotHaveBean(JwksKeyStore.class);
                    var validator = context.getBean(OpenIdJwtValidator.class);
                    assertThat(validator.getKeyStore()).isSameAs(keyStore);

                    // expired 10 seconds ago, within the configured skew
                    var token = SIGNING_KEY.sign(Map.of("sub", "alice", "exp", now.getEpochSecond() - 10));
                    assertThat(validator.validate(token, "").getClaims().toMap()).containsEntry("sub", "alice");
                });
    }
}
