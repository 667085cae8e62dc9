package com.contentgrid.storage.iam.openid.config;

import com.contentgrid.storage.iam.openid.OpenIdJwtValidator;
import com.contentgrid.storage.iam.openid.expiry.SessionExpiryPolicy;
import com.contentgrid.storage.iam.openid.jwks.JwksEndpoint;
import com.contentgrid.storage.iam.openid.jwks.JwksException;
import com.contentgrid.storage.iam.openid.jwks.JwksKeyStore;
import com.contentgrid.storage.iam.openid.jwks.PublicKeyStore;
import com.contentgrid.storage.iam.openid.jwks.ResponseCloser;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.core.env.Environment;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@AutoConfiguration
@Conditional(OnJwksUrlCondition.class)
@EnableConfigurationProperties(OpenIdJwtProperties.class)
@Slf4j
public class OpenIdJwtAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    SessionExpiryPolicy sessionExpiryPolicy() {
        return new SessionExpiryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean(PublicKeyStore.class)
    JwksKeyStore openIdJwksKeyStore(
            OpenIdJwtProperties properties,
            Environment environment,
            ObjectProvider<ClientHttpRequestFactory> transport,
            ObjectProvider<ResponseCloser> responseCloser
    ) throws JwksException {
        var url = JwksUrlResolver.resolve(properties.getJwksUrl(), environment::getProperty)
                .orElseThrow(() -> new IllegalStateException("No JWKSet URL configured"));

        var endpoint = JwksEndpoint.configure(url,
                transport.getIfUnique(() -> createTransport(properties)),
                responseCloser.getIfUnique(() -> ResponseCloser.DEFAULT)
        );
        var keyStore = new JwksKeyStore(endpoint);

        if (properties.isPrefetch()) {
            keyStore.refresh();
            log.info("Loaded {} keys from JWKSet {}", keyStore.size(), endpoint.getUri());
        }
        return keyStore;
    }

    @Bean
    @ConditionalOnMissingBean
    OpenIdJwtValidator openIdJwtValidator(
            PublicKeyStore keyStore,
            SessionExpiryPolicy sessionExpiryPolicy,
            ObjectProvider<Clock> clock,
            OpenIdJwtProperties properties
    ) {
        return new OpenIdJwtValidator(keyStore, sessionExpiryPolicy, clock.getIfUnique(Clock::systemUTC),
                properties.getClockSkew());
    }

    private static ClientHttpRequestFactory createTransport(OpenIdJwtProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return requestFactory;
    }
}
