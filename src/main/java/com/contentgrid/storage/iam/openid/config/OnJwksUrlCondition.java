package com.contentgrid.storage.iam.openid.config;

import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when a JWKSet URL is configured, either through properties or through the override variable.
 */
class OnJwksUrlCondition extends SpringBootCondition {

    static final String JWKS_URL_PROPERTY = OpenIdJwtProperties.PREFIX + ".jwks-url";

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        var environment = context.getEnvironment();
        var message = ConditionMessage.forCondition("OpenID JWKSet URL");
        return JwksUrlResolver.resolve(environment.getProperty(JWKS_URL_PROPERTY), environment::getProperty)
                .map(url -> ConditionOutcome.match(message.found("url").items(url)))
                .orElseGet(() -> ConditionOutcome.noMatch(message.didNotFind("url").atAll()));
    }
}
