package com.contentgrid.storage.iam.openid.config;

import java.util.Optional;
import java.util.function.Function;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Determines the effective JWKSet URL from the configured value and an override variable.
 */
@UtilityClass
public class JwksUrlResolver {

    public static final String JWKS_URL_VARIABLE = "CONTENTGRID_STORAGE_IAM_JWKS_URL";

    public static Optional<String> resolve(String configuredUrl) {
        return resolve(configuredUrl, System::getenv);
    }

    /**
     * @param configuredUrl the explicitly configured URL, may be {@code null}
     * @param lookup looks up the value of a variable by name, returning {@code null} when it is not set
     * @return the URL to fetch keys from; empty when JWT authentication is not configured
     */
    public static Optional<String> resolve(String configuredUrl, @NonNull Function<String, String> lookup) {
        var override = lookup.apply(JWKS_URL_VARIABLE);
        // a variable that is set, even to an empty value, takes precedence
        var url = override != null ? override : configuredUrl;
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(url.trim());
    }
}
