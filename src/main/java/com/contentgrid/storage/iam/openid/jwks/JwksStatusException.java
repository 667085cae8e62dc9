package com.contentgrid.storage.iam.openid.jwks;

import java.net.URI;
import lombok.Getter;

/**
 * The key set endpoint answered with a non-success HTTP status.
 */
@Getter
public class JwksStatusException extends JwksException {

    private final int statusCode;

    public JwksStatusException(URI uri, int statusCode, String statusText) {
        super("Fetching JWKSet from %s failed: %d %s".formatted(uri, statusCode, statusText).trim());
        this.statusCode = statusCode;
    }
}
