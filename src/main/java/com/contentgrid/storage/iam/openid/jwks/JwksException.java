package com.contentgrid.storage.iam.openid.jwks;

import com.contentgrid.storage.iam.openid.OpenIdException;

/**
 * Failure to configure or load the identity provider's key set.
 */
public abstract class JwksException extends OpenIdException {

    protected JwksException(String message) {
        super(message);
    }

    protected JwksException(String message, Throwable cause) {
        super(message, cause);
    }
}
