package com.contentgrid.storage.iam.openid;

/**
 * Base type for every failure raised while fetching provider keys or validating an OpenID token.
 * <p>
 * All subtypes are terminal for the call that raised them.
 */
public abstract class OpenIdException extends Exception {

    protected OpenIdException(String message) {
        super(message);
    }

    protected OpenIdException(String message, Throwable cause) {
        super(message, cause);
    }
}
