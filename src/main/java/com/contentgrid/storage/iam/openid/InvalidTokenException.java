package com.contentgrid.storage.iam.openid;

/**
 * The presented token can not be accepted.
 */
public abstract class InvalidTokenException extends OpenIdException {

    protected InvalidTokenException(String message) {
        super(message);
    }

    protected InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
