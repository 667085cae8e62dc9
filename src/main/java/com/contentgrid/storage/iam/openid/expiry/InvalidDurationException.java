package com.contentgrid.storage.iam.openid.expiry;

import com.contentgrid.storage.iam.openid.OpenIdException;

/**
 * A requested session duration, or the expiry claim it is reconciled with, is unusable.
 */
public class InvalidDurationException extends OpenIdException {

    public InvalidDurationException(String message) {
        super(message);
    }

    public InvalidDurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
