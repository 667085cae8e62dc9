package com.contentgrid.storage.iam.openid.jwks;

/**
 * The key set could not be retrieved because the transport failed.
 */
public class JwksUnavailableException extends JwksException {

    public JwksUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
