package com.contentgrid.storage.iam.openid.jwks;

public class JwksConfigurationException extends JwksException {

    public JwksConfigurationException(String message) {
        super(message);
    }

    public JwksConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
