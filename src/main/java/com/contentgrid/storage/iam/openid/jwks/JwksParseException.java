package com.contentgrid.storage.iam.openid.jwks;

public class JwksParseException extends JwksException {

    public JwksParseException(String message) {
        super(message);
    }

    public JwksParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
