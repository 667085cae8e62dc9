package com.contentgrid.storage.iam.openid;

public class InvalidSignatureException extends InvalidTokenException {

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
