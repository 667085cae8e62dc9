package com.contentgrid.storage.iam.openid;

public class MalformedTokenException extends InvalidTokenException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
