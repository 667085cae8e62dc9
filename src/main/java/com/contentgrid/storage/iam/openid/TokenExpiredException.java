package com.contentgrid.storage.iam.openid;

public class TokenExpiredException extends InvalidTokenException {

    public TokenExpiredException(String message) {
        super(message);
    }
}
