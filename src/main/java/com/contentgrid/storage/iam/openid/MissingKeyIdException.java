package com.contentgrid.storage.iam.openid;

public class MissingKeyIdException extends InvalidTokenException {

    public MissingKeyIdException(Object kid) {
        super("Invalid kid value %s".formatted(kid));
    }
}
