package com.contentgrid.storage.iam.openid;

import java.util.Collection;

/**
 * The token header names a signature algorithm outside the asymmetric allow-list.
 */
public class UnsupportedAlgorithmException extends InvalidSignatureException {

    public UnsupportedAlgorithmException(Object algorithm, Collection<?> allowed) {
        super("Signing algorithm %s is not allowed; expected one of %s".formatted(algorithm, allowed));
    }
}
