package com.contentgrid.storage.iam.openid.jwks;

import java.security.PublicKey;
import java.util.Optional;

/**
 * The currently known public keys of an identity provider, indexed by key id.
 */
public interface PublicKeyStore {

    /**
     * @param kid the key id from a token header
     * @return the key, or empty when the key id is not (yet) known
     */
    Optional<PublicKey> lookup(String kid);

    /**
     * Replaces the known keys with the keys currently published by the provider.
     * <p>
     * When the refresh fails, the previously known keys remain available.
     */
    void refresh() throws JwksException;
}
