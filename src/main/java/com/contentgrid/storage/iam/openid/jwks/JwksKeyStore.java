package com.contentgrid.storage.iam.openid.jwks;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.AsymmetricJWK;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.util.JSONObjectUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.text.ParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

/**
 * Public keys of an identity provider, loaded on demand from its JWKSet endpoint.
 * <p>
 * Lookups read an immutable snapshot. A refresh builds a complete new snapshot and publishes it in one step, so
 * concurrent lookups see either the old or the new key set. Overlapping refreshes are harmless; the last one to
 * complete wins.
 */
@Slf4j
@RequiredArgsConstructor
public class JwksKeyStore implements PublicKeyStore {

    static final String KEYS_MEMBER = "keys";

    @Getter
    @NonNull
    private final JwksEndpoint endpoint;

    private final AtomicReference<Map<String, PublicKey>> publicKeys = new AtomicReference<>(Map.of());

    @Override
    public Optional<PublicKey> lookup(@NonNull String kid) {
        return Optional.ofNullable(publicKeys.get().get(kid));
    }

    public Set<String> keyIds() {
        return publicKeys.get().keySet();
    }

    public int size() {
        return publicKeys.get().size();
    }

    @Override
    public void refresh() throws JwksException {
        var uri = endpoint.getUri();
        log.debug("Starting refresh of JWKSet {}", uri);

        ClientHttpResponse response;
        try {
            var request = endpoint.getTransport().createRequest(uri, HttpMethod.GET);
            request.getHeaders().setAccept(List.of(MediaType.APPLICATION_JSON));
            response = request.execute();
        } catch (IOException e) {
            log.warn("Failed to refresh JWKSet {}: {}", uri, e.getMessage());
            throw new JwksUnavailableException("Failed to fetch JWKSet from %s".formatted(uri), e);
        }

        try {
            var keys = decode(readBody(response));
            publicKeys.set(keys);
            log.debug("JWKSet {} was refreshed, {} keys available", uri, keys.size());
        } catch (JwksException e) {
            log.warn("Failed to refresh JWKSet {}: {}", uri, e.getMessage());
            throw e;
        } finally {
            endpoint.getResponseCloser().close(response);
        }
    }

    private String readBody(ClientHttpResponse response) throws JwksException {
        var uri = endpoint.getUri();
        try {
            var status = response.getStatusCode();
            if (!status.is2xxSuccessful()) {
                throw new JwksStatusException(uri, status.value(), response.getStatusText());
            }
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new JwksUnavailableException("Failed to read JWKSet from %s".formatted(uri), e);
        }
    }

    /**
     * Decodes a JWKSet document. The document is parsed as a plain JSON object first; every entry of its
     * {@code keys} member is then turned into a JWK and its public key.
     */
    static Map<String, PublicKey> decode(String document) throws JwksParseException {
        Map<String, Object> json;
        Map<String, Object>[] entries;
        try {
            json = JSONObjectUtils.parse(document);
            entries = JSONObjectUtils.getJSONObjectArray(json, KEYS_MEMBER);
        } catch (ParseException e) {
            throw new JwksParseException("Invalid JWKSet document: %s".formatted(e.getMessage()), e);
        }
        if (entries == null) {
            throw new JwksParseException("Invalid JWKSet document: missing '%s' member".formatted(KEYS_MEMBER));
        }

        Map<String, PublicKey> keys = new LinkedHashMap<>();
        for (var entry : entries) {
            var jwk = parseKey(entry);
            keys.put(jwk.getKeyID(), toPublicKey(jwk));
        }
        return Collections.unmodifiableMap(keys);
    }

    private static JWK parseKey(Map<String, Object> entry) throws JwksParseException {
        JWK jwk;
        try {
            jwk = JWK.parse(entry);
        } catch (ParseException e) {
            throw new JwksParseException("Can not parse JWK: %s".formatted(e.getMessage()), e);
        }
        if (jwk.getKeyID() == null) {
            throw new JwksParseException("Unsupported JWK of type %s: no key id".formatted(jwk.getKeyType()));
        }
        return jwk;
    }

    private static PublicKey toPublicKey(JWK jwk) throws JwksParseException {
        if (jwk instanceof AsymmetricJWK asymmetricJWK) {
            try {
                return asymmetricJWK.toPublicKey();
            } catch (JOSEException e) {
                throw new JwksParseException(
                        "Unsupported JWK %s: %s".formatted(jwk.getKeyID(), e.getMessage()), e);
            }
        }
        throw new JwksParseException(
                "Unsupported JWK %s: unsupported key type %s".formatted(jwk.getKeyID(), jwk.getKeyType()));
    }
}
