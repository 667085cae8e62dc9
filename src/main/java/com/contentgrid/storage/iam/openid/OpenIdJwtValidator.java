package com.contentgrid.storage.iam.openid;

import com.contentgrid.storage.iam.openid.claims.ClaimSet;
import com.contentgrid.storage.iam.openid.claims.ClaimValue.NumberValue;
import com.contentgrid.storage.iam.openid.expiry.InvalidDurationException;
import com.contentgrid.storage.iam.openid.expiry.SessionExpiryPolicy;
import com.contentgrid.storage.iam.openid.jwks.PublicKeyStore;
import com.nimbusds.jose.HeaderParameterNames;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObject;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.proc.JWSVerifierFactory;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jose.util.JSONObjectUtils;
import com.nimbusds.jwt.JWTClaimNames;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Validates bearer tokens issued by an OpenID Connect provider and derives a bounded session from them.
 * <p>
 * Only asymmetric signatures are accepted. When the signing key is unknown or the signature does not verify, the
 * key store is refreshed once and verification is retried once; a key rotation at the provider is picked up this way
 * without polling.
 */
@Slf4j
@RequiredArgsConstructor
public class OpenIdJwtValidator {

    public static final String ID = "jwt";

    public static final List<JWSAlgorithm> ALLOWED_ALGORITHMS = List.of(
            JWSAlgorithm.RS256, JWSAlgorithm.RS384, JWSAlgorithm.RS512,
            JWSAlgorithm.ES256, JWSAlgorithm.ES384, JWSAlgorithm.ES512
    );

    @Getter
    @NonNull
    private final PublicKeyStore keyStore;

    @NonNull
    private final SessionExpiryPolicy expiryPolicy;

    @NonNull
    private final Clock clock;

    @NonNull
    private final Duration clockSkew;

    private final JWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    public OpenIdJwtValidator(PublicKeyStore keyStore) {
        this(keyStore, new SessionExpiryPolicy(), Clock.systemUTC(), Duration.ZERO);
    }

    public String getId() {
        return ID;
    }

    /**
     * @param token compact serialized JWS
     * @param requestedDuration requested session duration in seconds, {@code null} or empty for the default
     * @return the accepted token with its session bounds
     * @throws OpenIdException when the token is rejected, or when refreshing the provider keys fails
     */
    public ValidatedToken validate(@NonNull String token, String requestedDuration) throws OpenIdException {
        var unverified = UnverifiedToken.parse(token);

        verifySignature(unverified);

        var claims = unverified.claims();
        var now = clock.instant();
        verifyTimestamps(claims, now);

        long expiresAt = claims.getEpochSeconds(JWTClaimNames.EXPIRATION_TIME)
                .orElseThrow(() -> new InvalidDurationException("Token has no usable expiration time"));

        var sessionDuration = expiryPolicy.resolve(requestedDuration);
        var remaining = Duration.between(now, toInstant(expiresAt));
        if (remaining.isNegative()) {
            // only reachable within the clock skew
            remaining = Duration.ZERO;
        }
        if (remaining.compareTo(sessionDuration) < 0) {
            sessionDuration = remaining;
        }

        var sessionExpiry = now.plus(sessionDuration);
        if (expiresAt < sessionExpiry.getEpochSecond()) {
            claims = claims.with(JWTClaimNames.EXPIRATION_TIME, new NumberValue(expiresAt));
        }

        return new ValidatedToken(ID, claims, sessionDuration, sessionExpiry);
    }

    private void verifySignature(UnverifiedToken token) throws OpenIdException {
        if (verify(token)) {
            return;
        }

        log.debug("Signing key {} is unknown or does not match; refreshing provider keys", token.keyId());
        keyStore.refresh();

        if (!verify(token)) {
            throw new InvalidSignatureException(
                    "Token signature can not be verified with key %s".formatted(token.keyId()));
        }
    }

    private boolean verify(UnverifiedToken token) {
        var key = keyStore.lookup(token.keyId());
        if (key.isEmpty()) {
            return false;
        }
        try {
            var verifier = verifierFactory.createJWSVerifier(token.jwt().getHeader(), key.get());
            return token.jwt().verify(verifier);
        } catch (JOSEException e) {
            log.debug("Key {} can not verify {} signatures: {}", token.keyId(),
                    token.jwt().getHeader().getAlgorithm(), e.getMessage());
            return false;
        }
    }

    private void verifyTimestamps(ClaimSet claims, Instant now) throws TokenExpiredException {
        long currentTime = now.getEpochSecond();
        long skew = clockSkew.toSeconds();

        var expiresAt = claims.getEpochSeconds(JWTClaimNames.EXPIRATION_TIME);
        if (expiresAt.isPresent() && currentTime > saturatedAdd(expiresAt.getAsLong(), skew)) {
            throw new TokenExpiredException("Token expired at %s".formatted(toInstant(expiresAt.getAsLong())));
        }

        var notBefore = claims.getEpochSeconds(JWTClaimNames.NOT_BEFORE);
        if (notBefore.isPresent() && saturatedAdd(currentTime, skew) < notBefore.getAsLong()) {
            throw new TokenExpiredException("Token is not valid before %s".formatted(toInstant(notBefore.getAsLong())));
        }

        var issuedAt = claims.getEpochSeconds(JWTClaimNames.ISSUED_AT);
        if (issuedAt.isPresent() && saturatedAdd(currentTime, skew) < issuedAt.getAsLong()) {
            throw new TokenExpiredException("Token used before it was issued at %s".formatted(toInstant(issuedAt.getAsLong())));
        }
    }

    private static long saturatedAdd(long value, long amount) {
        try {
            return Math.addExact(value, amount);
        } catch (ArithmeticException e) {
            return amount > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    /**
     * NumericDates beyond the range of {@link Instant} are clamped to {@link Instant#MIN} or {@link Instant#MAX}.
     */
    private static Instant toInstant(long epochSeconds) {
        var clamped = Math.max(Instant.MIN.getEpochSecond(), Math.min(Instant.MAX.getEpochSecond(), epochSeconds));
        return Instant.ofEpochSecond(clamped);
    }

    /**
     * A token of which the header and payload have been decoded, but of which the signature is not yet trusted.
     */
    private record UnverifiedToken(SignedJWT jwt, String keyId, ClaimSet claims) {

        static UnverifiedToken parse(String token) throws InvalidTokenException {
            Base64URL[] parts;
            try {
                parts = JOSEObject.split(token);
            } catch (ParseException e) {
                throw new MalformedTokenException("Invalid serialized token: %s".formatted(e.getMessage()), e);
            }
            if (parts.length != 3) {
                throw new MalformedTokenException("Expected a signed token with 3 parts, got %d".formatted(parts.length));
            }

            var header = decodeJson(parts[0], "header");
            var algorithm = header.get(HeaderParameterNames.ALGORITHM);
            if (!(algorithm instanceof String name) || !ALLOWED_ALGORITHMS.contains(JWSAlgorithm.parse(name))) {
                throw new UnsupportedAlgorithmException(algorithm, ALLOWED_ALGORITHMS);
            }
            if (!(header.get(HeaderParameterNames.KEY_ID) instanceof String keyId)) {
                throw new MissingKeyIdException(header.get(HeaderParameterNames.KEY_ID));
            }

            var payload = decodeJson(parts[1], "payload");

            try {
                return new UnverifiedToken(new SignedJWT(parts[0], parts[1], parts[2]), keyId,
                        ClaimSet.fromJson(payload));
            } catch (ParseException e) {
                throw new MalformedTokenException("Invalid token: %s".formatted(e.getMessage()), e);
            }
        }

        private static Map<String, Object> decodeJson(Base64URL part, String name) throws MalformedTokenException {
            try {
                return JSONObjectUtils.parse(part.decodeToString());
            } catch (ParseException e) {
                throw new MalformedTokenException("Invalid token %s: %s".formatted(name, e.getMessage()), e);
            }
        }
    }
}
