package com.contentgrid.storage.iam.openid;

import com.contentgrid.storage.iam.openid.claims.ClaimSet;
import java.time.Duration;
import java.time.Instant;
import lombok.NonNull;
import lombok.Value;

/**
 * An accepted token, together with the session that may be derived from it.
 */
@Value
public class ValidatedToken {

    /**
     * Identifier of the authentication method that accepted the token.
     */
    @NonNull
    String method;

    /**
     * The token claims. Only the expiration time may differ from the token payload.
     */
    @NonNull
    ClaimSet claims;

    /**
     * How long the derived session may last; never longer than the token remains valid.
     */
    @NonNull
    Duration sessionDuration;

    @NonNull
    Instant sessionExpiry;
}
