package com.contentgrid.storage.iam.openid.expiry;

import java.time.Duration;

/**
 * Bounds the lifetime of a session derived from a federated credential.
 * <p>
 * An explicitly requested duration must lie between 15 minutes and 12 hours, inclusive. Without a request, sessions
 * last one hour.
 */
public class SessionExpiryPolicy {

    public static final Duration MIN_DURATION = Duration.ofSeconds(900);
    public static final Duration MAX_DURATION = Duration.ofSeconds(43200);
    public static final Duration DEFAULT_DURATION = Duration.ofSeconds(3600);

    /**
     * @param requestedSeconds requested duration as a base-10 number of seconds; {@code null} or empty for the default
     * @return the session duration
     * @throws InvalidDurationException when the request is not a number or is out of bounds
     */
    public Duration resolve(String requestedSeconds) throws InvalidDurationException {
        if (requestedSeconds == null || requestedSeconds.isEmpty()) {
            return DEFAULT_DURATION;
        }

        long seconds;
        try {
            seconds = Long.parseLong(requestedSeconds, 10);
        } catch (NumberFormatException e) {
            throw new InvalidDurationException("Invalid session duration '%s'".formatted(requestedSeconds), e);
        }

        var duration = Duration.ofSeconds(seconds);
        if (duration.compareTo(MIN_DURATION) < 0 || duration.compareTo(MAX_DURATION) > 0) {
            throw new InvalidDurationException("Session duration %ds is outside of [%d, %d]".formatted(
                    seconds, MIN_DURATION.toSeconds(), MAX_DURATION.toSeconds()));
        }
        return duration;
    }
}
