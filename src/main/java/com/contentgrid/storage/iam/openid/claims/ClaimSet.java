package com.contentgrid.storage.iam.openid.claims;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Immutable set of named claims from a verified token.
 */
@EqualsAndHashCode
public final class ClaimSet {

    private final Map<String, ClaimValue> claims;

    private ClaimSet(Map<String, ClaimValue> claims) {
        this.claims = Collections.unmodifiableMap(claims);
    }

    /**
     * @param json a JSON object as produced by a JSON parser
     */
    public static ClaimSet fromJson(@NonNull Map<String, Object> json) {
        var claims = new LinkedHashMap<String, ClaimValue>();
        json.forEach((name, value) -> claims.put(name, ClaimValue.of(value)));
        return new ClaimSet(claims);
    }

    public Optional<ClaimValue> get(@NonNull String name) {
        return Optional.ofNullable(claims.get(name));
    }

    public boolean contains(@NonNull String name) {
        return claims.containsKey(name);
    }

    /**
     * @return the claim read as a NumericDate, empty when the claim is absent or not numeric
     * @see ClaimValue#asEpochSeconds()
     */
    public OptionalLong getEpochSeconds(@NonNull String name) {
        var value = claims.get(name);
        return value == null ? OptionalLong.empty() : value.asEpochSeconds();
    }

    public Set<String> names() {
        return claims.keySet();
    }

    public int size() {
        return claims.size();
    }

    /**
     * @return a copy of this claim set, with the claim {@code name} set to {@code value}
     */
    public ClaimSet with(@NonNull String name, @NonNull ClaimValue value) {
        var copy = new LinkedHashMap<>(claims);
        copy.put(name, value);
        return new ClaimSet(copy);
    }

    public Map<String, ClaimValue> asMap() {
        return claims;
    }

    /**
     * @return the claims as plain Java values (String, Number, Boolean, null, Map and List)
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        claims.forEach((name, value) -> map.put(name, value.unwrap()));
        return map;
    }

    @Override
    public String toString() {
        return "ClaimSet" + claims.keySet();
    }
}
