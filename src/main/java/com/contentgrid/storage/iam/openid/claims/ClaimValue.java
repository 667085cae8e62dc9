package com.contentgrid.storage.iam.openid.claims;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A JSON value carried in a token claim.
 */
public sealed interface ClaimValue {

    /**
     * Converts a value produced by a JSON parser (String, Number, Boolean, null, Map or List) into a claim value.
     */
    static ClaimValue of(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        } else if (value instanceof ClaimValue claimValue) {
            return claimValue;
        } else if (value instanceof String string) {
            return new StringValue(string);
        } else if (value instanceof Number number) {
            return new NumberValue(number);
        } else if (value instanceof Boolean bool) {
            return new BooleanValue(bool);
        } else if (value instanceof Map<?, ?> map) {
            var members = new LinkedHashMap<String, ClaimValue>();
            map.forEach((key, member) -> members.put(String.valueOf(key), of(member)));
            return new ObjectValue(members);
        } else if (value instanceof List<?> list) {
            var elements = new ArrayList<ClaimValue>(list.size());
            list.forEach(element -> elements.add(of(element)));
            return new ArrayValue(elements);
        }
        throw new IllegalArgumentException("Unsupported claim value of type %s".formatted(value.getClass().getName()));
    }

    /**
     * @return the plain Java representation of this value
     */
    Object unwrap();

    /**
     * Interprets this value as a NumericDate (seconds since the epoch). Integers and floating point numbers are
     * accepted, as are strings holding a decimal number. Fractional seconds are truncated.
     *
     * @return the number of seconds, or empty when this value can not be read as a number
     */
    default OptionalLong asEpochSeconds() {
        return OptionalLong.empty();
    }

    record StringValue(String value) implements ClaimValue {

        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object unwrap() {
            return value;
        }

        @Override
        public OptionalLong asEpochSeconds() {
            try {
                return OptionalLong.of(new BigDecimal(value.trim()).setScale(0, RoundingMode.DOWN).longValueExact());
            } catch (NumberFormatException | ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
    }

    record NumberValue(Number value) implements ClaimValue {

        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object unwrap() {
            return value;
        }

        @Override
        public OptionalLong asEpochSeconds() {
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return OptionalLong.of(value.longValue());
            }
            // NaN, infinities and numbers outside of the long range are not usable
            try {
                return OptionalLong.of(new BigDecimal(value.toString()).setScale(0, RoundingMode.DOWN).longValueExact());
            } catch (NumberFormatException | ArithmeticException e) {
                return OptionalLong.empty();
            }
        }
    }

    record BooleanValue(boolean value) implements ClaimValue {

        @Override
        public Object unwrap() {
            return value;
        }
    }

    final class NullValue implements ClaimValue {

        public static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public Object unwrap() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record ObjectValue(Map<String, ClaimValue> members) implements ClaimValue {

        public ObjectValue {
            Objects.requireNonNull(members, "members");
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        @Override
        public Object unwrap() {
            var map = new LinkedHashMap<String, Object>();
            members.forEach((key, member) -> map.put(key, member.unwrap()));
            return map;
        }
    }

    record ArrayValue(List<ClaimValue> elements) implements ClaimValue {

        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public Object unwrap() {
            var list = new ArrayList<>(elements.size());
            elements.forEach(element -> list.add(element.unwrap()));
            return list;
        }
    }
}
