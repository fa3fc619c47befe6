package com.myscrollr.delivery.routing;

import java.util.Optional;

/**
 * Computes a routing key from a raw field value.
 */
@FunctionalInterface
public interface KeyDeriver {

    /**
     * @return the derived key, or empty when the raw value is malformed
     */
    Optional<String> derive(String rawValue);

    /**
     * Takes everything before the first occurrence of {@code separator}.
     * A value without the separator, or with nothing in front of it, is malformed.
     * For example {@code nfl.l.12345.t.1} with separator {@code .t.} yields {@code nfl.l.12345}.
     */
    static KeyDeriver prefixBefore(String separator) {
        return raw -> {
            int idx = raw.indexOf(separator);
            if (idx <= 0) {
                return Optional.empty();
            }
            return Optional.of(raw.substring(0, idx));
        };
    }
}
