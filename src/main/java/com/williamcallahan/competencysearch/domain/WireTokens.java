package com.williamcallahan.competencysearch.domain;

import com.williamcallahan.competencysearch.support.AsciiTextNormalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves enum constants from their lower-case wire tokens.
 */
public final class WireTokens {

    private WireTokens() {}

    public static <E extends Enum<E>> E resolve(
            Class<E> enumType, E[] constants, Function<E, String> tokenOf, String rawToken) {
        String normalized = AsciiTextNormalizer.toLowerAscii(rawToken).trim();
        for (E constant : constants) {
            if (tokenOf.apply(constant).equals(normalized)) {
                return constant;
            }
        }
        String accepted = Arrays.stream(constants).map(tokenOf).collect(Collectors.joining(", "));
        throw new IllegalArgumentException(String.format(
                Locale.ROOT, "Unknown %s '%s' (expected one of: %s)", enumType.getSimpleName(), rawToken, accepted));
    }
}
