package com.williamcallahan.competencysearch.importer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Text cleaning helpers shared by the provider mappers.
 */
final class MapperText {

    private MapperText() {}

    /**
     * Upper-cases the first character and lower-cases the rest.
     */
    static String capitalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        int firstCodePoint = text.codePointAt(0);
        int firstLength = Character.charCount(firstCodePoint);
        return new String(Character.toChars(Character.toUpperCase(firstCodePoint)))
                + text.substring(firstLength).toLowerCase(Locale.ROOT);
    }

    /**
     * Splits on a literal separator, trimming parts and dropping blank ones.
     */
    static List<String> splitTrimmed(String text, String separator) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return parts;
        }
        for (String part : text.split(Pattern.quote(separator), -1)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts;
    }

    /**
     * Drops the first {@code codeLength + 1} characters, the fixed-width code and its separator.
     */
    static String dropLeadingCode(String text, int codeLength) {
        int start = Math.min(codeLength + 1, text.length());
        return text.substring(start);
    }

    /**
     * Removes a {@code "12345 "} prefix of exactly {@code codeLength} digits, when present.
     */
    static String removeCodePrefix(String text, int codeLength) {
        if (Pattern.compile("^\\d{" + codeLength + "} ").matcher(text).find()) {
            return text.substring(text.indexOf(' ') + 1);
        }
        return text;
    }

    /**
     * Removes a {@code " - 12345"} suffix of exactly {@code codeLength} digits, when present.
     */
    static String removeCodeSuffix(String text, int codeLength) {
        if (Pattern.compile(" - \\d{" + codeLength + "}$").matcher(text).find()) {
            return text.substring(0, text.lastIndexOf(" - "));
        }
        return text;
    }

    /**
     * Sorted, de-duplicated, non-blank keywords.
     */
    static List<String> sortedUnique(Collection<String> keywords) {
        TreeSet<String> unique = new TreeSet<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                unique.add(keyword);
            }
        }
        return List.copyOf(unique);
    }

    static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
