package com.williamcallahan.competencysearch.support;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Provides locale-independent ASCII text normalization for case-insensitive comparisons.
 *
 * <p>Only ASCII uppercase letters (A-Z) are lowered, so wire tokens and lexical terms behave the same
 * whatever the default locale. Accent folding lets French records match unaccented queries.</p>
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private AsciiTextNormalizer() {}

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text the input text to normalize (may be null)
     * @return the normalized text with ASCII letters lowercased, or empty string if null
     */
    public static String toLowerAscii(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= 'A' && current <= 'Z') {
                normalized.append((char) (current + CASE_OFFSET));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }

    /**
     * Removes diacritics by decomposing the text and dropping combining marks ("métier" becomes "metier").
     *
     * @param text the input text (may be null)
     * @return the folded text, or empty string if null
     */
    public static String foldDiacritics(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }
}
