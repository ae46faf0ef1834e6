package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Maps ROME job sheets.
 *
 * <p>Appellations written as {@code "a / b"} are expanded into two full job titles, borrowing the
 * words the shorter side shares with the longer one.</p>
 */
public class RomeMapper implements CompetencyMapper {

    static final String SHEET_URL = "https://candidat.pole-emploi.fr/metierscope/fiche-metier/";

    private final ImportContext context;
    private final Raw raw;

    /**
     * Raw ROME record.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Raw(
            @JsonProperty("code") String code,
            @JsonProperty("intitule") String intitule,
            @JsonProperty("category") String category,
            @JsonProperty("description") String description,
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("indexed_text") String indexedText) {}

    public RomeMapper(ImportContext context, Raw raw) {
        this.context = Objects.requireNonNull(context, "context");
        this.raw = Objects.requireNonNull(raw, "raw");
        if (!MapperText.hasText(raw.code())) {
            throw new ValidationException("ROME record is missing code");
        }
        if (!MapperText.hasText(raw.intitule())) {
            throw new ValidationException("ROME record is missing intitule");
        }
    }

    @Override
    public Competency toCompetency() {
        List<String> keywords = new ArrayList<>();
        if (raw.keywords() != null) {
            for (String keyword : raw.keywords()) {
                if (keyword != null) {
                    keywords.addAll(splitAppellation(keyword));
                }
            }
        }
        return new Competency(
                raw.code(),
                context.lang(),
                context.type(),
                context.provider(),
                raw.intitule(),
                SHEET_URL + raw.code(),
                raw.category(),
                raw.description(),
                MapperText.sortedUnique(keywords),
                MapperText.hasText(raw.indexedText()) ? raw.indexedText() : raw.intitule(),
                null);
    }

    /**
     * Expands {@code "a / b"} into two appellations.
     *
     * <p>When the left side has more words, its leading extra words are a shared prefix, so
     * {@code "Chef de cuisine / rang"} yields {@code "Chef de rang"}. When the right side has more words,
     * its trailing extra words are a shared suffix. Equal word counts split plainly.</p>
     */
    static List<String> splitAppellation(String appellation) {
        if (!appellation.contains("/")) {
            return List.of(appellation);
        }
        String[] parts = appellation.split("/", -1);
        if (parts.length != 2) {
            return List.of(appellation);
        }
        String left = parts[0].trim();
        String right = parts[1].trim();
        String[] leftWords = words(left);
        String[] rightWords = words(right);

        String first = left;
        String second = right;
        if (leftWords.length > rightWords.length) {
            int prefixLength = leftWords.length - rightWords.length;
            String prefix = String.join(" ", Arrays.copyOfRange(leftWords, 0, prefixLength));
            second = prefix + " " + right;
        } else if (rightWords.length > leftWords.length) {
            int suffixLength = rightWords.length - leftWords.length;
            String suffix = String.join(" ", Arrays.copyOfRange(rightWords, rightWords.length - suffixLength, rightWords.length));
            first = left + " " + suffix;
        }
        return List.of(first.trim(), second.trim());
    }

    private static String[] words(String text) {
        return text.isBlank() ? new String[0] : text.trim().split("\\s+");
    }
}
