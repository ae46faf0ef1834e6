package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps the current Formacode thesaurus export.
 *
 * <p>Term lists are {@code $}-separated and every term carries a fixed-width numeric code in front of
 * it: five digits for terms and the generic term, three for the NSF and semantic field.</p>
 */
public class FormaMapper implements CompetencyMapper {

    static final String THESAURUS_URL = "https://formacode.centre-inffo.fr/spip.php?page=thesaurus&fcd_code=";

    private static final String LIST_SEPARATOR = "$";
    private static final int TERM_CODE_LENGTH = 5;
    private static final int FIELD_CODE_LENGTH = 3;

    private final ImportContext context;
    private final Raw raw;

    /**
     * Raw Formacode record.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Raw(
            @JsonProperty("code") Integer code,
            @JsonProperty("title") String title,
            @JsonProperty("category") String category,
            @JsonProperty("NSF") String nsf,
            @JsonProperty("semantic_field") String semanticField,
            @JsonProperty("synonym") String synonym,
            @JsonProperty("synonym_job") String synonymJob,
            @JsonProperty("specific_terms") String specificTerms,
            @JsonProperty("associated_terms") String associatedTerms,
            @JsonProperty("ROME") String rome,
            @JsonProperty("explication_note") String explicationNote,
            @JsonProperty("application_note") String applicationNote,
            @JsonProperty("indexed_text") String indexedText) {}

    public FormaMapper(ImportContext context, Raw raw) {
        this.context = Objects.requireNonNull(context, "context");
        this.raw = Objects.requireNonNull(raw, "raw");
        if (raw.code() == null) {
            throw new ValidationException("Formacode record is missing code");
        }
        if (!MapperText.hasText(raw.title())) {
            throw new ValidationException("Formacode record is missing title");
        }
    }

    @Override
    public Competency toCompetency() {
        String title = MapperText.capitalize(raw.title());
        String category = MapperText.hasText(raw.category())
                ? MapperText.capitalize(MapperText.dropLeadingCode(raw.category(), TERM_CODE_LENGTH))
                : null;
        String nsf = MapperText.hasText(raw.nsf()) ? MapperText.dropLeadingCode(raw.nsf(), FIELD_CODE_LENGTH) : null;

        List<String> keywords = new ArrayList<>();
        if (MapperText.hasText(raw.semanticField())) {
            keywords.add(MapperText.capitalize(MapperText.dropLeadingCode(raw.semanticField(), FIELD_CODE_LENGTH)));
        }
        MapperText.splitTrimmed(raw.synonym(), LIST_SEPARATOR).forEach(term -> keywords.add(MapperText.capitalize(term)));
        MapperText.splitTrimmed(raw.synonymJob(), LIST_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.capitalize(term)));
        MapperText.splitTrimmed(raw.specificTerms(), LIST_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.capitalize(MapperText.dropLeadingCode(term, TERM_CODE_LENGTH))));
        MapperText.splitTrimmed(raw.associatedTerms(), LIST_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.capitalize(MapperText.dropLeadingCode(term, TERM_CODE_LENGTH))));
        MapperText.splitTrimmed(raw.rome(), LIST_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.capitalize(MapperText.dropLeadingCode(term, TERM_CODE_LENGTH))));

        List<String> descriptionParts = new ArrayList<>();
        for (String part : new String[] {nsf, raw.explicationNote(), raw.applicationNote()}) {
            if (MapperText.hasText(part)) {
                descriptionParts.add(part);
            }
        }
        String description = descriptionParts.isEmpty() ? null : String.join(". ", descriptionParts);

        String code = String.valueOf(raw.code());
        return new Competency(
                code,
                context.lang(),
                context.type(),
                context.provider(),
                title,
                THESAURUS_URL + code,
                category,
                description,
                MapperText.sortedUnique(keywords),
                MapperText.hasText(raw.indexedText()) ? raw.indexedText() : title,
                null);
    }
}
