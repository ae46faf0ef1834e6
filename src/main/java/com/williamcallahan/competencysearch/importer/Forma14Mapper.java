package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps the 2014 Formacode export, whose columns carry French headers.
 *
 * <p>Codes appear as {@code "123 Label"} prefixes or {@code "Label - 12345"} suffixes. Lists are
 * {@code ###}-separated except associated terms, which use {@code $}.</p>
 */
public class Forma14Mapper implements CompetencyMapper {

    static final String KNOWLEDGE_BASE_URL =
            "https://centreinffo.mondeca.com/KB/index#Concept:uri=https://centre-inffo.fr/descripteur_formacode/";

    private static final String LIST_SEPARATOR = "###";
    private static final String ASSOCIATED_SEPARATOR = "$";
    private static final int TERM_CODE_LENGTH = 5;
    private static final int FIELD_CODE_LENGTH = 3;

    private final ImportContext context;
    private final Raw raw;

    /**
     * Raw 2014 Formacode row.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Raw(
            @JsonProperty("Code du Terme") Integer code,
            @JsonProperty("Descripteur en typo riche") String title,
            @JsonProperty("TG (Terme Générique)") String category,
            @JsonProperty("Champ sémantique") String semanticField,
            @JsonProperty("Synonymes") String synonym,
            @JsonProperty("Synonymes métier") String synonymJob,
            @JsonProperty("TS (Termes Spécifiques)") String specificTerms,
            @JsonProperty("TA (Termes Associés)") String associatedTerms,
            @JsonProperty("NA (Note d’Application)") String applicationNote,
            @JsonProperty("NE (Note d’Explication)") String explicationNote,
            @JsonProperty("indexed_text") String indexedText) {}

    public Forma14Mapper(ImportContext context, Raw raw) {
        this.context = Objects.requireNonNull(context, "context");
        this.raw = Objects.requireNonNull(raw, "raw");
        if (raw.code() == null) {
            throw new ValidationException("Formacode 2014 record is missing 'Code du Terme'");
        }
        if (!MapperText.hasText(raw.title())) {
            throw new ValidationException("Formacode 2014 record is missing 'Descripteur en typo riche'");
        }
    }

    @Override
    public Competency toCompetency() {
        String category = MapperText.hasText(raw.category())
                ? MapperText.removeCodeSuffix(raw.category(), TERM_CODE_LENGTH)
                : null;

        List<String> keywords = new ArrayList<>();
        if (MapperText.hasText(raw.semanticField())) {
            keywords.add(MapperText.capitalize(MapperText.removeCodePrefix(raw.semanticField(), FIELD_CODE_LENGTH)));
        }
        MapperText.splitTrimmed(raw.synonym(), LIST_SEPARATOR).forEach(term -> keywords.add(MapperText.capitalize(term)));
        MapperText.splitTrimmed(raw.synonymJob(), LIST_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.capitalize(term)));
        MapperText.splitTrimmed(raw.specificTerms(), LIST_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.removeCodeSuffix(term, TERM_CODE_LENGTH)));
        MapperText.splitTrimmed(raw.associatedTerms(), ASSOCIATED_SEPARATOR)
                .forEach(term -> keywords.add(MapperText.removeCodeSuffix(term, TERM_CODE_LENGTH)));

        List<String> notes = new ArrayList<>();
        if (MapperText.hasText(raw.explicationNote())) {
            notes.add(raw.explicationNote().trim());
        }
        if (MapperText.hasText(raw.applicationNote())) {
            notes.add(raw.applicationNote().trim());
        }
        String description = notes.isEmpty() ? null : String.join(" ", notes);

        String code = String.valueOf(raw.code());
        return new Competency(
                code,
                context.lang(),
                context.type(),
                context.provider(),
                raw.title(),
                KNOWLEDGE_BASE_URL + code + ";tab=props;",
                category,
                description,
                MapperText.sortedUnique(keywords),
                MapperText.hasText(raw.indexedText()) ? raw.indexedText() : raw.title(),
                null);
    }
}
