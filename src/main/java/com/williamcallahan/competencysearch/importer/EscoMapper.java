package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps ESCO occupation and skill exports.
 *
 * <p>The title is the capitalized preferred label. Alternative and hidden labels become keywords, and a
 * two-part {@code "a / b"} label contributes both halves as well.</p>
 */
public class EscoMapper implements CompetencyMapper {

    private static final String ALT_LABEL_SEPARATOR = " | ";
    private static final String LINE_SEPARATOR = "\n";

    private final ImportContext context;
    private final Raw raw;

    /**
     * Raw ESCO record as exported.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Raw(
            @JsonProperty("preferredLabel") String preferredLabel,
            @JsonProperty("description") String description,
            @JsonProperty("conceptUri") String conceptUri,
            @JsonProperty("altLabels") String altLabels,
            @JsonProperty("hiddenLabels") String hiddenLabels,
            @JsonProperty("code") String code,
            @JsonProperty("category") String category,
            @JsonProperty("broaderConceptPT") String broaderConceptPt,
            @JsonProperty("indexed_text") String indexedText) {}

    public EscoMapper(ImportContext context, Raw raw) {
        this.context = Objects.requireNonNull(context, "context");
        this.raw = Objects.requireNonNull(raw, "raw");
        if (!MapperText.hasText(raw.preferredLabel())) {
            throw new ValidationException("ESCO record is missing preferredLabel");
        }
        if (!MapperText.hasText(raw.conceptUri())) {
            throw new ValidationException("ESCO record is missing conceptUri");
        }
        if (raw.description() == null) {
            throw new ValidationException("ESCO record is missing description");
        }
    }

    @Override
    public Competency toCompetency() {
        String title = MapperText.capitalize(raw.preferredLabel().trim());
        String code = MapperText.hasText(raw.code()) ? raw.code() : raw.conceptUri().trim();
        String category = raw.category();
        if (!MapperText.hasText(category) && MapperText.hasText(raw.broaderConceptPt())) {
            category = raw.broaderConceptPt().trim().replace(ALT_LABEL_SEPARATOR, ", ");
        }

        List<String> keywords = new ArrayList<>();
        if (MapperText.hasText(raw.altLabels())) {
            String separator = raw.altLabels().contains(ALT_LABEL_SEPARATOR) ? ALT_LABEL_SEPARATOR : LINE_SEPARATOR;
            keywords.addAll(MapperText.splitTrimmed(raw.altLabels(), separator));
        }
        keywords.addAll(MapperText.splitTrimmed(raw.hiddenLabels(), LINE_SEPARATOR));
        keywords.addAll(splitAppellation(title));

        List<String> capitalized = keywords.stream().map(MapperText::capitalize).toList();
        return new Competency(
                code,
                context.lang(),
                context.type(),
                context.provider(),
                title,
                raw.conceptUri(),
                category,
                raw.description(),
                MapperText.sortedUnique(capitalized),
                MapperText.hasText(raw.indexedText()) ? raw.indexedText() : title,
                null);
    }

    /**
     * Both halves of {@code "a / b"}, or nothing when the label is not a two-part appellation.
     */
    static List<String> splitAppellation(String appellation) {
        if (!appellation.contains("/")) {
            return List.of();
        }
        String[] parts = appellation.split("/", -1);
        if (parts.length != 2) {
            return List.of();
        }
        return List.of(parts[0].trim(), parts[1].trim());
    }
}
