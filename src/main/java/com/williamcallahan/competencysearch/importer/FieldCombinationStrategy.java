package com.williamcallahan.competencysearch.importer;

import com.williamcallahan.competencysearch.domain.Competency;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Indexes a single copy whose text joins the selected fields with {@code ". "}. List fields are
 * joined with {@code ", "} and a trailing period is removed from scalar values.
 */
public class FieldCombinationStrategy implements IndexingStrategy {

    private static final String FIELD_SEPARATOR = ". ";
    private static final String LIST_SEPARATOR = ", ";

    private final List<IndexedField> fields;

    public FieldCombinationStrategy(List<IndexedField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    }

    @Override
    public List<Competency> expand(Competency competency) {
        List<String> parts = new ArrayList<>();
        for (IndexedField field : fields) {
            List<String> values = field.valuesOf(competency).stream()
                    .filter(value -> value != null && !value.isBlank())
                    .map(String::trim)
                    .toList();
            if (values.isEmpty()) {
                continue;
            }
            if (field.isList()) {
                parts.add(String.join(LIST_SEPARATOR, values));
            } else {
                parts.add(stripTrailingPeriod(values.get(0)));
            }
        }
        return List.of(competency.withIndexedText(String.join(FIELD_SEPARATOR, parts).trim()));
    }

    private static String stripTrailingPeriod(String value) {
        return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
    }
}
