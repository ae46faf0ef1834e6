package com.williamcallahan.competencysearch.importer;

import com.williamcallahan.competencysearch.domain.Competency;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Indexes one copy of the competency per non-blank value of each selected field, so that a query
 * close to any single label finds the record.
 */
public class FieldDuplicationStrategy implements IndexingStrategy {

    private final List<IndexedField> fields;

    public FieldDuplicationStrategy(List<IndexedField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    }

    @Override
    public List<Competency> expand(Competency competency) {
        List<Competency> expanded = new ArrayList<>();
        for (IndexedField field : fields) {
            for (String value : field.valuesOf(competency)) {
                if (value != null && !value.isBlank()) {
                    expanded.add(competency.withIndexedText(value));
                }
            }
        }
        return expanded;
    }
}
