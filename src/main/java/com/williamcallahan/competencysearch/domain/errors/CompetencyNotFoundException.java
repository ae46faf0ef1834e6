package com.williamcallahan.competencysearch.domain.errors;

import java.io.Serial;

/**
 * Signals that no competency is stored under the requested identifier.
 */
public class CompetencyNotFoundException extends CompetencySearchException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String identifier;

    public CompetencyNotFoundException(String identifier) {
        super("Competency not found: " + identifier, false);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
