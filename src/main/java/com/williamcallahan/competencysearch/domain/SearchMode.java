package com.williamcallahan.competencysearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval strategy requested by a search call.
 */
public enum SearchMode {
    /** Dense nearest-neighbour retrieval only. */
    SEMANTIC("semantic"),
    /** Lexical sparse retrieval only. */
    SPARSE("sparse"),
    /** Both branches fused with reciprocal rank fusion. */
    HYBRID("hybrid");

    private final String token;

    SearchMode(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static SearchMode fromToken(String token) {
        return WireTokens.resolve(SearchMode.class, values(), SearchMode::token, token);
    }

    /**
     * Reports whether this mode needs a dense query vector.
     */
    public boolean usesDense() {
        return this != SPARSE;
    }

    /**
     * Reports whether this mode needs a sparse query vector.
     */
    public boolean usesSparse() {
        return this != SEMANTIC;
    }
}
