package com.williamcallahan.competencysearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Language of a competency record.
 */
public enum Language {
    EN("en"),
    FR("fr");

    private final String token;

    Language(String token) {
        this.token = token;
    }

    /**
     * Returns the lower-case wire token stored in payloads and accepted on the API.
     *
     * @return wire token
     */
    @JsonValue
    public String token() {
        return token;
    }

    /**
     * Resolves a language from its wire token.
     *
     * @param token wire token such as {@code en}
     * @return matching language
     * @throws IllegalArgumentException when the token is unknown
     */
    @JsonCreator
    public static Language fromToken(String token) {
        return WireTokens.resolve(Language.class, values(), Language::token, token);
    }
}
