package com.williamcallahan.competencysearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * External taxonomy a competency record originates from.
 *
 * <p>{@code FORMA14} is the 2014 Formacode export, whose columns differ from the current one.</p>
 */
public enum Provider {
    ESCO("esco"),
    ROME("rome"),
    FORMA("forma"),
    FORMA14("forma14");

    private final String token;

    Provider(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static Provider fromToken(String token) {
        return WireTokens.resolve(Provider.class, values(), Provider::token, token);
    }
}
