package com.williamcallahan.competencysearch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of competency a record describes.
 */
public enum CompetencyType {
    OCCUPATION("occupation"),
    SKILL("skill"),
    CERTIFICATION("certification");

    private final String token;

    CompetencyType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    @JsonCreator
    public static CompetencyType fromToken(String token) {
        return WireTokens.resolve(CompetencyType.class, values(), CompetencyType::token, token);
    }
}
