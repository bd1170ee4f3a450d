package com.aura.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 最终录用建议。
 */
public enum RecommendationEnum {

    STRONG_YES("Strong Yes"),

    YES("Yes"),

    MAYBE("Maybe");

    private final String label;

    RecommendationEnum(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
