package com.jz.coach.chat.directive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 回复长度档位 */
public enum ResponseLength {
    BRIEF, MODERATE, DETAILED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseLength fromCode(String code) {
        if (code == null) return MODERATE;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "brief" -> BRIEF;
            case "detailed" -> DETAILED;
            default -> MODERATE;
        };
    }
}
