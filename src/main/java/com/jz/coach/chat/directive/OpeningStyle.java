package com.jz.coach.chat.directive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 开场方式 */
public enum OpeningStyle {
    CONTINUE, GENTLE_CHECKIN, ENERGY_MATCH, GROUNDING;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OpeningStyle fromCode(String code) {
        if (code == null) return CONTINUE;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "gentle_checkin" -> GENTLE_CHECKIN;
            case "energy_match" -> ENERGY_MATCH;
            case "grounding" -> GROUNDING;
            default -> CONTINUE;
        };
    }
}
