package com.jz.coach.chat.directive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 回复语气 */
public enum ResponseTone {
    GENTLE, WARM, ENERGETIC, DIRECT, PLAYFUL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResponseTone fromCode(String code) {
        if (code == null) return WARM;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "gentle" -> GENTLE;
            case "energetic" -> ENERGETIC;
            case "direct" -> DIRECT;
            case "playful" -> PLAYFUL;
            default -> WARM;
        };
    }
}
