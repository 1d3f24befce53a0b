package com.jz.coach.chat.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 用户情绪（优先级：distressed > anxious > positive > calm > neutral） */
public enum UserMood {
    DISTRESSED, ANXIOUS, NEUTRAL, CALM, POSITIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UserMood fromCode(String code) {
        if (code == null) return NEUTRAL;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "distressed" -> DISTRESSED;
            case "anxious" -> ANXIOUS;
            case "calm" -> CALM;
            case "positive" -> POSITIVE;
            default -> NEUTRAL;
        };
    }
}
