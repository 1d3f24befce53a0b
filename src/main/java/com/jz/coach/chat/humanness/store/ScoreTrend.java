package com.jz.coach.chat.humanness.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScoreTrend {
    IMPROVING, STABLE, DECLINING;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScoreTrend fromCode(String code) {
        if (code == null) return STABLE;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "improving" -> IMPROVING;
            case "declining" -> DECLINING;
            default -> STABLE;
        };
    }
}
