package com.jz.coach.chat.humanness;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScoredBy {
    LOCAL, EVALUATOR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScoredBy fromCode(String code) {
        return "evaluator".equalsIgnoreCase(code == null ? "" : code.trim()) ? EVALUATOR : LOCAL;
    }
}
