package com.jz.coach.chat.directive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 提问类型（来自认知画像） */
public enum QuestionType {
    OPEN, SPECIFIC, REFLECTIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QuestionType fromCode(String code) {
        if (code == null) return OPEN;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "specific" -> SPECIFIC;
            case "reflective" -> REFLECTIVE;
            default -> OPEN;
        };
    }
}
