package com.jz.coach.chat.directive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 引用过往对话的方式 */
public enum MemoryCallbackStyle {
    SUBTLE, EXPLICIT, NONE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MemoryCallbackStyle fromCode(String code) {
        if (code == null) return SUBTLE;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "explicit" -> EXPLICIT;
            case "none" -> NONE;
            default -> SUBTLE;
        };
    }
}
