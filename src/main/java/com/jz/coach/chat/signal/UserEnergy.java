package com.jz.coach.chat.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 用户精力档位（由单条消息推断） */
public enum UserEnergy {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 未知值按 MEDIUM 处理 */
    @JsonCreator
    public static UserEnergy fromCode(String code) {
        if (code == null) return MEDIUM;
        return switch (code.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "high" -> HIGH;
            default -> MEDIUM;
        };
    }
}
