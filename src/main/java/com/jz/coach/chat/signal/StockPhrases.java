package com.jz.coach.chat.signal;

import java.util.List;

/**
 * 固定词表：机器味套话 / 过度认同词 / 记忆回调触发语。
 * 指令生成、本地打分、上下文构建共用同一份。
 */
public final class StockPhrases {
    private StockPhrases() {}

    /** 让回复显得像机器人的套话，任何情况下都不要用 */
    public static final List<String> AVOID = List.of(
            "I understand",
            "I hear you",
            "That's completely valid",
            "That's totally understandable",
            "It's okay to feel",
            "Thank you for sharing",
            "I appreciate you opening up",
            "That must be really hard",
            "I'm here for you",
            "You're not alone",
            "Take all the time you need",
            "There's no right or wrong way to feel",
            "Your feelings are valid",
            "I want you to know",
            "First of all",
            "Let me just say"
    );

    /** 认同类用语：一条回复里出现超过 1 个即视为过度认同 */
    public static final List<String> VALIDATION = List.of(
            "valid", "understandable", "makes sense", "natural to feel"
    );

    /** 助手提到“过去”的触发语（小写） */
    public static final List<String> MEMORY_CALLBACK = List.of(
            "you mentioned", "earlier you", "you said", "remember when", "last time"
    );
}
