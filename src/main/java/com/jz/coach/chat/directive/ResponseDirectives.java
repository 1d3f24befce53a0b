package com.jz.coach.chat.directive;

import com.jz.coach.chat.signal.StockPhrases;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 下一次模型调用的行为指令（每轮生成一次，编译成提示词后即丢弃）。
 * 约束：allowQuestions=false 当且仅当 maxQuestions=0。
 */
@Data
public class ResponseDirectives {
    // 时序
    private int artificialDelayMs = 500;

    // 内容形态
    private ResponseLength maxLength = ResponseLength.MODERATE;
    private ResponseTone tone = ResponseTone.WARM;
    private boolean allowQuestions = true;
    private int maxQuestions = 2;

    // 记忆
    private boolean allowMemoryCallback = true;
    private MemoryCallbackStyle memoryCallbackStyle = MemoryCallbackStyle.SUBTLE;

    // 特殊行为
    private boolean insertAntiDependencyNudge;
    private boolean insertBreathingPrompt;
    private boolean suggestBreak;

    private List<String> avoidPhrases = new ArrayList<>(StockPhrases.AVOID);

    private OpeningStyle openingStyle = OpeningStyle.CONTINUE;

    private CognitiveAdaptations cognitiveAdaptations = CognitiveAdaptations.defaults();

    /** 默认指令：500ms、适中、温暖、最多 2 个问题、允许含蓄回调 */
    public static ResponseDirectives defaults() {
        return new ResponseDirectives();
    }

    /** 关掉提问（问题数同步归零） */
    public void disallowQuestions() {
        this.allowQuestions = false;
        this.maxQuestions = 0;
    }

    /** 关掉记忆回调（回调方式同步置为 none） */
    public void disallowMemoryCallback() {
        this.allowMemoryCallback = false;
        this.memoryCallbackStyle = MemoryCallbackStyle.NONE;
    }
}
