package com.jz.coach.chat.humanness;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 七个维度的分项，各维上限合计 100。
 * 本地打分的分项由总分按上限比例摊分得到（不是逐维独立打分），评估模型则逐维给分。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HumannessBreakdown {
    public static final int NATURAL_LANGUAGE_MAX = 15;
    public static final int EMOTIONAL_TIMING_MAX = 20;
    public static final int BREVITY_CONTROL_MAX = 15;
    public static final int MEMORY_USE_MAX = 15;
    public static final int IMPERFECTION_MAX = 10;
    public static final int PERSONALITY_CONSISTENCY_MAX = 15;
    public static final int AVOIDED_STOCK_PHRASES_MAX = 10;

    private int naturalLanguage;        // 不机械
    private int emotionalTiming;        // 情绪时机
    private int brevityControl;         // 长度克制
    private int memoryUse;              // 回调不过界
    private int imperfection;           // 允许不确定
    private int personalityConsistency; // 人设一致
    private int avoidedStockPhrases;    // 避开套话

    /** 按各维上限比例摊分总分：min(cap, floor(total * cap / 100)) */
    public static HumannessBreakdown proportional(int total) {
        return HumannessBreakdown.builder()
                .naturalLanguage(share(total, NATURAL_LANGUAGE_MAX))
                .emotionalTiming(share(total, EMOTIONAL_TIMING_MAX))
                .brevityControl(share(total, BREVITY_CONTROL_MAX))
                .memoryUse(share(total, MEMORY_USE_MAX))
                .imperfection(share(total, IMPERFECTION_MAX))
                .personalityConsistency(share(total, PERSONALITY_CONSISTENCY_MAX))
                .avoidedStockPhrases(share(total, AVOIDED_STOCK_PHRASES_MAX))
                .build();
    }

    /** 各维都落在 [0, 上限] 内 */
    @JsonIgnore
    public boolean isWithinCaps() {
        return in(naturalLanguage, NATURAL_LANGUAGE_MAX)
                && in(emotionalTiming, EMOTIONAL_TIMING_MAX)
                && in(brevityControl, BREVITY_CONTROL_MAX)
                && in(memoryUse, MEMORY_USE_MAX)
                && in(imperfection, IMPERFECTION_MAX)
                && in(personalityConsistency, PERSONALITY_CONSISTENCY_MAX)
                && in(avoidedStockPhrases, AVOIDED_STOCK_PHRASES_MAX);
    }

    @JsonIgnore
    public int getSum() {
        return naturalLanguage + emotionalTiming + brevityControl + memoryUse
                + imperfection + personalityConsistency + avoidedStockPhrases;
    }

    private static int share(int total, int cap) {
        int t = Math.max(0, total);
        return Math.min(cap, t * cap / 100);
    }

    private static boolean in(int v, int cap) { return v >= 0 && v <= cap; }
}
