package com.jz.coach.chat.directive;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.signal.SignalDetector;
import com.jz.coach.chat.signal.UserEnergy;
import com.jz.coach.chat.signal.UserMood;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 规则引擎：从默认指令出发，按固定顺序逐组改写，后写覆盖先写。
 * 顺序即契约：
 * 1 时序 → 2 精力 → 3 情绪 → 4 时间感知 → 5 记忆回调限流 → 6 防依赖 → 7 长度收紧 → 8 认知画像合并 → 9 归一化
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectiveGenerator {

    static final int DEFAULT_DELAY_MS = 500;
    static final int QUICK_DELAY_MS = 300;
    static final int HEAVY_DELAY_MS = 2000;

    private final CognitiveAdaptationProvider adaptationProvider;

    /** 画像从 provider 取；取不到用安全默认 */
    public ResponseDirectives generate(ConversationContext ctx, String userKey) {
        CognitiveAdaptations hints = null;
        try {
            hints = adaptationProvider.adaptationsFor(userKey).orElse(null);
        } catch (Exception e) {
            log.warn("[Directive] cognitive adaptations unavailable, use defaults. userKey={}, err={}", userKey, e.toString());
        }
        return generate(ctx, hints);
    }

    public ResponseDirectives generate(ConversationContext ctx, CognitiveAdaptations hints) {
        ResponseDirectives d = ResponseDirectives.defaults();
        String msg = ctx.getLastUserMessage() == null ? "" : ctx.getLastUserMessage();
        int words = SignalDetector.wordCount(msg);
        boolean heavy = ctx.isHeavyTopic() || SignalDetector.detectHeavyTopic(msg);

        applyTiming(d, words, heavy);
        applyEnergy(d, ctx.getUserEnergy());
        applyMood(d, heavy ? UserMood.DISTRESSED : ctx.getUserMood(), ctx.getUserEnergy());
        applyTemporal(d, ctx);
        applyMemoryThrottle(d, ctx);
        applyAntiDependency(d, ctx.getMessageCount());
        clampLength(d, words);
        d.setCognitiveAdaptations(hints == null ? CognitiveAdaptations.defaults() : hints.toBuilder().build());
        normalizeQuestions(d);

        if (log.isDebugEnabled()) {
            log.debug("[Directive] session={} turn={} energy={} mood={} -> tone={} len={} q={} mem={} delay={}ms",
                    ctx.getSessionId(), ctx.getMessageCount(), ctx.getUserEnergy(), ctx.getUserMood(),
                    d.getTone(), d.getMaxLength(), d.getMaxQuestions(), d.isAllowMemoryCallback(), d.getArtificialDelayMs());
        }
        return d;
    }

    // ========== 1) 时序：短消息先写，沉重话题后写，保证沉重话题胜出 ==========
    private void applyTiming(ResponseDirectives d, int words, boolean heavy) {
        if (words <= 5) {
            d.setArtificialDelayMs(QUICK_DELAY_MS);
        }
        if (heavy) {
            d.setArtificialDelayMs(HEAVY_DELAY_MS);
            d.setTone(ResponseTone.GENTLE);
            d.setMaxLength(ResponseLength.BRIEF);   // 危机时不说教
            d.disallowQuestions();                  // 不追问
        }
    }

    // ========== 2) 精力匹配 ==========
    private void applyEnergy(ResponseDirectives d, UserEnergy energy) {
        if (energy == UserEnergy.LOW) {
            d.setTone(ResponseTone.GENTLE);
            d.setMaxLength(ResponseLength.BRIEF);
            d.disallowQuestions();
        } else if (energy == UserEnergy.HIGH) {
            d.setTone(ResponseTone.ENERGETIC);
            d.setArtificialDelayMs(QUICK_DELAY_MS);
        }
    }

    // ========== 3) 情绪 ==========
    private void applyMood(ResponseDirectives d, UserMood mood, UserEnergy energy) {
        if (mood == UserMood.DISTRESSED) {
            d.setTone(ResponseTone.GENTLE);
            d.setMaxLength(ResponseLength.BRIEF);
            d.setInsertBreathingPrompt(true);
            d.disallowMemoryCallback();             // 只关注当下
        } else if (mood == UserMood.ANXIOUS) {
            d.setTone(ResponseTone.GENTLE);
            d.setMaxQuestions(Math.min(d.getMaxQuestions(), 1));
        } else if (mood == UserMood.POSITIVE && energy == UserEnergy.HIGH) {
            d.setTone(ResponseTone.PLAYFUL);
        }
    }

    // ========== 4) 时间感知 ==========
    private void applyTemporal(ResponseDirectives d, ConversationContext ctx) {
        double gap = ctx.getTimeSinceLastSession();
        if (gap > 8 && gap < 24 && ctx.getLastSessionMood() == UserMood.DISTRESSED) {
            d.setOpeningStyle(OpeningStyle.GENTLE_CHECKIN);
        }
        if (gap > 48) {
            d.setOpeningStyle(OpeningStyle.GENTLE_CHECKIN);
        }
        int hour = ctx.getHourOfDay();
        if (hour >= 22 || hour <= 4) {             // 深夜 22:00 ~ 04:59
            d.setTone(ResponseTone.GENTLE);
            d.setMaxLength(ResponseLength.BRIEF);
        }
    }

    // ========== 5) 记忆回调限流：任一条件满足即关闭 ==========
    private void applyMemoryThrottle(ResponseDirectives d, ConversationContext ctx) {
        int turn = ctx.getMessageCount();
        int last = ctx.getLastMemoryCallbackTurn();
        boolean tooMany = ctx.getRecentMemoryCallbacks() >= 2;
        boolean tooEarly = turn < 3;
        boolean backToBack = last >= 0 && last >= turn - 2;
        if (tooMany || tooEarly || backToBack) {
            d.disallowMemoryCallback();
        }
    }

    // ========== 6) 防依赖 ==========
    private void applyAntiDependency(ResponseDirectives d, int turn) {
        if (turn >= 10 && turn % 5 == 0) {
            d.setInsertAntiDependencyNudge(true);
        }
        if (turn >= 20) {
            d.setSuggestBreak(true);
        }
    }

    // ========== 7) 用户话少则回复不展开（只降不升） ==========
    private void clampLength(ResponseDirectives d, int words) {
        if (words <= 10 && d.getMaxLength() == ResponseLength.DETAILED) {
            d.setMaxLength(ResponseLength.MODERATE);
        }
    }

    // ========== 9) 归一化：allowQuestions=false ⇔ maxQuestions=0 ==========
    private void normalizeQuestions(ResponseDirectives d) {
        if (!d.isAllowQuestions() || d.getMaxQuestions() <= 0) {
            d.disallowQuestions();
        }
    }
}
