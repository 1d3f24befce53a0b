package com.jz.coach.chat.humanness;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.signal.SignalDetector;
import com.jz.coach.chat.signal.StockPhrases;
import com.jz.coach.chat.signal.UserEnergy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 本地快速打分：从 100 起扣分，确定性、同步、不走网络。
 * 分项由总分按上限比例摊分，与评估模型的结果保持同一形状。
 */
@Component
public class LocalHumannessScorer {

    static final int STOCK_PHRASE_PENALTY = 10;
    static final int LEADING_I_PENALTY = 5;
    static final int VERBOSE_PENALTY = 15;
    static final int QUESTION_PENALTY = 10;
    static final int OVER_VALIDATION_PENALTY = 10;
    static final int ENERGY_MISMATCH_PENALTY = 15;

    /** 低精力用户能接受的最长回复（词数） */
    static final int LOW_ENERGY_MAX_WORDS = 50;

    // "I ..." / "I'm ..." 开头
    private static final Pattern LEADING_I = Pattern.compile("^I(\\s|'|’)");

    public HumannessScore score(String userMessage, String aiResponse, ConversationContext ctx) {
        return score(userMessage, aiResponse, ctx == null ? null : ctx.getUserEnergy());
    }

    public HumannessScore score(ScoringRequest req) {
        return score(req.userMessage(), req.aiResponse(), req.context().getUserEnergy());
    }

    public HumannessScore score(String userMessage, String aiResponse, UserEnergy userEnergy) {
        String resp = aiResponse == null ? "" : aiResponse.trim();
        boolean lowUser = userEnergy == UserEnergy.LOW;
        int score = 100;
        List<String> issues = new ArrayList<>();

        // 1) 套话：每条 -10
        List<String> ticks = SignalDetector.detectStockPhrases(resp);
        if (!ticks.isEmpty()) {
            score -= ticks.size() * STOCK_PHRASE_PENALTY;
            issues.add("Stock phrases: " + String.join(", ", ticks));
        }

        // 2) 以 "I" 开头
        if (LEADING_I.matcher(resp).find()) {
            score -= LEADING_I_PENALTY;
            issues.add("Starts with \"I\"");
        }

        // 3) 低精力用户 + 回复太长
        if (lowUser && SignalDetector.wordCount(resp) > LOW_ENERGY_MAX_WORDS) {
            score -= VERBOSE_PENALTY;
            issues.add("Too verbose for low-energy user");
        }

        // 4) 低精力用户 + 还在提问
        if (lowUser && resp.indexOf('?') >= 0) {
            score -= QUESTION_PENALTY;
            issues.add("Asked questions when user is low energy");
        }

        // 5) 过度认同
        String lower = resp.toLowerCase(Locale.ROOT);
        int validations = 0;
        for (String p : StockPhrases.VALIDATION) {
            if (lower.contains(p)) validations++;
        }
        if (validations > 1) {
            score -= OVER_VALIDATION_PENALTY;
            issues.add("Over-validation");
        }

        // 6) 精力错配：用户低、回复高
        if (lowUser && SignalDetector.detectUserEnergy(resp) == UserEnergy.HIGH) {
            score -= ENERGY_MISMATCH_PENALTY;
            issues.add("Energy mismatch: user low, response high");
        }

        int total = Math.max(0, score);
        List<String> suggestions = new ArrayList<>(issues.size());
        for (String i : issues) suggestions.add("Fix: " + i);

        return HumannessScore.builder()
                .total(total)
                .breakdown(HumannessBreakdown.proportional(total))
                .issues(issues)
                .suggestions(suggestions)
                .build();
    }
}
