package com.jz.coach.chat.humanness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.coach.config.EvaluatorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 用 ChatClient 调模型按固定评分表打分，严格要求 JSON 输出。
 * 形状不符（缺字段、越界、非数字）一律视为失败，不做兜底猜测。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmQualityEvaluator implements QualityEvaluator {

    private final Map<String, ChatClient> chatClientMap;
    private final EvaluatorProperties props;
    private final ObjectMapper mapper;

    private static final String RUBRIC = """
You are evaluating an AI coach's response for "human-ness".
Score how natural and human the response feels, NOT whether it is helpful or correct.

SCORING RUBRIC (100 points total):
1. naturalLanguage (0-15): sounds like a real person; natural contractions and flow. Deduct bullet points, numbered lists, overly organized text.
2. emotionalTiming (0-20): matches the emotional moment. Heavy topic = pause and gentleness; light topic = quicker and lighter. Deduct peppy replies to a user who is down.
3. brevityControl (0-15): length fits. Short or low-energy user messages get shorter replies. Deduct walls of text and over-explaining.
4. memoryUse (0-15): references to the past are subtle and rare. Deduct creepy recall, verbatim quotes, forced callbacks.
5. imperfection (0-10): allows uncertainty; does not always have the answer.
6. personalityConsistency (0-15): a consistent, distinct voice rather than a generic one.
7. avoidedStockPhrases (0-10): no "I understand how you feel", "That's completely valid", "Thank you for sharing", "I hear you", no starting with "I". Deduct heavily for each one.

RESPOND WITH JSON ONLY:
{
  "total": <1-100>,
  "breakdown": {
    "naturalLanguage": <0-15>,
    "emotionalTiming": <0-20>,
    "brevityControl": <0-15>,
    "memoryUse": <0-15>,
    "imperfection": <0-10>,
    "personalityConsistency": <0-15>,
    "avoidedStockPhrases": <0-10>
  },
  "issues": ["<specific issue>"],
  "suggestions": ["<specific improvement>"]
}
""";

    private ChatClient client() {
        return Optional.ofNullable(chatClientMap.get(props.getModel()))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    @Override
    public Optional<HumannessScore> evaluate(ScoringRequest req) {
        if (!props.isEnabled() || chatClientMap.isEmpty()) return Optional.empty();

        ContextSnapshot c = req.context();
        String user = """
USER MESSAGE: "%s"
AI RESPONSE: "%s"

CONTEXT:
- User energy level: %s
- User mood: %s
- Message # in conversation: %d
- Time of day (hour): %d

Only output JSON.
""".formatted(req.userMessage(), req.aiResponse(),
                c.getUserEnergy().code(), c.getUserMood().code(), c.getMessageCount(), c.getHourOfDay());

        try {
            String out = client().prompt()
                    .system(RUBRIC)
                    .user(user)
                    .call()
                    .content();
            Optional<HumannessScore> parsed = parse(out);
            if (parsed.isEmpty()) {
                log.warn("[Evaluator] malformed result dropped. head={}", head(out));
            }
            return parsed;
        } catch (Exception e) {
            log.warn("[Evaluator] call failed, dropped. err={}", e.toString());
            return Optional.empty();
        }
    }

    /** 裁剪出 { ... } 再按固定形状校验 */
    Optional<HumannessScore> parse(String out) {
        if (out == null || out.isBlank()) return Optional.empty();
        int b = out.indexOf('{'), e = out.lastIndexOf('}');
        if (b < 0 || e < b) return Optional.empty();
        try {
            JsonNode root = mapper.readTree(out.substring(b, e + 1));
            JsonNode total = root.get("total");
            if (!isInt(total) || total.asInt() < 1 || total.asInt() > 100) return Optional.empty();

            JsonNode bd = root.get("breakdown");
            if (bd == null || !bd.isObject()) return Optional.empty();
            for (String k : List.of("naturalLanguage", "emotionalTiming", "brevityControl", "memoryUse",
                    "imperfection", "personalityConsistency", "avoidedStockPhrases")) {
                if (!isInt(bd.get(k))) return Optional.empty();
            }
            HumannessBreakdown breakdown = HumannessBreakdown.builder()
                    .naturalLanguage(bd.get("naturalLanguage").asInt())
                    .emotionalTiming(bd.get("emotionalTiming").asInt())
                    .brevityControl(bd.get("brevityControl").asInt())
                    .memoryUse(bd.get("memoryUse").asInt())
                    .imperfection(bd.get("imperfection").asInt())
                    .personalityConsistency(bd.get("personalityConsistency").asInt())
                    .avoidedStockPhrases(bd.get("avoidedStockPhrases").asInt())
                    .build();
            if (!breakdown.isWithinCaps()) return Optional.empty();

            List<String> issues = strings(root.get("issues"));
            List<String> suggestions = strings(root.get("suggestions"));
            if (issues == null || suggestions == null) return Optional.empty();

            return Optional.of(HumannessScore.builder()
                    .total(total.asInt())
                    .breakdown(breakdown)
                    .issues(issues)
                    .suggestions(suggestions)
                    .build());
        } catch (Exception ex) {
            return Optional.empty();
        }
    }

    private static boolean isInt(JsonNode n) {
        return n != null && n.isIntegralNumber() && n.canConvertToInt();
    }

    /** 必须是字符串数组；否则返回 null 表示形状不符 */
    private static List<String> strings(JsonNode n) {
        if (n == null || !n.isArray()) return null;
        List<String> out = new ArrayList<>(n.size());
        for (JsonNode x : n) {
            if (!x.isTextual()) return null;
            out.add(x.asText());
        }
        return out;
    }

    private static String head(String s) {
        if (s == null) return "null";
        return s.length() <= 120 ? s : s.substring(0, 120) + "...";
    }
}
