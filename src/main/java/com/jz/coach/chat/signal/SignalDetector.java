package com.jz.coach.chat.signal;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单条消息的信号识别：沉重话题 / 精力 / 情绪 / 话题标签。
 * 纯函数，无状态、无 IO，可并发调用。
 */
public final class SignalDetector {
    private SignalDetector() {}

    // --- 沉重话题：关键词 + 句式 ---
    static final List<String> HEAVY_KEYWORDS = List.of(
            "suicide", "kill myself", "end it", "don't want to live",
            "hopeless", "worthless", "nobody cares", "better off without me",
            "panic", "can't breathe", "heart racing", "going to die",
            "abuse", "assault", "trauma", "nightmare",
            "breakup", "divorce", "cheated", "left me",
            "fired", "lost my job", "failed", "ruined",
            "died", "death", "funeral", "cancer", "diagnosis"
    );
    private static final List<Pattern> HEAVY_PATTERNS = List.of(
            Pattern.compile("i (want to|wanna) (die|disappear|give up)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("no (point|reason) (to|in) (living|life|anything)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("can't (take|handle|do) (it|this) anymore", Pattern.CASE_INSENSITIVE),
            Pattern.compile("everything is (falling apart|ruined|over)", Pattern.CASE_INSENSITIVE)
    );

    // --- 精力词表（"..." 与 "!" 单独计数，不放进词表） ---
    private static final List<String> LOW_ENERGY = List.of(
            "tired", "exhausted", "drained", "no energy", "can't think",
            "just want to sleep", "so done", "over it", "whatever",
            "ugh", "meh", "idk", "don't care", "nothing matters",
            "nm", "fine", "ok", "k"
    );
    private static final List<String> HIGH_ENERGY = List.of(
            "excited", "amazing", "incredible", "can't wait", "so happy",
            "finally", "omg", "awesome", "let's go",
            "haha", "lol", "love", "best"
    );

    // --- 情绪词表（按优先级检查） ---
    private static final List<String> ANXIETY_WORDS = List.of(
            "worried", "anxious", "nervous", "scared", "afraid", "panic", "stress", "overwhelm");
    private static final List<String> POSITIVE_WORDS = List.of(
            "happy", "excited", "great", "good", "better", "amazing", "wonderful", "love");
    private static final List<String> CALM_WORDS = List.of(
            "peaceful", "calm", "relaxed", "okay", "fine", "alright", "settled");

    // --- 话题：关键词 -> 标签 ---
    private static final Map<String, String> TOPIC_KEYWORDS = new LinkedHashMap<>();
    static {
        for (String k : List.of("work", "job", "boss", "coworker", "office")) TOPIC_KEYWORDS.put(k, "work");
        for (String k : List.of("relationship", "partner", "boyfriend", "girlfriend", "husband", "wife"))
            TOPIC_KEYWORDS.put(k, "relationships");
        for (String k : List.of("family", "mom", "dad", "parent", "sibling", "brother", "sister"))
            TOPIC_KEYWORDS.put(k, "family");
        for (String k : List.of("sleep", "insomnia", "tired", "nightmare")) TOPIC_KEYWORDS.put(k, "sleep");
        for (String k : List.of("health", "sick", "doctor")) TOPIC_KEYWORDS.put(k, "health");
        for (String k : List.of("therapy", "therapist", "medication")) TOPIC_KEYWORDS.put(k, "mental_health");
        TOPIC_KEYWORDS.put("anxiety", "anxiety");
        TOPIC_KEYWORDS.put("depression", "depression");
        for (String k : List.of("money", "bills", "debt")) TOPIC_KEYWORDS.put(k, "finances");
        for (String k : List.of("school", "college", "exam", "study")) TOPIC_KEYWORDS.put(k, "education");
    }

    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern ELLIPSIS = Pattern.compile("\\.\\.\\.");
    private static final Map<String, Pattern> WORD_PATTERNS = new ConcurrentHashMap<>();

    /** 命中任一危机关键词或句式即为 true（无分级） */
    public static boolean detectHeavyTopic(String message) {
        String s = normalize(message);
        if (s.isEmpty()) return false;
        String lower = s.toLowerCase(Locale.ROOT);
        for (String k : HEAVY_KEYWORDS) {
            if (lower.contains(k)) return true;
        }
        for (Pattern p : HEAVY_PATTERNS) {
            if (p.matcher(s).find()) return true;
        }
        return false;
    }

    public static UserEnergy detectUserEnergy(String message) {
        String s = normalize(message);
        // 很短且没有感叹号：大概率是没精力
        if (wordCount(s) <= 3 && s.indexOf('!') < 0) {
            return UserEnergy.LOW;
        }
        String lower = s.toLowerCase(Locale.ROOT);
        int low = countHits(lower, LOW_ENERGY) + count(ELLIPSIS, s);
        int high = countHits(lower, HIGH_ENERGY) + countChar(s, '!');

        if (low > high + 1) return UserEnergy.LOW;
        if (high > low + 1) return UserEnergy.HIGH;
        return UserEnergy.MEDIUM;
    }

    public static UserMood detectUserMood(String message) {
        if (detectHeavyTopic(message)) return UserMood.DISTRESSED;
        String lower = normalize(message).toLowerCase(Locale.ROOT);
        if (containsAny(lower, ANXIETY_WORDS)) return UserMood.ANXIOUS;
        if (containsAny(lower, POSITIVE_WORDS)) return UserMood.POSITIVE;
        if (containsAny(lower, CALM_WORDS)) return UserMood.CALM;
        return UserMood.NEUTRAL;
    }

    /** 关键词查表得到话题标签，去重且保持首次出现顺序 */
    public static Set<String> extractTopics(String message) {
        String lower = normalize(message).toLowerCase(Locale.ROOT);
        Set<String> out = new LinkedHashSet<>();
        if (lower.isEmpty()) return out;
        for (var e : TOPIC_KEYWORDS.entrySet()) {
            if (lower.contains(e.getKey())) out.add(e.getValue());
        }
        return out;
    }

    /** 回复中出现的套话（大小写不敏感），按词表顺序返回 */
    public static List<String> detectStockPhrases(String text) {
        String lower = normalize(text).toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        if (lower.isEmpty()) return found;
        for (String p : StockPhrases.AVOID) {
            if (lower.contains(p.toLowerCase(Locale.ROOT))) found.add(p);
        }
        return found;
    }

    public static int wordCount(String text) {
        if (text == null) return 0;
        String t = text.trim();
        return t.isEmpty() ? 0 : WS.split(t).length;
    }

    // ========= 辅助 =========

    /** 弯引号统一成直引号，null 视为空串 */
    static String normalize(String s) {
        if (s == null) return "";
        return s.replace('’', '\'').replace('‘', '\'');
    }

    private static boolean containsAny(String lower, List<String> words) {
        for (String w : words) if (lower.contains(w)) return true;
        return false;
    }

    /** 单词条目按整词匹配（避免 "k" 命中任何带 k 的词），短语按子串匹配 */
    private static int countHits(String lower, List<String> lexicon) {
        int n = 0;
        for (String k : lexicon) {
            boolean hit = k.indexOf(' ') >= 0 || k.indexOf('\'') >= 0
                    ? lower.contains(k)
                    : wholeWord(k).matcher(lower).find();
            if (hit) n++;
        }
        return n;
    }

    private static Pattern wholeWord(String w) {
        return WORD_PATTERNS.computeIfAbsent(w, k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b"));
    }

    private static int count(Pattern p, String s) {
        Matcher m = p.matcher(s);
        int n = 0;
        while (m.find()) n++;
        return n;
    }

    private static int countChar(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == c) n++;
        return n;
    }
}
