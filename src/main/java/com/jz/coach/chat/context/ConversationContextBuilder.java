package com.jz.coach.chat.context;

import com.jz.coach.chat.signal.SignalDetector;
import com.jz.coach.chat.signal.StockPhrases;
import com.jz.coach.config.ContextProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.*;

/**
 * 由“历史轮次 + 最新消息 + 上次会话结束记录”组装 {@link ConversationContext}。
 * 任何输入缺失都回退默认值，不抛给调用方。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationContextBuilder {

    private final SessionStore sessionStore;
    private final ContextProperties props;
    private final Clock clock;

    public ConversationContext build(String userKey, String sessionId,
                                     List<ChatTurn> history, String lastUserMessage) {
        Instant now = clock.instant();
        ZonedDateTime local = now.atZone(clock.getZone());
        List<ChatTurn> turns = history == null ? List.of() : history;
        String msg = lastUserMessage == null ? "" : lastUserMessage.trim();

        // 1) 上次会话：间隔 + 情绪
        Optional<SessionEndRecord> last = Optional.empty();
        try {
            last = sessionStore.findLastSessionEnd(userKey).filter(r -> r.getEndTime() != null);
        } catch (Exception e) {
            log.warn("[Context] session store unavailable, use defaults. userKey={}, err={}", userKey, e.toString());
        }
        double hours = last.map(r -> hoursBetween(r.getEndTime(), now))
                .orElse(props.getDefaultHoursSinceLastSession());

        // 2) 用户发言序列（最新一条若还没在历史末尾，则补上）
        List<String> userTexts = new ArrayList<>();
        for (ChatTurn t : turns) {
            if (t != null && t.isUser()) userTexts.add(t.safeText());
        }
        if (!msg.isEmpty() && !endsWithUserMessage(turns, msg)) userTexts.add(msg);

        // 3) 最近 N 条用户发言的话题，去重
        int window = Math.max(1, props.getTopicWindow());
        Set<String> topics = new LinkedHashSet<>();
        for (String text : userTexts.subList(Math.max(0, userTexts.size() - window), userTexts.size())) {
            topics.addAll(SignalDetector.extractTopics(text));
        }

        // 4) 助手轮次里的记忆回调：每轮最多计 1 次
        int callbacks = 0;
        int lastCallbackTurn = -1;
        int assistantIdx = 0;
        for (ChatTurn t : turns) {
            if (t == null || t.isUser()) continue;
            String lower = t.safeText().toLowerCase(Locale.ROOT);
            for (String phrase : StockPhrases.MEMORY_CALLBACK) {
                if (lower.contains(phrase)) {
                    callbacks++;
                    lastCallbackTurn = assistantIdx;
                    break;
                }
            }
            assistantIdx++;
        }

        return ConversationContext.builder()
                .sessionId(sessionId)
                .messageCount(userTexts.size())
                .sessionStartTime(now)
                .userEnergy(SignalDetector.detectUserEnergy(msg))
                .userMood(SignalDetector.detectUserMood(msg))
                .heavyTopic(SignalDetector.detectHeavyTopic(msg))
                .lastUserMessage(msg)
                .recentTopics(topics)
                .timeSinceLastSession(hours)
                .lastSessionMood(last.map(SessionEndRecord::getMood).orElse(null))
                .dayOfWeek(local.getDayOfWeek().getValue())
                .hourOfDay(local.getHour())
                .recentMemoryCallbacks(callbacks)
                .lastMemoryCallbackTurn(lastCallbackTurn)
                .build();
    }

    private static boolean endsWithUserMessage(List<ChatTurn> turns, String msg) {
        if (turns.isEmpty()) return false;
        ChatTurn tail = turns.get(turns.size() - 1);
        return tail != null && tail.isUser() && msg.equals(tail.safeText().trim());
    }

    /** 时钟回拨等异常情况下不出现负数 */
    private static double hoursBetween(Instant from, Instant to) {
        long millis = Duration.between(from, to).toMillis();
        return Math.max(0, millis / 3_600_000.0);
    }
}
