package com.jz.coach.chat.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.coach.chat.signal.UserMood;
import com.jz.coach.config.ContextProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * 会话结束记录：STRING + JSON + TTL
 * Key 形如：{sessionKeyPrefix}{userKey}，例如 coach:session:last:u:1001
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisSessionStore implements SessionStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final ContextProperties props;
    private final Clock clock;

    private String key(String userKey) { return props.getSessionKeyPrefix() + userKey; }

    @Override
    public Optional<SessionEndRecord> findLastSessionEnd(String userKey) {
        if (userKey == null || userKey.isBlank()) return Optional.empty();
        try {
            String raw = redis.opsForValue().get(key(userKey));
            if (raw == null || raw.isBlank()) return Optional.empty();
            SessionEndRecord r = mapper.readValue(raw, SessionEndRecord.class);
            return Optional.ofNullable(r).filter(x -> x.getEndTime() != null);
        } catch (Exception e) {
            // 读失败按“无记录”处理，不影响本轮
            log.warn("[SessionStore] read failed, fallback to defaults. userKey={}, err={}", userKey, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public void saveSessionEnd(String userKey, UserMood mood) {
        if (userKey == null || userKey.isBlank()) return;
        SessionEndRecord r = new SessionEndRecord(clock.instant(), mood == null ? UserMood.NEUTRAL : mood);
        try {
            long days = Math.max(1, props.getSessionTtlDays());
            redis.opsForValue().set(key(userKey), mapper.writeValueAsString(r), Duration.ofDays(days));
        } catch (Exception e) {
            log.warn("[SessionStore] write failed. userKey={}, err={}", userKey, e.toString());
        }
    }
}
