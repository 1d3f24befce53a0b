package com.jz.coach.chat.humanness.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.coach.chat.humanness.ScoredExchange;
import com.jz.coach.config.HumannessProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Redis 布局：
 * - {prefix}exchanges ：LIST + JSON，RPUSH 后 LTRIM 到最近 capacity 条（旧→新）
 * - {prefix}stats     ：STRING + JSON
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class RedisExchangeSnapshotRepository implements ExchangeSnapshotRepository {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final HumannessProperties props;

    private String exchangesKey() { return props.getRedisKeyPrefix() + "exchanges"; }
    private String statsKey() { return props.getRedisKeyPrefix() + "stats"; }

    @Override
    public List<ScoredExchange> loadExchanges(int capacity) {
        List<String> page = redis.opsForList().range(exchangesKey(), -Math.max(1, capacity), -1);
        if (page == null || page.isEmpty()) return List.of();
        List<ScoredExchange> out = new ArrayList<>(page.size());
        for (String j : page) {
            try {
                out.add(mapper.readValue(j, ScoredExchange.class));
            } catch (Exception e) {
                log.warn("[ExchangeRepo] bad json ignored: {}", e.getMessage());
            }
        }
        return out;
    }

    @Override
    public Optional<ScoreStats> loadStats() {
        String raw = redis.opsForValue().get(statsKey());
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(raw, ScoreStats.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stats json unreadable", e);
        }
    }

    @Override
    public void appendExchange(ScoredExchange exchange, int capacity) {
        String json;
        try {
            json = mapper.writeValueAsString(exchange);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("exchange not serializable: " + exchange.getId(), e);
        }
        redis.opsForList().rightPush(exchangesKey(), json);
        redis.opsForList().trim(exchangesKey(), -Math.max(1, capacity), -1);
    }

    @Override
    public void saveStats(ScoreStats stats) {
        try {
            redis.opsForValue().set(statsKey(), mapper.writeValueAsString(stats));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stats not serializable", e);
        }
    }
}
