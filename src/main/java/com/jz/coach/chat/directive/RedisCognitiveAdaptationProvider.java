package com.jz.coach.chat.directive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.coach.config.CognitiveProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCognitiveAdaptationProvider implements CognitiveAdaptationProvider {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final CognitiveProperties props;

    @Override
    public Optional<CognitiveAdaptations> adaptationsFor(String userKey) {
        if (userKey == null || userKey.isBlank()) return Optional.empty();
        try {
            String raw = redis.opsForValue().get(props.getRedisKeyPrefix() + userKey);
            if (raw == null || raw.isBlank()) return Optional.empty();
            return Optional.ofNullable(mapper.readValue(raw, CognitiveAdaptations.class));
        } catch (Exception e) {
            log.warn("[Cognitive] load adaptations failed, use defaults. userKey={}, err={}", userKey, e.toString());
            return Optional.empty();
        }
    }
}
