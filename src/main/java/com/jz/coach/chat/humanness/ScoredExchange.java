package com.jz.coach.chat.humanness;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * 已打分的一轮交互（训练样本）。写入后不可变，只会因环形缓冲溢出被淘汰。
 */
@Value
@Builder
@Jacksonized
public class ScoredExchange {
    String id;
    Instant timestamp;
    String userMessage;
    String aiResponse;
    ContextSnapshot context;
    HumannessScore score;
    ScoredBy scoredBy;
}
