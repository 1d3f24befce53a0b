package com.jz.coach.chat.humanness;

import java.util.Optional;

/** 外部高精度评估器：成功返回结构化评分；网络/解析/形状不符一律 empty */
public interface QualityEvaluator {
    Optional<HumannessScore> evaluate(ScoringRequest request);
}
