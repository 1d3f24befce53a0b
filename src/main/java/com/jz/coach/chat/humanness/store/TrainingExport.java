package com.jz.coach.chat.humanness.store;

import com.jz.coach.chat.humanness.ScoredExchange;

import java.time.Instant;
import java.util.List;

/** 离线训练导出：统计 + 全部样本（旧→新） */
public record TrainingExport(Instant exportDate, ScoreStats stats, List<ScoredExchange> exchanges) {}
