package com.jz.coach.chat.humanness.store;

import com.jz.coach.chat.humanness.ScoredExchange;

import java.util.List;
import java.util.Optional;

/** 打分样本与统计的持久化（KV 存储）。读失败由实现抛出，调用方回退空状态 */
public interface ExchangeSnapshotRepository {

    /** 读取最近 capacity 条，旧→新 */
    List<ScoredExchange> loadExchanges(int capacity);

    Optional<ScoreStats> loadStats();

    /** 追加一条并裁剪到最近 capacity 条 */
    void appendExchange(ScoredExchange exchange, int capacity);

    void saveStats(ScoreStats stats);
}
