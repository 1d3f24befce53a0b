package com.jz.coach.chat.humanness.store;

import com.jz.coach.chat.humanness.ScoredBy;
import com.jz.coach.chat.humanness.ScoredExchange;
import com.jz.coach.config.HumannessProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 打分样本环形缓冲 + 滚动统计。
 * - 只保留最近 capacity 条，满了先进先出淘汰；
 * - 统计与缓冲在同一把锁内读改写（单写者），外部只拿副本；
 * - 首次访问时从仓库恢复，读失败按空状态起步；
 * - 每次追加都在锁内镜像写仓库，写失败只记日志，不影响本轮。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExchangeStore {

    private final ExchangeSnapshotRepository repository;
    private final HumannessProperties props;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<ScoredExchange> ring = new ArrayDeque<>();
    /** 全量问题计数；stats.commonIssues 只是它的前 N */
    private final Map<String, Integer> issueCounts = new HashMap<>();
    private ScoreStats stats = new ScoreStats();
    private boolean loaded;

    public void append(ScoredExchange exchange) {
        if (exchange == null || exchange.getScore() == null) return;
        lock.lock();
        try {
            ensureLoaded();
            ring.addLast(exchange);
            while (ring.size() > capacity()) ring.pollFirst();
            updateStats(exchange);
            // 写回也在锁内：落库顺序与内存一致，统计不会回退
            persist(exchange, stats.copy());
        } finally {
            lock.unlock();
        }
    }

    public ScoreStats stats() {
        lock.lock();
        try {
            ensureLoaded();
            return stats.copy();
        } finally {
            lock.unlock();
        }
    }

    /** 旧→新 */
    public List<ScoredExchange> exchanges() {
        lock.lock();
        try {
            ensureLoaded();
            return new ArrayList<>(ring);
        } finally {
            lock.unlock();
        }
    }

    public TrainingReadiness readiness() {
        int needed = props.getTrainingThreshold();
        long evaluator = stats().getEvaluatorScoreCount();
        return new TrainingReadiness(evaluator >= needed, evaluator, needed);
    }

    public TrainingExport export() {
        lock.lock();
        try {
            ensureLoaded();
            return new TrainingExport(clock.instant(), stats.copy(), new ArrayList<>(ring));
        } finally {
            lock.unlock();
        }
    }

    // ---------- 内部 ----------

    private int capacity() {
        return Math.max(1, props.getStoreCapacity());
    }

    private void ensureLoaded() {
        if (loaded) return;
        loaded = true;
        try {
            List<ScoredExchange> restored = repository.loadExchanges(capacity());
            for (ScoredExchange e : restored) {
                if (e != null && e.getScore() != null) ring.addLast(e);
            }
            while (ring.size() > capacity()) ring.pollFirst();
        } catch (Exception e) {
            log.warn("[ExchangeStore] restore exchanges failed, start empty. err={}", e.toString());
            ring.clear();
        }
        try {
            repository.loadStats().ifPresent(s -> {
                stats = s.copy();
                if (stats.getRecentTrend() == null) stats.setRecentTrend(ScoreTrend.STABLE);
                for (IssueCount ic : stats.getCommonIssues()) {
                    issueCounts.merge(ic.getIssue(), ic.getCount(), Integer::sum);
                }
            });
        } catch (Exception e) {
            log.warn("[ExchangeStore] restore stats failed, start empty. err={}", e.toString());
            stats = new ScoreStats();
            issueCounts.clear();
        }
        log.info("[ExchangeStore] restored exchanges={} totalScored={}", ring.size(), stats.getTotalScored());
    }

    private void updateStats(ScoredExchange ex) {
        long n = stats.getTotalScored() + 1;
        int total = ex.getScore().getTotal();
        stats.setTotalScored(n);
        stats.setAverageScore(stats.getAverageScore() + (total - stats.getAverageScore()) / n);

        if (ex.getScoredBy() == ScoredBy.EVALUATOR) {
            stats.setEvaluatorScoreCount(stats.getEvaluatorScoreCount() + 1);
        } else {
            stats.setLocalScoreCount(stats.getLocalScoreCount() + 1);
        }

        List<String> issues = ex.getScore().getIssues();
        if (issues != null) {
            for (String i : issues) {
                if (i != null && !i.isBlank()) issueCounts.merge(i, 1, Integer::sum);
            }
        }
        stats.setCommonIssues(topIssues());
        stats.setRecentTrend(trend());
    }

    /** 次数降序，同次数按文本排，保证输出稳定 */
    private List<IssueCount> topIssues() {
        List<IssueCount> out = new ArrayList<>(issueCounts.size());
        issueCounts.forEach((k, v) -> out.add(new IssueCount(k, v)));
        out.sort(Comparator.comparingInt(IssueCount::getCount).reversed()
                .thenComparing(IssueCount::getIssue));
        int top = Math.max(0, props.getTopIssues());
        return out.size() > top ? new ArrayList<>(out.subList(0, top)) : out;
    }

    /** 最近 N 条均分 vs 之前 N 条均分；不足 2N 条视为平稳 */
    private ScoreTrend trend() {
        int w = Math.max(1, props.getTrendWindow());
        if (ring.size() < 2 * w) return ScoreTrend.STABLE;

        Iterator<ScoredExchange> it = ring.descendingIterator();
        double recent = 0, previous = 0;
        for (int i = 0; i < 2 * w; i++) {
            int t = it.next().getScore().getTotal();
            if (i < w) recent += t; else previous += t;
        }
        double delta = (recent - previous) / w;
        if (delta > props.getTrendDelta()) return ScoreTrend.IMPROVING;
        if (delta < -props.getTrendDelta()) return ScoreTrend.DECLINING;
        return ScoreTrend.STABLE;
    }

    private void persist(ScoredExchange exchange, ScoreStats snapshot) {
        try {
            repository.appendExchange(exchange, capacity());
            repository.saveStats(snapshot);
        } catch (Exception e) {
            log.warn("[ExchangeStore] persist failed, kept in memory. id={}, err={}", exchange.getId(), e.toString());
        }
    }
}
