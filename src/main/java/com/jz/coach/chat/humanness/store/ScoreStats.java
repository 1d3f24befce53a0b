package com.jz.coach.chat.humanness.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 打分滚动统计（进程内唯一一份，只由 {@link ExchangeStore} 在锁内修改）。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoreStats {
    private long totalScored;
    private double averageScore;
    /** 常见问题：按次数降序，只留前 N */
    private List<IssueCount> commonIssues = new ArrayList<>();
    private ScoreTrend recentTrend = ScoreTrend.STABLE;
    private long evaluatorScoreCount;
    private long localScoreCount;

    /** 深拷贝，对外只给副本 */
    public ScoreStats copy() {
        ScoreStats s = new ScoreStats();
        s.totalScored = totalScored;
        s.averageScore = averageScore;
        List<IssueCount> issues = new ArrayList<>();
        if (commonIssues != null) {
            for (IssueCount i : commonIssues) issues.add(new IssueCount(i.getIssue(), i.getCount()));
        }
        s.commonIssues = issues;
        s.recentTrend = recentTrend;
        s.evaluatorScoreCount = evaluatorScoreCount;
        s.localScoreCount = localScoreCount;
        return s;
    }
}
