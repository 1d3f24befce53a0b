package com.jz.coach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "coach.humanness")
public class HumannessProperties {
    /** 环形缓冲容量：只保留最近 N 条打分样本 */
    private int storeCapacity = 1000;
    /** 常见问题直方图只保留前 N */
    private int topIssues = 20;
    /** 评估模型样本达到多少条即可训练本地打分模型 */
    private int trainingThreshold = 500;
    /** 趋势：最近 N 条均分 vs 之前 N 条均分 */
    private int trendWindow = 10;
    /** 趋势判定阈值（分） */
    private double trendDelta = 5.0;
    private String redisKeyPrefix = "coach:humanness:";
}
