package com.jz.coach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "coach.humanness.evaluator")
public class EvaluatorProperties {
    private boolean enabled = true;
    /** 评分用模型（建议稳定、便宜） */
    private String model = "qwen-turbo";
    /** 单次评估超时，超时即丢弃 */
    private long timeoutMs = 20_000;
    /** 待评估队列上限，满了直接丢 */
    private int queueCapacity = 500;
}
