package com.jz.coach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "coach.context")
public class ContextProperties {
    /** 话题只看最近 N 条用户发言 */
    private int topicWindow = 5;
    /** 没有上次会话记录时的默认间隔（小时） */
    private double defaultHoursSinceLastSession = 24;
    private String sessionKeyPrefix = "coach:session:last:";
    /** 会话结束记录保留天数 */
    private long sessionTtlDays = 30;
}
