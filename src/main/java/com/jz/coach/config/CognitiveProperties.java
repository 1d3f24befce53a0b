package com.jz.coach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "coach.cognitive")
public class CognitiveProperties {
    /** 画像服务写入的适配提示：{prefix}{userKey} -> JSON */
    private String redisKeyPrefix = "coach:cog:";
}
