package com.jz.coach.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "coach.chat")
public class ChatProperties {
    /** 可用模型；每个模型一个 ChatClient */
    private List<String> models = new ArrayList<>(List.of("qwen-plus", "qwen-turbo", "qwen-max"));
    /** 生成回复用的模型 */
    private String replyModel = "qwen-plus";
    /** 基础人设 */
    private String baseSystemPrompt = "You are a warm, steady coach. You talk with people the way a thoughtful friend would.";
}
