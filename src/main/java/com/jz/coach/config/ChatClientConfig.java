package com.jz.coach.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
public class ChatClientConfig {

    // 无记忆：历史由调用方逐轮带上，这里不装 Advisor
    @Bean
    public Map<String, ChatClient> chatClientMap(ChatModel chatModel, ChatProperties props) {
        Map<String, ChatClient> map = new LinkedHashMap<>();
        for (String model : props.getModels()) {
            map.put(model, ChatClient.builder(chatModel)
                    .defaultOptions(ChatOptions.builder().model(model).build())
                    .build());
        }
        return map;
    }
}
