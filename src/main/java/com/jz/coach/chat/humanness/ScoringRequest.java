package com.jz.coach.chat.humanness;

/** 待评分的一轮：用户原话 + 回复原文 + 精简上下文 */
public record ScoringRequest(String userMessage, String aiResponse, ContextSnapshot context) {

    public ScoringRequest {
        userMessage = userMessage == null ? "" : userMessage;
        aiResponse = aiResponse == null ? "" : aiResponse;
        context = context == null ? ContextSnapshot.builder().build() : context;
    }
}
