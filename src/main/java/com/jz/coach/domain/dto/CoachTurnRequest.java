package com.jz.coach.domain.dto;

import com.jz.coach.chat.context.ChatTurn;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CoachTurnRequest {
    /** 用户标识：会话结束记录、认知画像都按它存取 */
    private String userKey;
    private String sessionId;
    /** 本会话之前的轮次（旧→新），可为空 */
    private List<ChatTurn> history = new ArrayList<>();
    private String userMessage;
}
