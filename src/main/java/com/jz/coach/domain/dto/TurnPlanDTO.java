package com.jz.coach.domain.dto;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.directive.ResponseDirectives;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 本轮策略：上下文 + 行为指令 + 编译好的提示词块 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnPlanDTO {
    private ConversationContext context;
    private ResponseDirectives directives;
    /** 注入 System 的指令块 */
    private String promptModifiers;
    /** 建议延时（毫秒）：前端用于“打字效果/延迟显示” */
    private int delayMs;
}
