package com.jz.coach.service;

import com.jz.coach.chat.humanness.ScoredExchange;
import com.jz.coach.domain.dto.CoachTurnRequest;
import com.jz.coach.domain.dto.CompleteTurnRequest;
import com.jz.coach.domain.dto.SessionEndRequest;
import com.jz.coach.domain.dto.TurnPlanDTO;

public interface CoachTurnService {

    /** 策略链路：信号 → 上下文 → 指令 → 提示词块（同步，不抛异常） */
    TurnPlanDTO prepare(CoachTurnRequest req);

    /** 反馈链路：本地打分入库 + 投递后台评估 */
    ScoredExchange complete(CompleteTurnRequest req);

    void endSession(SessionEndRequest req);
}
