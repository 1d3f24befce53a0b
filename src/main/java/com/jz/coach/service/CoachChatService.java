package com.jz.coach.service;

import com.jz.coach.domain.dto.CoachReplyDTO;
import com.jz.coach.domain.dto.CoachTurnRequest;

public interface CoachChatService {

    /** prepare → 调模型 → complete，一次走完 */
    CoachReplyDTO chat(CoachTurnRequest req);
}
