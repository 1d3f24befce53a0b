package com.jz.coach.controller;

import com.jz.coach.chat.humanness.ScoredExchange;
import com.jz.coach.common.Result;
import com.jz.coach.domain.dto.*;
import com.jz.coach.service.CoachChatService;
import com.jz.coach.service.CoachTurnService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("api/coach")
@RequiredArgsConstructor
public class CoachController {

    private final CoachTurnService turnService;
    private final CoachChatService chatService;

    /** 只生成本轮策略，由调用方自己调模型 */
    @PostMapping("/turn/prepare")
    public Result<TurnPlanDTO> prepare(@RequestBody CoachTurnRequest req) {
        return Result.success(turnService.prepare(req));
    }

    /** 调用方拿到回复后回传，做本地打分 + 后台评估 */
    @PostMapping("/turn/complete")
    public Result<ScoredExchange> complete(@RequestBody CompleteTurnRequest req) {
        return Result.success(turnService.complete(req));
    }

    @PostMapping("/chat")
    public Result<CoachReplyDTO> chat(@RequestBody CoachTurnRequest req) {
        return Result.success(chatService.chat(req));
    }

    @PostMapping("/session/end")
    public Result<Void> endSession(@RequestBody SessionEndRequest req) {
        turnService.endSession(req);
        return Result.success(null);
    }
}
