package com.jz.coach.service.impl;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.context.ConversationContextBuilder;
import com.jz.coach.chat.context.SessionStore;
import com.jz.coach.chat.directive.DirectiveGenerator;
import com.jz.coach.chat.directive.ResponseDirectives;
import com.jz.coach.chat.humanness.HumannessScoringService;
import com.jz.coach.chat.humanness.ScoredExchange;
import com.jz.coach.chat.prompt.PromptModifierCompiler;
import com.jz.coach.chat.signal.SignalDetector;
import com.jz.coach.chat.signal.UserMood;
import com.jz.coach.domain.dto.CoachTurnRequest;
import com.jz.coach.domain.dto.CompleteTurnRequest;
import com.jz.coach.domain.dto.SessionEndRequest;
import com.jz.coach.domain.dto.TurnPlanDTO;
import com.jz.coach.service.CoachTurnService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class CoachTurnServiceImpl implements CoachTurnService {

    private final ConversationContextBuilder contextBuilder;
    private final DirectiveGenerator directiveGenerator;
    private final HumannessScoringService scoringService;
    private final SessionStore sessionStore;

    @Override
    public TurnPlanDTO prepare(CoachTurnRequest req) {
        ConversationContext ctx = context(req);
        ResponseDirectives d = directiveGenerator.generate(ctx, req.getUserKey());
        return TurnPlanDTO.builder()
                .context(ctx)
                .directives(d)
                .promptModifiers(PromptModifierCompiler.compile(d))
                .delayMs(d.getArtificialDelayMs())
                .build();
    }

    @Override
    public ScoredExchange complete(CompleteTurnRequest req) {
        return scoringService.scoreExchange(req.getUserMessage(), req.getAiResponse(), context(req));
    }

    @Override
    public void endSession(SessionEndRequest req) {
        UserMood mood = req.getMood() != null
                ? req.getMood()
                : SignalDetector.detectUserMood(req.getLastUserMessage());
        sessionStore.saveSessionEnd(req.getUserKey(), mood);
        log.info("[Coach] session ended. userKey={} mood={}", req.getUserKey(), mood.code());
    }

    private ConversationContext context(CoachTurnRequest req) {
        return contextBuilder.build(req.getUserKey(), req.getSessionId(), req.getHistory(), req.getUserMessage());
    }
}
