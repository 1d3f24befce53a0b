package com.jz.coach.service.impl;

import com.jz.coach.chat.context.ChatTurn;
import com.jz.coach.chat.context.ConversationContextBuilder;
import com.jz.coach.chat.context.SessionStore;
import com.jz.coach.chat.directive.CognitiveAdaptationProvider;
import com.jz.coach.chat.directive.DirectiveGenerator;
import com.jz.coach.chat.directive.ResponseLength;
import com.jz.coach.chat.humanness.HumannessScoringService;
import com.jz.coach.chat.signal.UserMood;
import com.jz.coach.config.ContextProperties;
import com.jz.coach.domain.dto.CoachTurnRequest;
import com.jz.coach.domain.dto.CompleteTurnRequest;
import com.jz.coach.domain.dto.SessionEndRequest;
import com.jz.coach.domain.dto.TurnPlanDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CoachTurnServiceImplTest {

    private SessionStore sessionStore;
    private HumannessScoringService scoring;
    private CoachTurnServiceImpl service;

    @BeforeEach
    void setUp() {
        sessionStore = mock(SessionStore.class);
        when(sessionStore.findLastSessionEnd(anyString())).thenReturn(Optional.empty());
        CognitiveAdaptationProvider provider = mock(CognitiveAdaptationProvider.class);
        when(provider.adaptationsFor(any())).thenReturn(Optional.empty());
        scoring = mock(HumannessScoringService.class);
        Clock clock = Clock.fixed(Instant.parse("2024-06-05T12:00:00Z"), ZoneOffset.UTC);
        service = new CoachTurnServiceImpl(
                new ConversationContextBuilder(sessionStore, new ContextProperties(), clock),
                new DirectiveGenerator(provider), scoring, sessionStore);
    }

    @Test
    @DisplayName("prepare runs the policy path end to end")
    void prepare() {
        CoachTurnRequest req = new CoachTurnRequest();
        req.setUserKey("u1");
        req.setSessionId("s1");
        req.setHistory(List.of(ChatTurn.user("hi"), ChatTurn.assistant("hey")));
        req.setUserMessage("I want to disappear");

        TurnPlanDTO plan = service.prepare(req);

        assertEquals(2000, plan.getDelayMs());
        assertEquals(ResponseLength.BRIEF, plan.getDirectives().getMaxLength());
        assertEquals(2, plan.getContext().getMessageCount());
        assertTrue(plan.getPromptModifiers().contains("Do NOT ask questions."));
        assertTrue(plan.getPromptModifiers().contains("breathing exercise"));
    }

    @Test
    @DisplayName("complete hands the rebuilt context to the scoring service")
    void complete() {
        CompleteTurnRequest req = new CompleteTurnRequest();
        req.setUserKey("u1");
        req.setUserMessage("just so tired");
        req.setAiResponse("That's rough.");

        service.complete(req);

        verify(scoring).scoreExchange(eq("just so tired"), eq("That's rough."),
                argThat(ctx -> ctx.getMessageCount() == 1 && ctx.getUserMood() == UserMood.NEUTRAL));
    }

    @Test
    @DisplayName("session end infers mood from the last message when none is given")
    void endSession() {
        SessionEndRequest req = new SessionEndRequest();
        req.setUserKey("u1");
        req.setLastUserMessage("I can't handle this anymore");
        service.endSession(req);
        verify(sessionStore).saveSessionEnd("u1", UserMood.DISTRESSED);

        req.setMood(UserMood.CALM);
        service.endSession(req);
        verify(sessionStore).saveSessionEnd("u1", UserMood.CALM);
    }
}
