package com.jz.coach.service.impl;

import com.jz.coach.chat.context.ChatTurn;
import com.jz.coach.chat.humanness.ScoredExchange;
import com.jz.coach.chat.prompt.CoachSystemPrompt;
import com.jz.coach.config.ChatProperties;
import com.jz.coach.domain.dto.CoachReplyDTO;
import com.jz.coach.domain.dto.CoachTurnRequest;
import com.jz.coach.domain.dto.CompleteTurnRequest;
import com.jz.coach.domain.dto.TurnPlanDTO;
import com.jz.coach.service.CoachChatService;
import com.jz.coach.service.CoachTurnService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CoachChatServiceImpl implements CoachChatService {

    private final Map<String, ChatClient> chatClientMap;
    private final ChatProperties chatProps;
    private final CoachTurnService turnService;

    private ChatClient client() {
        if (chatClientMap.isEmpty()) {
            throw new IllegalStateException("no chat model configured");
        }
        return Optional.ofNullable(chatClientMap.get(chatProps.getReplyModel()))
                .orElseGet(() -> chatClientMap.values().iterator().next());
    }

    @Override
    public CoachReplyDTO chat(CoachTurnRequest req) {
        if (req.getUserMessage() == null || req.getUserMessage().isBlank()) {
            throw new IllegalArgumentException("userMessage must not be blank");
        }
        TurnPlanDTO plan = turnService.prepare(req);
        String system = CoachSystemPrompt.inject(chatProps.getBaseSystemPrompt(), plan.getPromptModifiers());

        long t0 = System.currentTimeMillis();
        String text = client().prompt()
                .system(system)
                .messages(toMessages(req.getHistory()))
                .user(req.getUserMessage())
                .call()
                .content();
        text = text == null ? "" : text.trim();
        log.debug("[Coach] reply model={} cost={}ms len={}", chatProps.getReplyModel(),
                System.currentTimeMillis() - t0, text.length());

        CompleteTurnRequest done = new CompleteTurnRequest();
        done.setUserKey(req.getUserKey());
        done.setSessionId(req.getSessionId());
        done.setHistory(req.getHistory());
        done.setUserMessage(req.getUserMessage());
        done.setAiResponse(text);
        ScoredExchange scored = turnService.complete(done);

        return CoachReplyDTO.reply(text, plan.getDelayMs(), scored.getScore(), scored.getId());
    }

    private static List<Message> toMessages(List<ChatTurn> history) {
        List<Message> out = new ArrayList<>();
        if (history == null) return out;
        for (ChatTurn t : history) {
            if (t == null || t.safeText().isBlank()) continue;
            out.add(t.isUser() ? new UserMessage(t.safeText()) : new AssistantMessage(t.safeText()));
        }
        return out;
    }
}
