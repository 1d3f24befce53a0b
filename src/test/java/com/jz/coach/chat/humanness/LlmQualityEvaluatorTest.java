package com.jz.coach.chat.humanness;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.coach.config.EvaluatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmQualityEvaluatorTest {

    private static final String GOOD = """
            {"total": 82,
             "breakdown": {"naturalLanguage": 13, "emotionalTiming": 17, "brevityControl": 12, "memoryUse": 14,
                           "imperfection": 8, "personalityConsistency": 11, "avoidedStockPhrases": 7},
             "issues": ["a bit long"], "suggestions": ["trim the second sentence"]}
            """;

    private ChatClient client;
    private EvaluatorProperties props;
    private LlmQualityEvaluator evaluator;

    @BeforeEach
    void setUp() {
        client = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        props = new EvaluatorProperties();
        evaluator = new LlmQualityEvaluator(Map.of("qwen-turbo", client), props, new ObjectMapper());
    }

    private void reply(String content) {
        when(client.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
    }

    private static ScoringRequest req() {
        return new ScoringRequest("long day", "Oof. Want to talk about it?", null);
    }

    @Test
    @DisplayName("well-formed JSON wrapped in prose is accepted")
    void accepted() {
        reply("Sure! Here is the score:\n```json\n" + GOOD + "```");
        Optional<HumannessScore> s = evaluator.evaluate(req());
        assertTrue(s.isPresent());
        assertEquals(82, s.get().getTotal());
        assertEquals(17, s.get().getBreakdown().getEmotionalTiming());
        assertEquals(List.of("a bit long"), s.get().getIssues());
        assertEquals(List.of("trim the second sentence"), s.get().getSuggestions());
    }

    @Test
    @DisplayName("call failure → empty, never throws")
    void callFails() {
        when(client.prompt()).thenThrow(new RuntimeException("503"));
        assertTrue(evaluator.evaluate(req()).isEmpty());
    }

    @Test
    @DisplayName("disabled evaluator never calls the model")
    void disabled() {
        props.setEnabled(false);
        assertTrue(evaluator.evaluate(req()).isEmpty());
        verify(client, never()).prompt();
    }

    @Nested
    @DisplayName("parse() rejects malformed shapes")
    class Malformed {

        @Test
        void notJson() {
            assertTrue(evaluator.parse("I think it's around 80").isEmpty());
            assertTrue(evaluator.parse(null).isEmpty());
            assertTrue(evaluator.parse("{not json}").isEmpty());
        }

        @Test
        void totalOutOfRange() {
            assertTrue(evaluator.parse(GOOD.replace("\"total\": 82", "\"total\": 0")).isEmpty());
            assertTrue(evaluator.parse(GOOD.replace("\"total\": 82", "\"total\": 101")).isEmpty());
            assertTrue(evaluator.parse(GOOD.replace("\"total\": 82", "\"total\": \"82\"")).isEmpty());
        }

        @Test
        void dimensionOverCap() {
            assertTrue(evaluator.parse(GOOD.replace("\"emotionalTiming\": 17", "\"emotionalTiming\": 21")).isEmpty());
        }

        @Test
        void missingDimension() {
            assertTrue(evaluator.parse(GOOD.replace("\"memoryUse\": 14,", "")).isEmpty());
        }

        @Test
        void issuesNotStrings() {
            assertTrue(evaluator.parse(GOOD.replace("[\"a bit long\"]", "[1, 2]")).isEmpty());
            assertTrue(evaluator.parse(GOOD.replace("\"issues\": [\"a bit long\"], ", "")).isEmpty());
        }
    }
}
