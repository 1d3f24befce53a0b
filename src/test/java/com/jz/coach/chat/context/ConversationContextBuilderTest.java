package com.jz.coach.chat.context;

import com.jz.coach.chat.signal.UserEnergy;
import com.jz.coach.chat.signal.UserMood;
import com.jz.coach.config.ContextProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationContextBuilderTest {

    // 2024-06-05 是周三，23:30 UTC
    private static final Instant NOW = Instant.parse("2024-06-05T23:30:00Z");

    private SessionStore store;
    private ConversationContextBuilder builder;

    @BeforeEach
    void setUp() {
        store = mock(SessionStore.class);
        when(store.findLastSessionEnd(anyString())).thenReturn(Optional.empty());
        builder = new ConversationContextBuilder(store, new ContextProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("time since last session")
    class LastSession {

        @Test
        @DisplayName("no record → 24h and no previous mood")
        void defaults() {
            ConversationContext ctx = builder.build("u1", "s1", List.of(), "hey");
            assertEquals(24.0, ctx.getTimeSinceLastSession());
            assertNull(ctx.getLastSessionMood());
        }

        @Test
        @DisplayName("hours are measured from the stored end time")
        void fromRecord() {
            when(store.findLastSessionEnd("u1")).thenReturn(Optional.of(
                    new SessionEndRecord(NOW.minus(Duration.ofHours(10)), UserMood.DISTRESSED)));
            ConversationContext ctx = builder.build("u1", "s1", List.of(), "hey");
            assertEquals(10.0, ctx.getTimeSinceLastSession(), 1e-9);
            assertEquals(UserMood.DISTRESSED, ctx.getLastSessionMood());
        }

        @Test
        @DisplayName("end time in the future clamps to 0")
        void clamped() {
            when(store.findLastSessionEnd("u1")).thenReturn(Optional.of(
                    new SessionEndRecord(NOW.plus(Duration.ofHours(2)), UserMood.CALM)));
            assertEquals(0.0, builder.build("u1", "s1", List.of(), "hey").getTimeSinceLastSession());
        }

        @Test
        @DisplayName("store failure falls back to defaults")
        void storeFails() {
            when(store.findLastSessionEnd("u1")).thenThrow(new IllegalStateException("redis down"));
            ConversationContext ctx = builder.build("u1", "s1", List.of(), "hey");
            assertEquals(24.0, ctx.getTimeSinceLastSession());
        }
    }

    @Test
    @DisplayName("clock fields use ISO day of week and local hour")
    void clockFields() {
        ConversationContext ctx = builder.build("u1", "s1", null, null);
        assertEquals(3, ctx.getDayOfWeek());
        assertEquals(23, ctx.getHourOfDay());
        assertEquals(NOW, ctx.getSessionStartTime());
        assertEquals("", ctx.getLastUserMessage());
        assertEquals(0, ctx.getMessageCount());
    }

    @Test
    @DisplayName("latest message is counted once even if already in history")
    void messageCount() {
        List<ChatTurn> history = List.of(
                ChatTurn.user("hi"), ChatTurn.assistant("hey you"), ChatTurn.user("long day"));
        assertEquals(3, builder.build("u1", "s1", history, "so tired").getMessageCount());
        assertEquals(2, builder.build("u1", "s1", history, "long day").getMessageCount());
    }

    @Test
    @DisplayName("signals come from the latest message")
    void signals() {
        ConversationContext ctx = builder.build("u1", "s1", List.of(), "I want to disappear");
        assertTrue(ctx.isHeavyTopic());
        assertEquals(UserMood.DISTRESSED, ctx.getUserMood());
        assertEquals(UserEnergy.LOW, builder.build("u1", "s1", List.of(), "just so tired").getUserEnergy());
    }

    @Test
    @DisplayName("topics come from the last 5 user turns, de-duplicated")
    void topicsWindow() {
        List<ChatTurn> history = List.of(
                ChatTurn.user("money is tight"),     // 窗口外
                ChatTurn.user("my boss again"),
                ChatTurn.user("work is a lot"),
                ChatTurn.user("my mom called"),
                ChatTurn.user("nothing new"));
        ConversationContext ctx = builder.build("u1", "s1", history, "the office was loud");
        assertEquals(List.of("work", "family"), List.copyOf(ctx.getRecentTopics()));
    }

    @Test
    @DisplayName("memory callbacks are counted once per assistant turn")
    void memoryCallbacks() {
        List<ChatTurn> history = List.of(
                ChatTurn.user("a"),
                ChatTurn.assistant("You mentioned your sister. Last time you said she visited."),
                ChatTurn.user("b"),
                ChatTurn.assistant("sounds good"),
                ChatTurn.user("c"),
                ChatTurn.assistant("Remember when you tried that?"));
        ConversationContext ctx = builder.build("u1", "s1", history, "d");
        assertEquals(2, ctx.getRecentMemoryCallbacks());
        assertEquals(2, ctx.getLastMemoryCallbackTurn());
    }

    @Test
    @DisplayName("no callbacks → -1")
    void noCallbacks() {
        assertEquals(-1, builder.build("u1", "s1", List.of(ChatTurn.assistant("ok")), "hi")
                .getLastMemoryCallbackTurn());
    }
}
