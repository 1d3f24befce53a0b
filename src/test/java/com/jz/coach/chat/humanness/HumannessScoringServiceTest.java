package com.jz.coach.chat.humanness;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.humanness.store.ExchangeStore;
import com.jz.coach.chat.signal.UserEnergy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HumannessScoringServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-05T12:00:00Z");

    @Test
    @DisplayName("local score is stored first, then the same turn goes to the evaluator")
    void scoresAndSubmits() {
        ExchangeStore store = mock(ExchangeStore.class);
        BackgroundEvaluationWorker worker = mock(BackgroundEvaluationWorker.class);
        HumannessScoringService service = new HumannessScoringService(
                new LocalHumannessScorer(), store, worker, Clock.fixed(NOW, ZoneOffset.UTC));

        ConversationContext ctx = ConversationContext.builder()
                .userEnergy(UserEnergy.LOW).messageCount(3).hourOfDay(23).build();
        ScoredExchange ex = service.scoreExchange("just so tired", "What's going on?", ctx);

        assertEquals(ScoredBy.LOCAL, ex.getScoredBy());
        assertTrue(ex.getId().startsWith("local_"));
        assertEquals(90, ex.getScore().getTotal());
        assertEquals(UserEnergy.LOW, ex.getContext().getUserEnergy());
        assertEquals(23, ex.getContext().getHourOfDay());

        var order = inOrder(store, worker);
        order.verify(store).append(ex);
        ArgumentCaptor<ScoringRequest> captor = ArgumentCaptor.forClass(ScoringRequest.class);
        order.verify(worker).submit(captor.capture());
        assertEquals("What's going on?", captor.getValue().aiResponse());
        assertEquals(3, captor.getValue().context().getMessageCount());
    }
}
