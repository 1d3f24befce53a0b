package com.jz.coach.chat.humanness;

import com.jz.coach.chat.context.ConversationContext;
import com.jz.coach.chat.humanness.store.ExchangeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * 一轮结束后的反馈链路：本地同步打分入库，再把同一轮丢给后台评估。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HumannessScoringService {

    private final LocalHumannessScorer localScorer;
    private final ExchangeStore store;
    private final BackgroundEvaluationWorker evaluationWorker;
    private final Clock clock;

    public ScoredExchange scoreExchange(String userMessage, String aiResponse, ConversationContext ctx) {
        ContextSnapshot snapshot = ctx == null ? ContextSnapshot.builder().build() : ContextSnapshot.of(ctx);
        ScoringRequest req = new ScoringRequest(userMessage, aiResponse, snapshot);

        HumannessScore score = localScorer.score(req);
        ScoredExchange exchange = ScoredExchange.builder()
                .id("local_" + UUID.randomUUID())
                .timestamp(clock.instant())
                .userMessage(req.userMessage())
                .aiResponse(req.aiResponse())
                .context(snapshot)
                .score(score)
                .scoredBy(ScoredBy.LOCAL)
                .build();
        store.append(exchange);

        evaluationWorker.submit(req);
        log.debug("[Humanness] local score={} issues={}", score.getTotal(), score.getIssues());
        return exchange;
    }
}
