package com.jz.coach.chat.humanness;

import com.jz.coach.chat.humanness.store.ExchangeStore;
import com.jz.coach.config.EvaluatorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;

/**
 * 后台评估：
 * - submit() 入队（非阻塞，满了直接丢）；
 * - 单消费者线程逐条取出，交给评估线程池并限时等待；
 * - 成功则以 evaluator 来源追加到样本库；超时 / 失败 / 形状不符一律丢弃并计数。
 */
@Slf4j
@Component
public class BackgroundEvaluationWorker {

    private final QualityEvaluator evaluator;
    private final ExchangeStore store;
    private final EvaluatorProperties props;
    private final ThreadPoolTaskExecutor evaluatorExecutor;
    private final MeterRegistry registry;
    private final Clock clock;

    private final BlockingQueue<ScoringRequest> q;
    private Thread worker;
    private volatile boolean running = true;

    private static final long POLL_MS = 500;

    // 指标
    private Counter submitReject;
    private Counter evalSuccess;
    private Counter evalDropped;
    private Timer evalTimer;

    public BackgroundEvaluationWorker(QualityEvaluator evaluator,
                                      ExchangeStore store,
                                      EvaluatorProperties props,
                                      @Qualifier("evaluatorExecutor") ThreadPoolTaskExecutor evaluatorExecutor,
                                      MeterRegistry registry,
                                      Clock clock) {
        this.evaluator = evaluator;
        this.store = store;
        this.props = props;
        this.evaluatorExecutor = evaluatorExecutor;
        this.registry = registry;
        this.clock = clock;
        this.q = new LinkedBlockingQueue<>(Math.max(1, props.getQueueCapacity()));
    }

    @PostConstruct
    public void start() {
        this.submitReject = Counter.builder("humanness.eval.submit.reject")
                .description("Evaluations dropped because the queue was full")
                .register(registry);
        this.evalSuccess = Counter.builder("humanness.eval.success")
                .description("Evaluations appended to the exchange store")
                .register(registry);
        this.evalDropped = Counter.builder("humanness.eval.dropped")
                .description("Evaluations dropped on timeout, failure or malformed result")
                .register(registry);
        this.evalTimer = Timer.builder("humanness.eval.latency")
                .description("Latency of one external evaluation")
                .register(registry);
        Gauge.builder("humanness.eval.queue.size", q, BlockingQueue::size)
                .description("Pending evaluations")
                .register(registry);

        this.worker = new Thread(this::loop, "humanness-eval");
        this.worker.setDaemon(true);
        this.worker.start();
        log.info("[EvalWorker] started, enabled={} queueCapacity={} timeoutMs={}",
                props.isEnabled(), props.getQueueCapacity(), props.getTimeoutMs());
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (worker != null) worker.interrupt();
    }

    /** 生产者：永不阻塞调用方 */
    public boolean submit(ScoringRequest req) {
        if (!props.isEnabled() || req == null) return false;
        if (!q.offer(req)) {
            submitReject.increment();
            log.warn("[EvalWorker] queue full, evaluation dropped. size={}", q.size());
            return false;
        }
        return true;
    }

    int pending() {
        return q.size();
    }

    private void loop() {
        while (running) {
            try {
                ScoringRequest req = q.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (req != null) process(req);
            } catch (InterruptedException e) {
                // stop() 触发的中断：退出；否则继续轮询
                if (!running) return;
            } catch (Exception e) {
                // 单条失败不能拖死消费线程
                log.warn("[EvalWorker] unexpected error, continue. err={}", e.toString());
            }
        }
    }

    /** 处理一条：限时评估，成功入库 */
    boolean process(ScoringRequest req) throws InterruptedException {
        Timer.Sample sample = Timer.start(registry);
        Future<Optional<HumannessScore>> f;
        try {
            f = evaluatorExecutor.submit(() -> evaluator.evaluate(req));
        } catch (TaskRejectedException e) {
            sample.stop(evalTimer);
            evalDropped.increment();
            log.warn("[EvalWorker] evaluator pool saturated, dropped. err={}", e.getMessage());
            return false;
        }
        Optional<HumannessScore> score;
        try {
            score = f.get(props.getTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            evalDropped.increment();
            log.warn("[EvalWorker] evaluation timed out after {}ms, dropped", props.getTimeoutMs());
            return false;
        } catch (ExecutionException e) {
            evalDropped.increment();
            log.warn("[EvalWorker] evaluation failed, dropped. err={}", String.valueOf(e.getCause()));
            return false;
        } finally {
            sample.stop(evalTimer);
        }

        if (score == null || score.isEmpty()) {
            evalDropped.increment();
            return false;
        }
        store.append(ScoredExchange.builder()
                .id("evaluator_" + UUID.randomUUID())
                .timestamp(clock.instant())
                .userMessage(req.userMessage())
                .aiResponse(req.aiResponse())
                .context(req.context())
                .score(score.get())
                .scoredBy(ScoredBy.EVALUATOR)
                .build());
        evalSuccess.increment();
        return true;
    }
}
