package com.jz.coach.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    /** 外部评估专用线程池：单消费者逐条提交，池子只需兜住超时未退出的调用 */
    @Bean(name = "evaluatorExecutor")
    public ThreadPoolTaskExecutor evaluatorExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(2);
        ex.setMaxPoolSize(4);
        ex.setQueueCapacity(16);
        ex.setKeepAliveSeconds(60);
        ex.setThreadNamePrefix("humanness-eval-call-");
        ex.setDaemon(true);
        ex.setAwaitTerminationSeconds(5);
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }

    /** 统一时钟：时间感知规则、会话间隔、样本时间戳都从这里取 */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
