package com.wordhub.gameservice.clock;

import com.wordhub.gameservice.clock.scheduler.CountdownScheduler;
import com.wordhub.gameservice.clock.scheduler.CountdownSchedulerImpl;
import com.wordhub.gameservice.games.scrabble.application.config.GameProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * ClockAutoConfig
 * ---------------------------------------
 * 倒计时相关 Bean 的装配：系统时钟 + 调度线程池 → 通用调度引擎。
 * 这里不关心任何业务细节，只负责把基础设施拼起来。
 */
@Configuration
public class ClockAutoConfig {

    /** 系统时钟（测试里可替换为可调时钟） */
    @Bean
    @ConditionalOnMissingBean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    /**
     * 注册通用倒计时调度器。
     * @param turnClockScheduler 调度线程池（守护线程）
     * @param properties         同步间隔
     */
    @Bean
    public CountdownScheduler countdownScheduler(@Qualifier("turnClockScheduler") ScheduledThreadPoolExecutor turnClockScheduler,
                                                 GameProperties properties,
                                                 Clock clock) {
        return new CountdownSchedulerImpl(turnClockScheduler, properties.getSyncInterval().toMillis(), clock);
    }
}
