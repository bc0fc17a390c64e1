package com.wordhub.gameservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 这个调度器专门用于机器人的思考延迟与搜索，与棋钟调度器分开，避免机器人搜索拖慢各房间的计时。
 */
@Configuration
public class BotSchedulerConfig {

	@Value("${scheduler.bot.corePoolSize:0}")
	private int corePoolSize;

	@Bean(name = "botScheduler", destroyMethod = "shutdownNow")
	public ScheduledExecutorService botScheduler() {
		int poolSize = corePoolSize > 0 ? corePoolSize : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
		ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactory() {
			private final AtomicInteger idx = new AtomicInteger(1);
			@Override
			public Thread newThread(Runnable r) {
				Thread t = new Thread(r, "bot-think-" + idx.getAndIncrement());
				t.setDaemon(true);
				return t;
			}
		});
		exec.setRemoveOnCancelPolicy(true);
		return exec;
	}
}
