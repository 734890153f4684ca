package com.ramgenix.swingscanner.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for scans: one launcher thread for background scans, a bounded pool for ticker tasks, and a separate
 * pool for the sub-tasks a ticker task waits on.
 */
@Configuration
public class ScannerConfig {

	public static final String LAUNCHER_EXECUTOR = "scanLauncherExecutor";
	public static final String TICKER_EXECUTOR = "tickerExecutor";
	public static final String ANALYSIS_EXECUTOR = "analysisExecutor";

	@Bean(name = LAUNCHER_EXECUTOR, destroyMethod = "shutdownNow")
	public ExecutorService scanLauncherExecutor() {
		return Executors.newSingleThreadExecutor(namedThreads("scan-launcher"));
	}

	@Bean(name = TICKER_EXECUTOR, destroyMethod = "shutdownNow")
	public ExecutorService tickerExecutor(ScannerProperties properties) {
		return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), namedThreads("scan-ticker"));
	}

	@Bean(name = ANALYSIS_EXECUTOR, destroyMethod = "shutdownNow")
	public ExecutorService analysisExecutor(ScannerProperties properties) {
		return Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()),
				namedThreads("scan-analysis"));
	}

	static ThreadFactory namedThreads(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
