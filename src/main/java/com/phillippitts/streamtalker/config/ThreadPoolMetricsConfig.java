package com.phillippitts.streamtalker.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the synthesis executor through Micrometer as {@code synthesis.pool.*} gauges and logs a
 * short pool summary every five minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("synthesisExecutor") ObjectProvider<ThreadPoolTaskExecutor> synthesisExecutorProvider) {
        this.synthesisExecutorProvider = synthesisExecutorProvider;
    }

    @Bean
    public MeterBinder synthesisExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = synthesisExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("synthesis.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the synthesis pool")
                    .register(registry);
            Gauge.builder("synthesis.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads currently waiting on the TTS server")
                    .register(registry);
            Gauge.builder("synthesis.pool.queued", executor, e -> e.getQueue().size())
                    .description("Synthesis batches waiting for a thread")
                    .register(registry);

            LOG.info("Synthesis pool metrics registered: synthesis.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = synthesisExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Synthesis pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
