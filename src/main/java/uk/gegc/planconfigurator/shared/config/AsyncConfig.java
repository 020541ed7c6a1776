package uk.gegc.planconfigurator.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for backend calls.
 * <p>
 * Backend requests and their retries run here so callers (validation, the workflow engine,
 * the REST layer) never block on the network.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.backend.core-pool-size:4}")
    private int backendCorePoolSize;

    @Value("${async.backend.max-pool-size:16}")
    private int backendMaxPoolSize;

    @Value("${async.backend.queue-capacity:100}")
    private int backendQueueCapacity;

    @Value("${async.backend.keep-alive-seconds:60}")
    private int backendKeepAliveSeconds;

    @Bean(name = "backendTaskExecutor")
    public Executor backendTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(backendCorePoolSize);
        executor.setMaxPoolSize(backendMaxPoolSize);
        executor.setQueueCapacity(backendQueueCapacity);
        executor.setKeepAliveSeconds(backendKeepAliveSeconds);
        executor.setThreadNamePrefix("backend-");

        // A full queue rejects the task; the request executor turns that into a NETWORK failure
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Backend Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                backendCorePoolSize, backendMaxPoolSize, backendQueueCapacity, backendKeepAliveSeconds);

        return executor;
    }
}
