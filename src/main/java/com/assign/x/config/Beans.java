package com.assign.x.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;


@Configuration
@Slf4j
public class Beans {

    @Bean(name = "costMatrixExecutor", destroyMethod = "shutdown")
    public ExecutorService costMatrixExecutor(MeterRegistry meterRegistry,
                                              @Value("${assign.cost-matrix.pool-size:0}") int configuredPoolSize) {
        int poolSize = configuredPoolSize > 0 ? configuredPoolSize : Runtime.getRuntime().availableProcessors();
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("cost-matrix-%d")
                .setDaemon(true)
                .build();

        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                poolSize, poolSize,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        meterRegistry.counter("cost_matrix_executor_rejections").increment();
                        log.warn("Cost matrix row task rejected: queue size={}", e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                }
        );
        executor.allowCoreThreadTimeOut(true);
        meterRegistry.gauge("cost_matrix_executor_queue", executor, e -> e.getQueue().size());
        meterRegistry.gauge("cost_matrix_executor_active", executor, ThreadPoolExecutor::getActiveCount);
        log.info("Cost matrix executor started with {} threads", poolSize);
        return executor;
    }
}
