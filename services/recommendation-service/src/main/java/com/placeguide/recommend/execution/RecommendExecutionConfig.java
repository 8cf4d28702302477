package com.placeguide.recommend.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RecommendExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService recommendExecutor(@Value("${recommend.execution.pool-size:8}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService profileExecutor(@Value("${recommend.execution.profile-pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize));
    }
}
