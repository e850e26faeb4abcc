package org.learningjava.ees.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // fixed width; extra items wait in the queue instead of being rejected
    @Bean(name = "batchTaskExecutor")
    public TaskExecutor batchTaskExecutor(EesProperties props) {
        int width = Math.max(1, props.getBatch().getConcurrency());
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(width);
        ex.setMaxPoolSize(width);
        ex.setThreadNamePrefix("batch-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }
}
