package eu.virtualparadox.ragqa.application.config;

import eu.virtualparadox.ragqa.application.executor.EmbeddingExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public EmbeddingExecutor embeddingExecutor(final ApplicationConfig config) {
        final int threads = Math.max(1, config.getEmbedding().getThreads());

        EmbeddingExecutor executor = new EmbeddingExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);             // fixed size
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("embed-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
