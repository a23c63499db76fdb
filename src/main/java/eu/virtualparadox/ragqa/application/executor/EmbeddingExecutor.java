package eu.virtualparadox.ragqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Fixed-size worker pool running embedding batches. A dedicated type so it can be
 * injected without qualifiers next to Spring's own task executors.
 */
public class EmbeddingExecutor extends ThreadPoolTaskExecutor {
}
