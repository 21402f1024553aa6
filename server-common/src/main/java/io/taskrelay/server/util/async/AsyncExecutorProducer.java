package io.taskrelay.server.util.async;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the {@link Internal} executor: a cached pool of daemon threads, shut down with
 * the application.
 */
@ApplicationScoped
public class AsyncExecutorProducer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncExecutorProducer.class);

    private final ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory("a2a-agent-"));

    @Produces
    @Internal
    public ExecutorService produce() {
        return executor;
    }

    @PreDestroy
    public void close() {
        LOGGER.debug("Shutting down the agent executor");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Agent executor did not terminate in time, interrupting running agents");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
