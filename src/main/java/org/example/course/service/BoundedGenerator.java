package org.example.course.service;

import jakarta.annotation.PreDestroy;
import org.example.course.service.llm.LlmCompletion;
import org.example.course.service.llm.LlmOptions;
import org.example.course.service.llm.LlmProvider;
import org.example.course.service.llm.LlmProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls the content generator exactly once under a deadline. Provider failures and timeouts
 * surface as {@link GenerationException}; there are no retries at this level.
 */
@Component
public class BoundedGenerator {

    private static final Logger log = LoggerFactory.getLogger(BoundedGenerator.class);

    private final LlmProvider generationProvider;
    private final ExecutorService executor = Executors.newCachedThreadPool(new GeneratorThreadFactory());

    public BoundedGenerator(@Qualifier("generationLlmProvider") LlmProvider generationProvider) {
        this.generationProvider = generationProvider;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public boolean isAvailable() {
        return generationProvider.isAvailable();
    }

    public String getProviderName() {
        return generationProvider.getProviderName();
    }

    public LlmCompletion generate(String prompt, LlmOptions options, Duration timeout) {
        CompletableFuture<LlmCompletion> future =
                CompletableFuture.supplyAsync(() -> generationProvider.complete(prompt, options), executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationException(GenerationException.Cause.TIMEOUT,
                    "Generation timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new GenerationException(GenerationException.Cause.UPSTREAM, "Generation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LlmProviderException providerException) {
                log.warn("Provider {} failed: {}", providerException.getProviderName(), providerException.getMessage());
            }
            throw new GenerationException(GenerationException.Cause.UPSTREAM,
                    "Content generator failed: " + cause.getMessage(), cause);
        }
    }

    private static final class GeneratorThreadFactory implements ThreadFactory {
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "content-generator-" + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
