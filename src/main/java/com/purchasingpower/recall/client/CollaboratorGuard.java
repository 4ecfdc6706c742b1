package com.purchasingpower.recall.client;

import com.purchasingpower.recall.exception.CollaboratorTimeoutException;
import com.purchasingpower.recall.exception.KnowledgeGraphException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls with a bounded timeout.
 *
 * <p>Any failure of the call, including a timeout, surfaces as
 * {@link CollaboratorTimeoutException}. Engine exceptions thrown by the call
 * itself (e.g. a malformed payload) pass through unchanged.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class CollaboratorGuard {

    private final Executor executor;

    public CollaboratorGuard(@Qualifier("collaboratorExecutor") Executor executor) {
        this.executor = executor;
    }

    public <T> T call(String collaborator, Duration timeout, Supplier<T> work) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(work, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⚠️ {} timed out after {}ms", collaborator, timeout.toMillis());
            throw new CollaboratorTimeoutException(collaborator, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof KnowledgeGraphException) {
                throw (KnowledgeGraphException) cause;
            }
            log.warn("⚠️ {} failed: {}", collaborator, cause.getMessage());
            throw new CollaboratorTimeoutException(collaborator, timeout, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CollaboratorTimeoutException(collaborator, timeout, e);
        }
    }

    public void run(String collaborator, Duration timeout, Runnable work) {
        call(collaborator, timeout, () -> {
            work.run();
            return null;
        });
    }
}
