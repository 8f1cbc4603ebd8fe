package com.flagship.card_autopay.common.concurrency;

import com.flagship.card_autopay.common.exception.ExternalCallException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls to the bank and the gateway on a dedicated executor with a hard deadline.
 *
 * A timeout cancels the running future and surfaces as an {@link ExternalCallException}
 * with {@code timeout = true}. Runtime exceptions thrown by the call itself propagate
 * unchanged.
 */
@Slf4j
public class ExternalCallGuard {

    public static final String BANK_SYNC = "bankSync";
    public static final String GATEWAY_SUBMIT = "gatewaySubmit";

    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;

    public ExternalCallGuard(TimeLimiterRegistry timeLimiterRegistry, ExecutorService executor) {
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    public <T> T call(String name, Supplier<T> call) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(name);
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, executor));
        } catch (TimeoutException e) {
            log.warn("External call {} timed out after {}", name,
                timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new ExternalCallException(name + " timed out after "
                + timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalCallException(name + " was interrupted", e, false);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalCallException(name + " failed: " + e.getMessage(), e, false);
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
