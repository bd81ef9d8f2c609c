package com.specforge.core.ai;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.ProviderFatalException;
import com.specforge.core.error.ProviderTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorates an {@link AiProvider} with timeout, bounded retry and fallback.
 *
 * <p>Each attempt runs on a worker thread and is bounded by {@link GenerationOptions#timeout()};
 * exceeding it interrupts the worker and counts as a transient failure. Transient failures are retried per {@link RetryPolicy}; when retries are
 * exhausted the fallback provider (if any) is tried with the same policy. Fatal failures are
 * rethrown immediately and never trigger the fallback.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AiProvider ai = new ResilientAiProvider(primary, secondary, RetryPolicy.defaults());
 * GenerationResult result = ai.generate(system, user, GenerationOptions.defaults());
 * }</pre>
 *
 * @since 1.0.0
 */
public class ResilientAiProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(ResilientAiProvider.class);

    private static final AtomicInteger WORKER_COUNT = new AtomicInteger();

    private static final ExecutorService ATTEMPTS = Executors.newCachedThreadPool(task -> {
        Thread worker = new Thread(task, "specforge-ai-attempt-" + WORKER_COUNT.incrementAndGet());
        worker.setDaemon(true);
        return worker;
    });

    private final AiProvider primary;
    private final AiProvider fallback;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public ResilientAiProvider(AiProvider primary, AiProvider fallback, RetryPolicy retryPolicy) {
        this(primary, fallback, retryPolicy, Sleeper.SYSTEM);
    }

    /**
     * Creates a resilient provider.
     *
     * @param primary provider tried first
     * @param fallback provider tried after the primary's transient failures, or {@code null}
     * @param retryPolicy retry bounds
     * @param sleeper backoff implementation
     */
    public ResilientAiProvider(AiProvider primary, AiProvider fallback, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.primary = Objects.requireNonNull(primary, "primary must not be null");
        this.fallback = fallback;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public String name() {
        return fallback == null ? primary.name() : primary.name() + "+" + fallback.name();
    }

    @Override
    public GenerationResult generate(String systemPrompt, String userPrompt, GenerationOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        try {
            return withRetry(primary, systemPrompt, userPrompt, options);
        } catch (ProviderTransientException e) {
            if (fallback == null) {
                throw e;
            }
            log.warn("Provider '{}' unavailable ({}), falling back to '{}'", primary.name(), e.getMessage(), fallback.name());
            return withRetry(fallback, systemPrompt, userPrompt, options);
        }
    }

    private GenerationResult withRetry(AiProvider provider, String systemPrompt, String userPrompt,
                                       GenerationOptions options) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return attempt(provider, systemPrompt, userPrompt, options);
            } catch (ProviderTransientException e) {
                if (attempt > retryPolicy.maxRetries()) {
                    log.warn("Provider '{}' failed after {} attempt(s): {}", provider.name(), attempt, e.getMessage());
                    throw e;
                }
                Duration delay = retryPolicy.delayAfter(attempt);
                log.debug("Provider '{}' attempt {}/{} failed ({}), retrying in {}ms",
                    provider.name(), attempt, retryPolicy.maxRetries() + 1, e.getMessage(), delay.toMillis());
                pause(delay, e);
            }
        }
    }

    private GenerationResult attempt(AiProvider provider, String systemPrompt, String userPrompt,
                                     GenerationOptions options) {
        long timeoutMillis = options.timeout().toMillis();
        Future<GenerationResult> call = ATTEMPTS.submit(() -> provider.generate(systemPrompt, userPrompt, options));
        try {
            return call.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ProviderTransientException(ErrorCode.PROVIDER_TIMEOUT,
                "Provider '" + provider.name() + "' timed out after " + timeoutMillis + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderTransientException(ErrorCode.PROVIDER_TRANSIENT,
                "Interrupted while waiting for provider '" + provider.name() + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ProviderTransientException transientFailure) {
                throw transientFailure;
            }
            if (cause instanceof ProviderFatalException fatal) {
                throw fatal;
            }
            throw new ProviderFatalException("Provider '" + provider.name() + "' failed: " + cause.getMessage(), cause);
        }
    }

    private void pause(Duration delay, ProviderTransientException failure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderTransientException(ErrorCode.PROVIDER_TRANSIENT, "Interrupted while backing off", failure);
        }
    }
}
