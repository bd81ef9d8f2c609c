package com.specforge.core.ai;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.ProviderFatalException;
import com.specforge.core.error.ProviderTransientException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResilientAiProvider}.
 */
class ResilientAiProviderTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;
    private final RetryPolicy twoRetries = new RetryPolicy(2, Duration.ofMillis(100));

    @Test
    void generate_transientThenSuccess_retriesWithBackoff() {
        ScriptedAiProvider primary = new ScriptedAiProvider("primary")
            .thenThrow(new ProviderTransientException("503"))
            .thenThrow(new ProviderTransientException("503"))
            .thenReturn("done");

        GenerationResult result = new ResilientAiProvider(primary, null, twoRetries, recordingSleeper)
            .generate("system", "user", GenerationOptions.defaults());

        assertThat(result.content()).isEqualTo("done");
        assertThat(primary.callCount()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void generate_primaryExhausted_usesFallback() {
        ScriptedAiProvider primary = new ScriptedAiProvider("primary")
            .thenThrow(new ProviderTransientException("503"))
            .thenThrow(new ProviderTransientException("503"))
            .thenThrow(new ProviderTransientException("503"));
        ScriptedAiProvider fallback = new ScriptedAiProvider("fallback").thenReturn("from fallback");

        ResilientAiProvider provider = new ResilientAiProvider(primary, fallback, twoRetries, recordingSleeper);
        GenerationResult result = provider.generate("system", "user", GenerationOptions.defaults());

        assertThat(result.content()).isEqualTo("from fallback");
        assertThat(result.provider()).isEqualTo("fallback");
        assertThat(primary.callCount()).isEqualTo(3);
        assertThat(provider.name()).isEqualTo("primary+fallback");
    }

    @Test
    void generate_fatalFailure_isNotRetriedOrFallenBack() {
        ScriptedAiProvider primary = new ScriptedAiProvider("primary")
            .thenThrow(new ProviderFatalException("401 invalid key"));
        ScriptedAiProvider fallback = new ScriptedAiProvider("fallback").thenReturn("unused");

        assertThatThrownBy(() -> new ResilientAiProvider(primary, fallback, twoRetries, recordingSleeper)
                .generate("system", "user", GenerationOptions.defaults()))
            .isInstanceOf(ProviderFatalException.class)
            .hasMessageContaining("401");

        assertThat(primary.callCount()).isEqualTo(1);
        assertThat(fallback.callCount()).isZero();
        assertThat(sleeps).isEmpty();
    }

    @Test
    void generate_allAttemptsTransient_throwsLastFailure() {
        ScriptedAiProvider primary = new ScriptedAiProvider("primary")
            .thenThrow(new ProviderTransientException("first"))
            .thenThrow(new ProviderTransientException("last"));

        assertThatThrownBy(() -> new ResilientAiProvider(primary, null, new RetryPolicy(1, Duration.ZERO), recordingSleeper)
                .generate("system", "user", GenerationOptions.defaults()))
            .isInstanceOf(ProviderTransientException.class)
            .hasMessage("last");
    }

    @Test
    void generate_unexpectedException_becomesFatal() {
        ScriptedAiProvider primary = new ScriptedAiProvider("primary")
            .thenThrow(new IllegalArgumentException("bad prompt"));

        assertThatThrownBy(() -> new ResilientAiProvider(primary, null, twoRetries, recordingSleeper)
                .generate("system", "user", GenerationOptions.defaults()))
            .isInstanceOf(ProviderFatalException.class)
            .hasMessageContaining("bad prompt");
        assertThat(primary.callCount()).isEqualTo(1);
    }

    @Test
    void generate_slowProvider_timesOutAsTransient() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        ScriptedAiProvider primary = new ScriptedAiProvider("primary").then(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new GenerationResult("late", 0, "primary", null);
        });
        GenerationOptions quick = GenerationOptions.defaults().withTimeout(Duration.ofMillis(50));

        try {
            assertThatThrownBy(() -> new ResilientAiProvider(primary, null, new RetryPolicy(0, Duration.ZERO), recordingSleeper)
                    .generate("system", "user", quick))
                .isInstanceOf(ProviderTransientException.class)
                .satisfies(e -> assertThat(((ProviderTransientException) e).getErrorCode())
                    .isEqualTo(ErrorCode.PROVIDER_TIMEOUT));
        } finally {
            release.countDown();
        }
    }

    @Test
    void generate_slowProvider_isInterruptedOnTimeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        ScriptedAiProvider primary = new ScriptedAiProvider("primary").then(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return new GenerationResult("late", 0, "primary", null);
        });
        GenerationOptions quick = GenerationOptions.defaults().withTimeout(Duration.ofMillis(50));

        assertThatThrownBy(() -> new ResilientAiProvider(primary, null, new RetryPolicy(0, Duration.ZERO), recordingSleeper)
                .generate("system", "user", quick))
            .isInstanceOf(ProviderTransientException.class);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void delayAfter_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(250));

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(250));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofSeconds(1));
    }
}
