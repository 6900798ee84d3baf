/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.assistant.domain.system;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides which model failures are worth another attempt and how long to wait
 * before it: {@code base * 2^attempt} plus up to half a second of jitter,
 * capped at 30 seconds.
 */
@Slf4j
public class RetryPolicy {

    public static final Duration MAX_DELAY = Duration.ofSeconds(30);
    private static final double MAX_JITTER_SECONDS = 0.5;

    private final DoubleSupplier jitter;

    public RetryPolicy() {
        this(() -> ThreadLocalRandom.current().nextDouble(0.0, MAX_JITTER_SECONDS));
    }

    /**
     * @param jitter
     *            source of jitter in seconds; values outside [0, 0.5] are
     *            clamped
     */
    public RetryPolicy(DoubleSupplier jitter) {
        this.jitter = jitter;
    }

    public boolean isRetryable(Throwable error) {
        String code = LlmErrorClassifier.classify(error);
        boolean retryable = LlmErrorClassifier.isTransientCode(code);
        log.debug("[Retry] Classified {} as {} (retryable: {})",
                error != null ? error.getClass().getSimpleName() : "null", code, retryable);
        return retryable;
    }

    /**
     * Delay before the attempt that follows the failed attempt number
     * {@code attempt} (0-based).
     */
    public Duration delay(int attempt, Duration base) {
        double baseSeconds = base.toNanos() / 1_000_000_000.0;
        double exponential = baseSeconds * Math.pow(2, Math.max(0, attempt));
        double jitterSeconds = Math.min(MAX_JITTER_SECONDS, Math.max(0.0, jitter.getAsDouble()));
        double seconds = Math.min(exponential + jitterSeconds, MAX_DELAY.getSeconds());
        return Duration.ofNanos((long) (seconds * 1_000_000_000L));
    }

    /**
     * Sleeps for the given delay. An interrupt restores the flag and is reported
     * as a cancellation.
     */
    public void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting to retry");
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
