/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.agentflow.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Retry decision and delay computation for failed task attempts.
 * <p>
 * The delay after failed attempt {@code k} is {@code min(base * multiplier^(k-1), max)}.
 * {@link #backoff(int)} is a pure function of {@code k}; jitter, when configured,
 * is applied separately by {@link #jitteredBackoff(int, RandomGenerator)} so that
 * concurrently failing tasks do not retry in lockstep.
 *
 * @param base delay after the first failed attempt
 * @param max ceiling for any delay
 * @param multiplier growth factor between consecutive delays
 * @param jitter relative jitter in [0, 1], e.g. 0.2 for a uniform +/-20%
 * @param classifier decides which errors may be retried
 */
public record BackoffPolicy(
        Duration base,
        Duration max,
        double multiplier,
        double jitter,
        ErrorClassifier classifier
) {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

    /**
     * Default policy: 2s base, 30s ceiling, doubling, no jitter.
     */
    public static final BackoffPolicy DEFAULT = new BackoffPolicy(
            DEFAULT_BASE, DEFAULT_MAX, 2.0, 0.0, new ErrorClassifier());

    public BackoffPolicy {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        Objects.requireNonNull(classifier, "classifier cannot be null");
        if (base.isNegative() || max.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
    }

    /**
     * Creates a doubling policy without jitter.
     *
     * @param base delay after the first failure
     * @param max delay ceiling
     * @return new policy
     */
    public static BackoffPolicy exponential(Duration base, Duration max) {
        return new BackoffPolicy(base, max, 2.0, 0.0, new ErrorClassifier());
    }

    public BackoffPolicy withJitter(double jitter) {
        return new BackoffPolicy(base, max, multiplier, jitter, classifier);
    }

    public BackoffPolicy withClassifier(ErrorClassifier classifier) {
        return new BackoffPolicy(base, max, multiplier, jitter, classifier);
    }

    /**
     * Decides whether the task may be attempted again after the given failure.
     * The attempt cap of the task itself is checked by the caller.
     *
     * @param error the error of the failed attempt
     * @param attempt the failed attempt number (1-based)
     * @return true if the error is retryable
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        return attempt >= 1 && classifier.isRetryable(error);
    }

    /**
     * Calculates the delay to wait after a failed attempt.
     *
     * @param attempt the failed attempt number (1-based)
     * @return the delay duration
     */
    public Duration backoff(int attempt) {
        if (attempt < 1) {
            return Duration.ZERO;
        }
        double delayMs = base.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(delayMs, (double) max.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Calculates the delay with uniform jitter applied.
     *
     * @param attempt the failed attempt number (1-based)
     * @param random the random source
     * @return the jittered delay, never negative
     */
    public Duration jitteredBackoff(int attempt, RandomGenerator random) {
        Duration delay = backoff(attempt);
        if (jitter == 0.0 || delay.isZero()) {
            return delay;
        }
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitter;
        return Duration.ofMillis(Math.max(0L, Math.round(delay.toMillis() * factor)));
    }

    /**
     * Gets the delay actually slept before the next attempt.
     *
     * @param attempt the failed attempt number (1-based)
     * @return the delay
     */
    public Duration delayFor(int attempt) {
        return jitteredBackoff(attempt, ThreadLocalRandom.current());
    }
}
