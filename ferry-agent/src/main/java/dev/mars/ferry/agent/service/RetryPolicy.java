/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.ferry.agent.service;

import java.time.Duration;

/**
 * Bounded exponential backoff for upload attempts.
 *
 * <p>Attempt 1 starts immediately. The wait before attempt {@code k + 1} is
 * {@code baseDelay * 2^(k - 1)}, so the defaults give 1s, 2s, 4s and 8s between five
 * attempts.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay cannot be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * @param attempt 1-based attempt number
     * @return how long to wait before starting {@code attempt}
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt < 1 || attempt > maxAttempts) {
            throw new IllegalArgumentException("attempt must be in [1, " + maxAttempts + "], got: " + attempt);
        }
        if (attempt == 1) {
            return Duration.ZERO;
        }
        return baseDelay.multipliedBy(1L << (attempt - 2));
    }

    public boolean hasAttemptAfter(int attempt) {
        return attempt < maxAttempts;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay.toMillis() + "ms}";
    }
}
