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


package me.golemcore.assistant.domain.model;

import java.time.Duration;

/**
 * Per-run limits of the orchestrator loop.
 *
 * @param maxIterations
 *            upper bound of model calls that may request tools
 * @param maxRetries
 *            total attempts for one model call, including the first
 * @param baseRetryDelay
 *            base of the exponential backoff between attempts
 */
public record AgentConfig(int maxIterations, int maxRetries, Duration baseRetryDelay) {

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_RETRY_DELAY = Duration.ofSeconds(1);

    public AgentConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be positive: " + maxRetries);
        }
        if (baseRetryDelay == null || baseRetryDelay.isNegative()) {
            throw new IllegalArgumentException("baseRetryDelay must be non-negative");
        }
    }

    public static AgentConfig defaults() {
        return new AgentConfig(DEFAULT_MAX_ITERATIONS, DEFAULT_MAX_RETRIES, DEFAULT_BASE_RETRY_DELAY);
    }
}
