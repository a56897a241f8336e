package me.golemcore.webai.ratelimit;

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

import me.golemcore.webai.domain.model.RateLimitResult;
import me.golemcore.webai.domain.service.TelemetrySupport;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.RateCounterPort;
import me.golemcore.webai.port.outbound.RateLimitPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-user fixed-window rate limiter.
 *
 * <p>
 * Each request increments the counter of the {@code (user, current minute)}
 * bucket; the request is admitted while the post-increment count stays within
 * {@code webai.rate-limit.requests-per-minute} (default 30/min). Denied
 * requests advertise a constant {@code retry-after-seconds} instead of the
 * exact time left in the window.
 *
 * <p>
 * Requests without a user id are never limited. Counters are not
 * linearizable across instances or restarts; concurrent requests of one user
 * are counted atomically within this process.
 *
 * <p>
 * Can be disabled via {@code webai.rate-limit.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FixedWindowRateLimiter implements RateLimitPort {

    static final Duration WINDOW = Duration.ofMinutes(1);

    private final RateCounterPort counters;
    private final WebAiProperties properties;
    private final Clock clock;

    @Override
    public RateLimitResult tryConsume(String userId) {
        WebAiProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled() || userId == null || userId.isBlank()) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        long windowIndex = clock.millis() / WINDOW.toMillis();
        String key = bucketKey(userId, windowIndex);
        Instant windowEnd = Instant.ofEpochMilli((windowIndex + 1) * WINDOW.toMillis());

        long count = counters.incrementAndGet(key, windowEnd);
        int max = config.getRequestsPerMinute();
        if (count <= max) {
            return RateLimitResult.allowed(max - count);
        }

        log.debug("[RateLimit] Limit exceeded for user {} ({} > {})", TelemetrySupport.shortHash(userId), count, max);
        return RateLimitResult.denied(Duration.ofSeconds(config.getRetryAfterSeconds()), "Rate limit exceeded");
    }

    static String bucketKey(String userId, long windowIndex) {
        return "rl:" + userId + ":" + windowIndex;
    }
}
