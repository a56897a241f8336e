package me.golemcore.webai.adapter.outbound.cache;

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

import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.RateCounterPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local rate limit counters.
 *
 * <p>
 * Buckets remember when their window ends and a background sweep drops
 * finished buckets every {@code webai.rate-limit.sweep-interval-ms}, so the map
 * only holds the current windows of active users.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryRateCounterStore implements RateCounterPort {

    private static final int EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 2;

    private final WebAiProperties properties;
    private final Clock clock;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "rate-limit-sweep");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long interval = properties.getRateLimit().getSweepIntervalMs();
        if (interval > 0) {
            sweepExecutor.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
        }
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public long incrementAndGet(String key, Instant windowEnd) {
        return buckets.computeIfAbsent(key, k -> new Bucket(windowEnd)).count().incrementAndGet();
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = buckets.size();
        buckets.values().removeIf(bucket -> !bucket.windowEnd().isAfter(now));
        return Math.max(0, before - buckets.size());
    }

    int size() {
        return buckets.size();
    }

    private void sweep() {
        try {
            int removed = purgeExpired(Instant.now(clock));
            if (removed > 0) {
                log.debug("[RateLimit] Purged {} expired buckets", removed);
            }
        } catch (RuntimeException e) {
            log.warn("[RateLimit] Bucket sweep failed", e);
        }
    }

    private record Bucket(Instant windowEnd, AtomicLong count) {
        Bucket(Instant windowEnd) {
            this(windowEnd, new AtomicLong());
        }
    }
}
