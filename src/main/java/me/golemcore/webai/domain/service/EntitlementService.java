package me.golemcore.webai.domain.service;

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

import me.golemcore.webai.domain.model.Entitlement;
import me.golemcore.webai.domain.model.ProviderMembership;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.EntitlementCachePort;
import me.golemcore.webai.port.outbound.EntitlementProviderPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves and caches per-user entitlements.
 *
 * <p>
 * Resolution order:
 * <ol>
 * <li>no user id - inactive, without touching cache or providers</li>
 * <li>live cache entry - returned as is</li>
 * <li>configured providers in ascending priority - the first one reporting an
 * active membership wins</li>
 * </ol>
 * A provider failure counts as "nothing found" for that provider. Every
 * resolution, active or not, is cached for {@code webai.entitlement.cache-ttl-ms}.
 *
 * <p>
 * Concurrent misses for the same user share one provider round.
 */
@Service
@Slf4j
public class EntitlementService {

    private final List<EntitlementProviderPort> providers;
    private final EntitlementCachePort cache;
    private final WebAiProperties properties;
    private final Clock clock;
    private final Map<String, CompletableFuture<Entitlement>> inFlight = new ConcurrentHashMap<>();

    public EntitlementService(List<EntitlementProviderPort> providers, EntitlementCachePort cache,
            WebAiProperties properties, Clock clock) {
        this.providers = providers != null
                ? providers.stream().sorted(Comparator.comparingInt(EntitlementProviderPort::getPriority)).toList()
                : List.of();
        this.cache = cache;
        this.properties = properties;
        this.clock = clock;
    }

    public Entitlement resolve(String userId) {
        if (userId == null || userId.isBlank()) {
            return Entitlement.inactive();
        }

        Optional<Entitlement> cached = cache.get(userId, Instant.now(clock));
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<Entitlement> pending = new CompletableFuture<>();
        CompletableFuture<Entitlement> existing = inFlight.putIfAbsent(userId, pending);
        if (existing != null) {
            return awaitShared(existing);
        }

        try {
            Entitlement resolved = queryProviders(userId);
            Instant expiresAt = Instant.now(clock).plus(Duration.ofMillis(properties.getEntitlement().getCacheTtlMs()));
            cache.put(userId, resolved, expiresAt);
            pending.complete(resolved);
            return resolved;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(userId, pending);
        }
    }

    /**
     * Drops the cached entitlement so the next lookup queries providers again.
     */
    public void evict(String userId) {
        if (userId != null) {
            cache.evict(userId);
        }
    }

    private Entitlement queryProviders(String userId) {
        for (EntitlementProviderPort provider : providers) {
            if (!provider.isConfigured()) {
                continue;
            }
            try {
                ProviderMembership membership = provider.lookup(userId);
                if (membership != null && membership.active()) {
                    log.debug("[Entitlement] Active membership via {} (user {})", provider.getSource().getId(),
                            TelemetrySupport.shortHash(userId));
                    return Entitlement.active(membership.plan(), provider.getSource());
                }
            } catch (Exception e) { // NOSONAR - a failing provider must not fail the request
                log.warn("[Entitlement] Provider {} lookup failed: {}", provider.getSource().getId(), e.getMessage());
            }
        }
        return Entitlement.inactive();
    }

    private Entitlement awaitShared(CompletableFuture<Entitlement> shared) {
        try {
            return shared.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
