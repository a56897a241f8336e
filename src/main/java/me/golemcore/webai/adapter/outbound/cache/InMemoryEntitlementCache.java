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

import me.golemcore.webai.domain.model.Entitlement;
import me.golemcore.webai.port.outbound.EntitlementCachePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local entitlement cache. Expired entries are not swept, they are
 * ignored on read and replaced by the next resolution.
 */
@Component
public class InMemoryEntitlementCache implements EntitlementCachePort {

    private final Map<String, CachedEntitlement> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Entitlement> get(String userId, Instant now) {
        CachedEntitlement cached = entries.get(userId);
        if (cached == null || !cached.expiresAt().isAfter(now)) {
            return Optional.empty();
        }
        return Optional.of(cached.entitlement());
    }

    @Override
    public void put(String userId, Entitlement entitlement, Instant expiresAt) {
        entries.put(userId, new CachedEntitlement(entitlement, expiresAt));
    }

    @Override
    public void evict(String userId) {
        entries.remove(userId);
    }

    private record CachedEntitlement(Entitlement entitlement, Instant expiresAt) {
    }
}
