package me.golemcore.webai.port.outbound;

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

import java.time.Instant;
import java.util.Optional;

/**
 * Keyed store of resolved entitlements with an expiry instant per entry.
 */
public interface EntitlementCachePort {

    /**
     * Returns the cached entitlement if present and not expired at {@code now}.
     */
    Optional<Entitlement> get(String userId, Instant now);

    void put(String userId, Entitlement entitlement, Instant expiresAt);

    void evict(String userId);
}
