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

import me.golemcore.webai.domain.model.EntitlementSource;
import me.golemcore.webai.domain.model.ProviderMembership;

/**
 * Port for a remote membership/subscription service.
 *
 * <p>
 * Providers are queried in ascending {@link #getPriority()} order. A provider
 * that is not configured is skipped. Lookup failures are thrown and handled by
 * the caller.
 */
public interface EntitlementProviderPort {

    EntitlementSource getSource();

    int getPriority();

    boolean isConfigured();

    ProviderMembership lookup(String userId);
}
