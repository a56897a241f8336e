package me.golemcore.webai.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A user's current subscription status as reported by the first entitlement
 * provider that knows about an active membership.
 *
 * <p>
 * An inactive entitlement carries no guaranteed plan. Users without an
 * identifier always resolve to {@link #inactive()}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Entitlement {

    private static final Entitlement INACTIVE = Entitlement.builder()
            .active(false)
            .source(EntitlementSource.NONE)
            .build();

    boolean active;
    String plan;
    @Builder.Default
    EntitlementSource source = EntitlementSource.NONE;

    public static Entitlement inactive() {
        return INACTIVE;
    }

    public static Entitlement active(String plan, EntitlementSource source) {
        return Entitlement.builder()
                .active(true)
                .plan(plan)
                .source(source)
                .build();
    }
}
