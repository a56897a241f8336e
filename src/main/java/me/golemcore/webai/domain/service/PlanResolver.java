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
import me.golemcore.webai.domain.model.PlanPolicy;
import org.springframework.stereotype.Component;

/**
 * Maps an entitlement to one of the three fixed plan tiers.
 *
 * <p>
 * The enterprise tier is detected by a substring match on the provider plan id,
 * so any plan id containing {@value #ENTERPRISE_MARKER} qualifies.
 */
@Component
public class PlanResolver {

    static final String ENTERPRISE_MARKER = "enterprise";

    public static final PlanPolicy FREE = PlanPolicy.builder()
            .name("free")
            .tokenBudget(1000)
            .historyLimit(4)
            .enabledTool("math")
            .build();

    public static final PlanPolicy PRO = PlanPolicy.builder()
            .name("pro")
            .tokenBudget(8000)
            .historyLimit(10)
            .enabledTool("web")
            .enabledTool("math")
            .build();

    public static final PlanPolicy ENTERPRISE = PlanPolicy.builder()
            .name("enterprise")
            .tokenBudget(16000)
            .historyLimit(14)
            .enabledTool("web")
            .enabledTool("math")
            .build();

    public PlanPolicy policyFor(Entitlement entitlement) {
        if (entitlement == null || !entitlement.isActive()) {
            return FREE;
        }
        String plan = entitlement.getPlan();
        if (plan != null && plan.contains(ENTERPRISE_MARKER)) {
            return ENTERPRISE;
        }
        return PRO;
    }
}
