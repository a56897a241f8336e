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

import me.golemcore.webai.domain.component.ToolComponent;
import me.golemcore.webai.domain.model.PlanPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static ordered collection of tools. Registration order (Spring
 * {@code @Order} of the tool beans) is also the merge order of tool output.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolRegistry(List<ToolComponent> toolComponents) {
        if (toolComponents == null) {
            return;
        }
        for (ToolComponent tool : toolComponents) {
            if (tool == null) {
                continue;
            }
            String toolId = tool.getToolId();
            if (toolId == null || toolId.isBlank()) {
                log.warn("[Tools] Skipping tool without id: {}", tool.getClass().getSimpleName());
                continue;
            }
            if (tools.putIfAbsent(toolId, tool) != null) {
                throw new IllegalStateException("Duplicate tool id: " + toolId);
            }
        }
        log.debug("[Tools] Registered tools: {}", tools.keySet());
    }

    /**
     * Tools that are enabled and allowed by the plan, in registry order.
     */
    public List<ToolComponent> eligibleFor(PlanPolicy policy) {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .filter(tool -> policy.allowsTool(tool.getToolId()))
                .toList();
    }
}
