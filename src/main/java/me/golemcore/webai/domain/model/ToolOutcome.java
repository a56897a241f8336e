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

/**
 * Result of running one tool for a request.
 */
public record ToolOutcome(String toolId, ToolOutcomeKind kind, ToolOutput output, String error) {

    public static ToolOutcome success(String toolId, ToolOutput output) {
        return new ToolOutcome(toolId, ToolOutcomeKind.SUCCESS, output != null ? output : ToolOutput.empty(), null);
    }

    public static ToolOutcome timeout(String toolId, long timeoutMs) {
        return new ToolOutcome(toolId, ToolOutcomeKind.TIMEOUT, null, "Timed out after " + timeoutMs + "ms");
    }

    public static ToolOutcome error(String toolId, String error) {
        return new ToolOutcome(toolId, ToolOutcomeKind.ERROR, null, error);
    }

    /**
     * Whether this outcome contributes text to the answer context.
     */
    public boolean isUsable() {
        return kind == ToolOutcomeKind.SUCCESS && output != null && output.hasText();
    }
}
