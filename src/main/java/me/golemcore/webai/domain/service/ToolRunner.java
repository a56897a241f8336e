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
import me.golemcore.webai.domain.model.ToolDescriptor;
import me.golemcore.webai.domain.model.ToolInput;
import me.golemcore.webai.domain.model.ToolOutcome;
import me.golemcore.webai.domain.model.ToolOutput;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs tools against a hard per-tool deadline and classifies each invocation as
 * success, timeout or error. Each tool gets exactly one attempt.
 *
 * <p>
 * On timeout the tool future is cancelled but never awaited; whatever it
 * produces later is discarded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolRunner {

    private final WebAiProperties properties;

    public ToolOutcome execute(ToolComponent tool, ToolInput input) {
        return start(tool, input).join();
    }

    /**
     * Runs all tools and returns their outcomes in the order of {@code tools},
     * regardless of completion order. Tools run concurrently, each against its own
     * deadline, unless {@code webai.tools.parallel=false}.
     */
    public List<ToolOutcome> executeAll(List<ToolComponent> tools, ToolInput input) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        if (!properties.getTools().isParallel()) {
            List<ToolOutcome> outcomes = new ArrayList<>(tools.size());
            for (ToolComponent tool : tools) {
                outcomes.add(execute(tool, input));
            }
            return outcomes;
        }

        List<CompletableFuture<ToolOutcome>> started = tools.stream()
                .map(tool -> start(tool, input))
                .toList();
        return started.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    long resolveTimeoutMs(ToolComponent tool) {
        ToolDescriptor descriptor = tool.getDescriptor();
        Long timeoutMs = descriptor != null ? descriptor.getTimeoutMs() : null;
        if (timeoutMs == null || timeoutMs <= 0) {
            return properties.getTools().getDefaultTimeoutMs();
        }
        return timeoutMs;
    }

    private CompletableFuture<ToolOutcome> start(ToolComponent tool, ToolInput input) {
        String toolId = tool.getToolId();
        long timeoutMs = resolveTimeoutMs(tool);

        CompletableFuture<ToolOutput> running;
        try {
            running = tool.run(input);
        } catch (Exception e) { // NOSONAR - tool failures are isolated per tool
            log.warn("[Tools] '{}' failed to start: {}", toolId, safeCauseMessage(e));
            return CompletableFuture.completedFuture(ToolOutcome.error(toolId, safeCauseMessage(e)));
        }
        if (running == null) {
            return CompletableFuture.completedFuture(ToolOutcome.error(toolId, "Tool returned no result"));
        }

        // The copy times out, not the tool's own future: only the deadline yields a
        // bare TimeoutException, tool failures arrive wrapped in CompletionException.
        return running.copy()
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((output, failure) -> {
                    if (failure == null) {
                        log.debug("[Tools] '{}' completed", toolId);
                        return ToolOutcome.success(toolId, output);
                    }
                    if (failure instanceof TimeoutException) {
                        running.cancel(true);
                        log.warn("[Tools] '{}' timed out after {}ms", toolId, timeoutMs);
                        return ToolOutcome.timeout(toolId, timeoutMs);
                    }
                    String message = safeCauseMessage(failure);
                    log.warn("[Tools] '{}' failed: {}", toolId, message);
                    return ToolOutcome.error(toolId, message);
                });
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        while ((cursor instanceof CompletionException || cursor instanceof ExecutionException)
                && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        if (cursor == null) {
            return "unknown";
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
