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
import me.golemcore.webai.domain.model.AnswerResponse;
import me.golemcore.webai.domain.model.AskCompletedEvent;
import me.golemcore.webai.domain.model.AskData;
import me.golemcore.webai.domain.model.AskRequest;
import me.golemcore.webai.domain.model.Citation;
import me.golemcore.webai.domain.model.Entitlement;
import me.golemcore.webai.domain.model.PlanPolicy;
import me.golemcore.webai.domain.model.ToolInput;
import me.golemcore.webai.domain.model.ToolOutcome;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.AnswerBackendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Core ask workflow: entitlement and plan, history condensation, tool fan-out,
 * answer generation and result assembly.
 *
 * <p>
 * Tool failures and timeouts are recorded on the result and never abort the
 * workflow. A failing answer backend does, there is no fallback answer.
 * Tool output is merged in registry order whatever the completion order.
 */
@Service
@Slf4j
public class AskOrchestrator {

    static final String TOOLS_CONTEXT_HEADER = "Tools info:\n";
    static final String TOOL_TEXT_SEPARATOR = "\n\n";

    private final EntitlementService entitlementService;
    private final PlanResolver planResolver;
    private final ToolRegistry toolRegistry;
    private final ToolRunner toolRunner;
    private final AnswerBackendPort answerBackend;
    private final TelemetryService telemetryService;
    private final WebAiProperties properties;
    private final Clock clock;

    public AskOrchestrator(EntitlementService entitlementService, PlanResolver planResolver,
            ToolRegistry toolRegistry, ToolRunner toolRunner, AnswerBackendPort answerBackend,
            TelemetryService telemetryService, WebAiProperties properties, Clock clock) {
        this.entitlementService = entitlementService;
        this.planResolver = planResolver;
        this.toolRegistry = toolRegistry;
        this.toolRunner = toolRunner;
        this.answerBackend = answerBackend;
        this.telemetryService = telemetryService;
        this.properties = properties;
        this.clock = clock;
    }

    public AskData run(AskRequest request) {
        long startedAt = clock.millis();

        Entitlement entitlement = entitlementService.resolve(request.getUserId());
        PlanPolicy policy = planResolver.policyFor(entitlement);

        List<String> history = HistoryCondenser.condense(request.getHistory(), policy.getHistoryLimit(),
                properties.getHistory().getCharLimit());

        List<ToolComponent> tools = toolRegistry.eligibleFor(policy);
        ToolInput input = new ToolInput(request.getPrompt(), history, policy.getTokenBudget());
        List<ToolOutcome> outcomes = toolRunner.executeAll(tools, input);

        List<String> usedTools = new ArrayList<>();
        List<String> timedOutTools = new ArrayList<>();
        List<String> erroredTools = new ArrayList<>();
        List<String> toolTexts = new ArrayList<>();
        List<Citation> citations = new ArrayList<>();
        for (ToolOutcome outcome : outcomes) {
            switch (outcome.kind()) {
            case SUCCESS -> {
                if (outcome.isUsable()) {
                    usedTools.add(outcome.toolId());
                    toolTexts.add(outcome.output().getText());
                    citations.addAll(outcome.output().getCitations());
                }
            }
            case TIMEOUT -> timedOutTools.add(outcome.toolId());
            case ERROR -> erroredTools.add(outcome.toolId());
            }
        }

        List<String> contextBlocks = toolTexts.isEmpty()
                ? List.of()
                : List.of(TOOLS_CONTEXT_HEADER + String.join(TOOL_TEXT_SEPARATOR, toolTexts));

        log.debug("[Ask] plan={}, tools={}, used={}, timedOut={}, errored={}", policy.getName(),
                tools.size(), usedTools, timedOutTools, erroredTools);

        AnswerResponse answer = generateAnswer(request.getPrompt(), contextBlocks, policy.getTokenBudget());

        AskData data = AskData.builder()
                .answer(answer.getText())
                .citations(List.copyOf(citations))
                .usedTools(List.copyOf(usedTools))
                .tokensUsed(answer.getTokensUsed())
                .latencyMs(clock.millis() - startedAt)
                .entitlement(entitlement)
                .timedOutTools(List.copyOf(timedOutTools))
                .erroredTools(List.copyOf(erroredTools))
                .version(AskData.API_VERSION)
                .build();

        telemetryService.recordAskCompleted(AskCompletedEvent.builder()
                .timestamp(Instant.now(clock))
                .userId(request.getUserId())
                .plan(entitlement.getPlan() != null && !entitlement.getPlan().isBlank()
                        ? entitlement.getPlan()
                        : policy.getName())
                .usedTools(data.getUsedTools())
                .timedOutTools(data.getTimedOutTools())
                .erroredTools(data.getErroredTools())
                .latencyMs(data.getLatencyMs())
                .build());

        return data;
    }

    private AnswerResponse generateAnswer(String prompt, List<String> contextBlocks, int tokenBudget) {
        try {
            AnswerResponse response = answerBackend.chat(prompt, contextBlocks, tokenBudget).get();
            if (response == null) {
                throw new IllegalStateException("Answer backend returned no response");
            }
            return response;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the answer backend", e);
        } catch (ExecutionException e) {
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Answer backend failed", cause);
    }
}
