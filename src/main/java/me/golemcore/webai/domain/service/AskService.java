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

import me.golemcore.webai.domain.model.AskData;
import me.golemcore.webai.domain.model.AskException;
import me.golemcore.webai.domain.model.AskRequest;
import me.golemcore.webai.domain.model.AskResult;
import me.golemcore.webai.domain.model.Entitlement;
import me.golemcore.webai.domain.model.RateLimitResult;
import me.golemcore.webai.port.outbound.RateLimitPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Request-level entry of the ask workflow: input normalisation, rate limit and
 * subscription gates, then {@link AskOrchestrator}. Every call produces exactly
 * one {@link AskResult}.
 *
 * <p>
 * Unexpected failures raise a best-effort operational alert and are reported
 * as a generic {@code SERVER_ERROR}; {@link AskException} keeps its own code
 * and message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AskService {

    private static final String ALERT_PREFIX = "ask.error ";

    private final RateLimitPort rateLimitPort;
    private final EntitlementService entitlementService;
    private final AskOrchestrator orchestrator;
    private final TelemetryService telemetryService;

    public AskResult ask(AskRequest raw) {
        AskRequest request = normalize(raw);
        if (request.getPrompt().isEmpty()) {
            return AskResult.badRequest("Missing prompt.");
        }

        try {
            RateLimitResult rateLimit = rateLimitPort.tryConsume(request.getUserId());
            if (!rateLimit.isAllowed()) {
                log.debug("[Ask] Rate limited user {}", TelemetrySupport.shortHash(request.getUserId()));
                return AskResult.rateLimited(rateLimit.getRetryAfterSeconds());
            }

            Entitlement entitlement = entitlementService.resolve(request.getUserId());
            if (!entitlement.isActive()) {
                return AskResult.subscriptionRequired();
            }

            AskData data = orchestrator.run(request);
            return AskResult.success(data);
        } catch (AskException e) {
            log.warn("[Ask] Failed with {}: {}", e.getCode(), e.getMessage());
            telemetryService.alert(ALERT_PREFIX + e.getMessage());
            return AskResult.failure(e.getCode(), e.getMessage());
        } catch (Exception e) { // NOSONAR - every failure must map to a structured result
            log.error("[Ask] Unexpected failure", e);
            telemetryService.alert(ALERT_PREFIX + describe(e));
            return AskResult.serverError();
        }
    }

    private static AskRequest normalize(AskRequest raw) {
        AskRequest source = raw != null ? raw : new AskRequest();
        return AskRequest.builder()
                .prompt(source.getPrompt() != null ? source.getPrompt().trim() : "")
                .history(source.getHistory() != null ? source.getHistory() : new ArrayList<>())
                .userId(source.getUserId())
                .toolIds(source.getToolIds())
                .sessionId(source.getSessionId())
                .stream(source.getStream())
                .build();
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
