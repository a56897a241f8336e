package me.golemcore.webai.adapter.outbound.telemetry;

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

import me.golemcore.webai.domain.model.AskCompletedEvent;
import me.golemcore.webai.domain.service.TelemetrySupport;
import me.golemcore.webai.port.outbound.TelemetryPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analytics sink writing one JSON line per completed ask to the
 * {@code [Analytics]} log. User ids are replaced with a short hash.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingTelemetryAdapter implements TelemetryPort {

    private final ObjectMapper objectMapper;

    @Override
    public void record(AskCompletedEvent event) {
        try {
            log.info("[Analytics] {}", objectMapper.writeValueAsString(toPayload(event)));
        } catch (JsonProcessingException e) {
            log.warn("[Analytics] Could not serialize event: {}", e.getMessage());
        }
    }

    Map<String, Object> toPayload(AskCompletedEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("t", event.getTimestamp() != null ? event.getTimestamp().toString() : null);
        payload.put("user", event.getUserId() != null ? TelemetrySupport.shortHash(event.getUserId()) : null);
        payload.put("plan", event.getPlan());
        payload.put("usedTools", event.getUsedTools());
        payload.put("timedOutTools", event.getTimedOutTools());
        payload.put("erroredTools", event.getErroredTools());
        payload.put("latencyMs", event.getLatencyMs());
        return payload;
    }
}
