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

import me.golemcore.webai.domain.model.AskCompletedEvent;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.AlertPort;
import me.golemcore.webai.port.outbound.TelemetryPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget dispatch of analytics events and operational alerts.
 *
 * <p>
 * Sinks run on a dedicated executor. Neither a slow nor a failing sink can
 * block or fail the request that produced the event.
 */
@Service
@Slf4j
public class TelemetryService {

    private final TelemetryPort telemetryPort;
    private final AlertPort alertPort;
    private final WebAiProperties properties;
    private final Executor executor;

    public TelemetryService(TelemetryPort telemetryPort, AlertPort alertPort, WebAiProperties properties,
            @Qualifier("telemetryExecutor") Executor executor) {
        this.telemetryPort = telemetryPort;
        this.alertPort = alertPort;
        this.properties = properties;
        this.executor = executor;
    }

    public void recordAskCompleted(AskCompletedEvent event) {
        if (event == null || !properties.getTelemetry().isEnabled()) {
            return;
        }
        dispatch("analytics", () -> telemetryPort.record(event));
    }

    public void alert(String message) {
        if (!alertPort.isAvailable()) {
            log.debug("[Telemetry] Alert sink not configured, dropping: {}", message);
            return;
        }
        dispatch("alert", () -> alertPort.notify(message));
    }

    private void dispatch(String sink, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) { // NOSONAR - sinks are best effort
                    log.warn("[Telemetry] {} sink failed: {}", sink, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Telemetry] {} queue full, event dropped", sink);
        }
    }
}
