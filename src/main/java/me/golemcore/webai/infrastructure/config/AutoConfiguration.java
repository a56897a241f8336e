package me.golemcore.webai.infrastructure.config;

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

import me.golemcore.webai.port.outbound.AlertPort;
import me.golemcore.webai.port.outbound.AnswerBackendPort;
import me.golemcore.webai.port.outbound.EntitlementProviderPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Spring configuration for shared infrastructure beans and startup logging.
 *
 * <p>
 * Logs which collaborators are configured so that a missing secret is visible
 * at startup rather than on the first request.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private static final int TELEMETRY_QUEUE_CAPACITY = 1000;

    private final WebAiProperties properties;
    private final AnswerBackendPort answerBackendPort;
    private final List<EntitlementProviderPort> entitlementProviders;
    private final AlertPort alertPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Single daemon thread with a bounded queue for fire-and-forget telemetry and
     * alerts. Overflow is rejected and dropped by the caller.
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService telemetryExecutor() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(TELEMETRY_QUEUE_CAPACITY),
                r -> {
                    Thread t = new Thread(r, "telemetry-dispatch");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PostConstruct
    public void init() {
        log.info("WebAI ask service starting...");
        log.info("Answer backend: {} (available: {})", answerBackendPort.getProviderId(),
                answerBackendPort.isAvailable());
        if (!answerBackendPort.isAvailable()) {
            log.warn("webai.llm.api-key is not set, every ask will fail with SERVER_ERROR");
        }
        for (EntitlementProviderPort provider : entitlementProviders) {
            log.info("Entitlement provider {}: {}", provider.getSource().getId(),
                    provider.isConfigured() ? "configured" : "skipped");
        }
        log.info("Rate limit: {} ({} req/min)", properties.getRateLimit().isEnabled() ? "on" : "off",
                properties.getRateLimit().getRequestsPerMinute());
        log.info("Tool execution: {}", properties.getTools().isParallel() ? "parallel" : "sequential");
        log.info("Ops alerts: {}", alertPort.isAvailable() ? "enabled" : "disabled");
    }
}
