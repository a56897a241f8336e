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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties for the ask service, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code webai.*} prefix. This class
 * contains nested property classes for the different subsystems:
 * <ul>
 * <li>{@link RateLimitProperties} - per-user request limit</li>
 * <li>{@link EntitlementProperties} - membership providers and cache TTL</li>
 * <li>{@link HistoryProperties} - history condensation</li>
 * <li>{@link LlmProperties} - answer backend</li>
 * <li>{@link ToolsProperties} - tool timeouts and execution strategy</li>
 * <li>{@link AlertsProperties} / {@link TelemetryProperties} - operational
 * sinks</li>
 * <li>{@link HttpProperties} - shared HTTP client</li>
 * </ul>
 *
 * <p>
 * Secrets are expected to come from environment variables through property
 * placeholders.
 */
@Component
@ConfigurationProperties(prefix = "webai")
@Data
public class WebAiProperties {

    private RateLimitProperties rateLimit = new RateLimitProperties();
    private EntitlementProperties entitlement = new EntitlementProperties();
    private HistoryProperties history = new HistoryProperties();
    private LlmProperties llm = new LlmProperties();
    private ToolsProperties tools = new ToolsProperties();
    private AlertsProperties alerts = new AlertsProperties();
    private TelemetryProperties telemetry = new TelemetryProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class RateLimitProperties {
        private boolean enabled = true;
        private int requestsPerMinute = 30;
        private int retryAfterSeconds = 60;
        private long sweepIntervalMs = 60000;
    }

    // ==================== ENTITLEMENT ====================

    @Data
    public static class EntitlementProperties {
        private long cacheTtlMs = 300000;
        private WhopProperties whop = new WhopProperties();
        private RevenueCatProperties revenuecat = new RevenueCatProperties();
    }

    @Data
    public static class WhopProperties {
        private String apiKey;
        private String baseUrl = "https://api.whop.com";
    }

    @Data
    public static class RevenueCatProperties {
        private String secret;
        private String baseUrl = "https://api.revenuecat.com";
    }

    @Data
    public static class HistoryProperties {
        private int charLimit = 800;
    }

    @Data
    public static class LlmProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private String systemPrompt = "WebAI Pro";
        private int maxOutputTokens = 1024;
        private int defaultOutputTokens = 512;
        private long timeoutMs = 60000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private long defaultTimeoutMs = 5000;
        private boolean parallel = true;
        private WebToolProperties web = new WebToolProperties();
        private MathToolProperties math = new MathToolProperties();
    }

    @Data
    public static class WebToolProperties {
        private boolean enabled = true;
        private long timeoutMs = 8000;
        private String braveApiKey;
        private int resultCount = 5;
    }

    @Data
    public static class MathToolProperties {
        private boolean enabled = true;
        private long timeoutMs = 1500;
    }

    @Data
    public static class AlertsProperties {
        private String slackWebhookUrl;
    }

    @Data
    public static class TelemetryProperties {
        private boolean enabled = true;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
