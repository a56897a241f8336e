package me.golemcore.webai;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the WebAI ask service.
 *
 * <p>
 * Answers a prompt by combining an LLM call with auxiliary tool lookups, gated
 * by per-user entitlement, rate limit and plan tier.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → AskController
 * Domain Layer       → AskService, AskOrchestrator, EntitlementService,
 *                      PlanResolver, ToolRunner, TelemetryService
 * Infrastructure     → Entitlement/LLM/Alert/Telemetry adapters, tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code webai.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WebAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(WebAiApplication.class, args);
    }

}
