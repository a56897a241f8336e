package me.golemcore.webai.adapter.outbound.entitlement;

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

import me.golemcore.webai.domain.model.EntitlementSource;
import me.golemcore.webai.domain.model.ProviderMembership;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.infrastructure.http.FeignClientFactory;
import me.golemcore.webai.port.outbound.EntitlementProviderPort;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entitlement provider backed by RevenueCat subscribers. Queried after Whop.
 *
 * <p>
 * A user is active when any of their entitlements is flagged active; the plan
 * is the entitlement identifier.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code webai.entitlement.revenuecat.secret} - secret API key (provider
 * is skipped when blank)
 * <li>{@code webai.entitlement.revenuecat.base-url} - API base URL
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RevenueCatEntitlementAdapter implements EntitlementProviderPort {

    static final int PRIORITY = 20;

    private final FeignClientFactory feignClientFactory;
    private final WebAiProperties properties;

    private RevenueCatApi api;
    private String secret;

    @PostConstruct
    public void init() {
        WebAiProperties.RevenueCatProperties config = properties.getEntitlement().getRevenuecat();
        this.secret = config.getSecret();
        if (isConfigured()) {
            this.api = feignClientFactory.create(RevenueCatApi.class, config.getBaseUrl());
            log.info("[Entitlement] RevenueCat provider initialized");
        }
    }

    @Override
    public EntitlementSource getSource() {
        return EntitlementSource.REVENUECAT;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean isConfigured() {
        return secret != null && !secret.isBlank();
    }

    @Override
    public ProviderMembership lookup(String userId) {
        if (api == null) {
            return ProviderMembership.notFound();
        }
        SubscriberResponse response = api.subscriber(secret, userId);
        if (response == null || response.getSubscriber() == null
                || response.getSubscriber().getEntitlements() == null) {
            return ProviderMembership.notFound();
        }
        return response.getSubscriber().getEntitlements().entrySet().stream()
                .filter(entry -> entry.getValue() != null && entry.getValue().isActive())
                .map(Map.Entry::getKey)
                .findFirst()
                .map(ProviderMembership::active)
                .orElse(ProviderMembership.notFound());
    }

    // Feign API interface
    interface RevenueCatApi {
        // user ids are opaque; a slash must stay inside the path segment
        @RequestLine(value = "GET /v1/subscribers/{userId}", decodeSlash = false)
        @Headers({
                "Accept: application/json",
                "Authorization: Bearer {secret}"
        })
        SubscriberResponse subscriber(@Param("secret") String secret, @Param("userId") String userId);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SubscriberResponse {
        private Subscriber subscriber;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Subscriber {
        private LinkedHashMap<String, EntitlementInfo> entitlements;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EntitlementInfo {
        @JsonProperty("is_active")
        private boolean active;
    }
}
