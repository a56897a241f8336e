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

import java.util.List;

/**
 * Entitlement provider backed by Whop memberships.
 *
 * <p>
 * A user is active when any of their memberships has status {@code active};
 * the plan is the price id of that first active membership, not of the first
 * membership in the response.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code webai.entitlement.whop.api-key} - API key (provider is skipped
 * when blank)
 * <li>{@code webai.entitlement.whop.base-url} - API base URL
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WhopEntitlementAdapter implements EntitlementProviderPort {

    static final int PRIORITY = 10;
    private static final String STATUS_ACTIVE = "active";

    private final FeignClientFactory feignClientFactory;
    private final WebAiProperties properties;

    private WhopApi api;
    private String apiKey;

    @PostConstruct
    public void init() {
        WebAiProperties.WhopProperties config = properties.getEntitlement().getWhop();
        this.apiKey = config.getApiKey();
        if (isConfigured()) {
            this.api = feignClientFactory.create(WhopApi.class, config.getBaseUrl());
            log.info("[Entitlement] Whop provider initialized");
        }
    }

    @Override
    public EntitlementSource getSource() {
        return EntitlementSource.WHOP;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ProviderMembership lookup(String userId) {
        if (api == null) {
            return ProviderMembership.notFound();
        }
        MembershipsResponse response = api.memberships(apiKey, userId);
        if (response == null || response.getData() == null) {
            return ProviderMembership.notFound();
        }
        return response.getData().stream()
                .filter(membership -> STATUS_ACTIVE.equals(membership.getStatus()))
                .findFirst()
                .map(membership -> ProviderMembership.active(membership.getPriceId()))
                .orElse(ProviderMembership.notFound());
    }

    // Feign API interface
    interface WhopApi {
        @RequestLine("GET /api/v2/memberships?user_id={userId}")
        @Headers({
                "Accept: application/json",
                "Authorization: Bearer {apiKey}"
        })
        MembershipsResponse memberships(@Param("apiKey") String apiKey, @Param("userId") String userId);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MembershipsResponse {
        private List<Membership> data;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Membership {
        private String status;
        @JsonProperty("price_id")
        private String priceId;
    }
}
