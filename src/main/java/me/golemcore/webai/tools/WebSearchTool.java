package me.golemcore.webai.tools;

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
import me.golemcore.webai.domain.model.Citation;
import me.golemcore.webai.domain.model.ToolDescriptor;
import me.golemcore.webai.domain.model.ToolInput;
import me.golemcore.webai.domain.model.ToolOutput;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Tool for web search ({@code web}).
 *
 * <p>
 * With a Brave Search API key the prompt is sent to Brave Search and the
 * results become the tool text and citations. Without a key the tool only
 * contributes a search hint line built from the prompt.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code webai.tools.web.enabled} - Enable/disable
 * <li>{@code webai.tools.web.timeout-ms} - deadline (default 8000)
 * <li>{@code webai.tools.web.brave-api-key} - Brave API key (optional)
 * <li>{@code webai.tools.web.result-count} - Number of results (default 5)
 * </ul>
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    static final String TOOL_ID = "web";
    static final int HINT_PROMPT_CHARS = 100;
    private static final int MAX_QUERY_CHARS = 400;

    private final FeignClientFactory feignClientFactory;
    private final WebAiProperties properties;

    private BraveSearchApi searchApi;
    private String apiKey;

    @PostConstruct
    public void init() {
        WebAiProperties.WebToolProperties config = properties.getTools().getWeb();
        this.apiKey = config.getBraveApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            this.searchApi = feignClientFactory.create(BraveSearchApi.class, "https://api.search.brave.com");
            log.info("[Tools] Web search backed by Brave Search (results: {})", config.getResultCount());
        } else {
            log.info("[Tools] Web search running without a search backend");
        }
    }

    @Override
    public boolean isEnabled() {
        return properties.getTools().getWeb().isEnabled();
    }

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .id(TOOL_ID)
                .name("Web")
                .description("Web Search")
                .timeoutMs(properties.getTools().getWeb().getTimeoutMs())
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> run(ToolInput input) {
        return CompletableFuture.supplyAsync(() -> {
            String prompt = input.prompt() != null ? input.prompt() : "";
            if (searchApi == null) {
                return ToolOutput.text("\n\n— Web search for: " + truncate(prompt, HINT_PROMPT_CHARS) + "...");
            }
            return search(truncate(prompt, MAX_QUERY_CHARS));
        });
    }

    private ToolOutput search(String query) {
        int count = Math.max(1, Math.min(20, properties.getTools().getWeb().getResultCount()));
        log.debug("[Tools] Brave Search: count={}", count);
        BraveSearchResponse response = searchApi.search(apiKey, query, count);
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return ToolOutput.empty();
        }

        List<WebResult> results = response.getWeb().getResults();
        String listing = results.stream()
                .map(r -> r.getTitle() + "\n" + r.getUrl() + "\n"
                        + (r.getDescription() != null ? r.getDescription() : ""))
                .collect(Collectors.joining("\n\n"));

        return ToolOutput.builder()
                .text("\n\n— Web search results:\n\n" + listing)
                .citations(results.stream()
                        .map(r -> Citation.builder()
                                .title(r.getTitle() != null ? r.getTitle() : r.getUrl())
                                .url(r.getUrl())
                                .snippet(r.getDescription())
                                .build())
                        .toList())
                .build();
    }

    private static String truncate(String value, int maxChars) {
        return value.length() > maxChars ? value.substring(0, maxChars) : value;
    }

    // Feign API interface
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}
