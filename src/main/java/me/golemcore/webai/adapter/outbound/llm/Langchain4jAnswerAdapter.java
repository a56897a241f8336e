package me.golemcore.webai.adapter.outbound.llm;

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

import me.golemcore.webai.domain.model.AnswerResponse;
import me.golemcore.webai.domain.model.AskErrorCode;
import me.golemcore.webai.domain.model.AskException;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.AnswerBackendPort;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Answer backend using an OpenAI chat model through langchain4j.
 *
 * <p>
 * The conversation sent to the model is the system prompt, one user message
 * per context block, then the prompt itself. Output size is derived from the
 * plan token budget: half the budget, capped at
 * {@code webai.llm.max-output-tokens}.
 *
 * <p>
 * Without {@code webai.llm.api-key} every call fails with a
 * {@code SERVER_ERROR} "Model unavailable".
 *
 * <p>
 * Provider ID: {@code "openai"}
 */
@Component
@Slf4j
public class Langchain4jAnswerAdapter implements AnswerBackendPort {

    private final WebAiProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    public Langchain4jAnswerAdapter(WebAiProperties properties) {
        this.properties = properties;
    }

    Langchain4jAnswerAdapter(WebAiProperties properties, ChatModel chatModel) {
        this.properties = properties;
        this.chatModel = chatModel;
        this.initialized = true;
    }

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public boolean isAvailable() {
        if (initialized) {
            return chatModel != null;
        }
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<AnswerResponse> chat(String prompt, List<String> contextBlocks, int tokenBudget) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = ensureInitialized();
            if (model == null) {
                throw new AskException("Model unavailable", AskErrorCode.SERVER_ERROR);
            }

            ChatRequest request = ChatRequest.builder()
                    .messages(buildMessages(prompt, contextBlocks))
                    .maxOutputTokens(resolveMaxOutputTokens(tokenBudget))
                    .build();

            ChatResponse response;
            try {
                response = model.chat(request);
            } catch (RuntimeException e) {
                log.error("[LLM] Chat request failed: {}", e.getMessage());
                throw new AskException("Model request failed", AskErrorCode.SERVER_ERROR, e);
            }
            return convertResponse(response);
        });
    }

    List<ChatMessage> buildMessages(String prompt, List<String> contextBlocks) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(properties.getLlm().getSystemPrompt()));
        if (contextBlocks != null) {
            for (String block : contextBlocks) {
                messages.add(UserMessage.from(block));
            }
        }
        messages.add(UserMessage.from(prompt));
        return messages;
    }

    int resolveMaxOutputTokens(int tokenBudget) {
        WebAiProperties.LlmProperties llm = properties.getLlm();
        if (tokenBudget <= 0) {
            return llm.getDefaultOutputTokens();
        }
        return Math.max(1, Math.min(llm.getMaxOutputTokens(), tokenBudget / 2));
    }

    private AnswerResponse convertResponse(ChatResponse response) {
        String text = response.aiMessage() != null && response.aiMessage().text() != null
                ? response.aiMessage().text()
                : "";
        Integer tokensUsed = response.tokenUsage() != null ? response.tokenUsage().totalTokenCount() : null;
        return AnswerResponse.builder()
                .text(text)
                .tokensUsed(tokensUsed)
                .build();
    }

    private synchronized ChatModel ensureInitialized() {
        if (initialized) {
            return chatModel;
        }
        WebAiProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() != null && !llm.getApiKey().isBlank()) {
            var builder = OpenAiChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(llm.getModel())
                    .maxRetries(0)
                    .timeout(Duration.ofMillis(llm.getTimeoutMs()));
            if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
                builder.baseUrl(llm.getBaseUrl());
            }
            this.chatModel = builder.build();
            log.info("[LLM] OpenAI answer backend initialized with model: {}", llm.getModel());
        }
        initialized = true;
        return chatModel;
    }
}
