package me.golemcore.webai.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the answer-generation backend (an LLM chat completion).
 */
public interface AnswerBackendPort {

    /**
     * Returns the provider identifier (e.g., "openai").
     */
    String getProviderId();

    /**
     * Generates an answer for the prompt using the given context blocks.
     * Completes exceptionally with
     * {@link me.golemcore.webai.domain.model.AskException} of kind
     * {@code SERVER_ERROR} when the backend is unreachable or misconfigured.
     */
    CompletableFuture<AnswerResponse> chat(String prompt, List<String> contextBlocks, int tokenBudget);

    /**
     * Checks if the backend is configured.
     */
    boolean isAvailable();
}
