package me.golemcore.webai.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Payload of a successful ask.
 *
 * <p>
 * {@link #API_VERSION} must be bumped whenever this shape changes
 * incompatibly.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AskData {

    public static final int API_VERSION = 2;

    String answer;
    List<Citation> citations;
    List<String> usedTools;
    Integer tokensUsed;
    long latencyMs;
    Entitlement entitlement;
    List<String> timedOutTools;
    List<String> erroredTools;
    @Builder.Default
    int version = API_VERSION;
}
