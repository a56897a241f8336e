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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Text and citations produced by one tool run. Empty text means the tool had
 * nothing to contribute for this prompt.
 */
@Value
@Builder
public class ToolOutput {

    @Builder.Default
    String text = "";
    @Singular
    List<Citation> citations;
    Integer tokensUsed;

    public static ToolOutput text(String text) {
        return ToolOutput.builder().text(text).build();
    }

    public static ToolOutput empty() {
        return ToolOutput.builder().build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }
}
