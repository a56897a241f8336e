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
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single prior message of the conversation, supplied by the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationTurn {

    private Role role;
    private String content;
    private Long ts;

    public enum Role {
        @JsonProperty("user")
        USER,

        @JsonProperty("assistant")
        ASSISTANT
    }

    public static ConversationTurn user(String content) {
        return ConversationTurn.builder().role(Role.USER).content(content).build();
    }

    public static ConversationTurn assistant(String content) {
        return ConversationTurn.builder().role(Role.ASSISTANT).content(content).build();
    }
}
