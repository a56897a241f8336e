package me.golemcore.webai.domain.service;

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

import me.golemcore.webai.domain.model.ConversationTurn;

import java.util.List;

/**
 * Cuts conversation history down to a plan window: the last
 * {@code historyLimit} turns, each truncated to {@code charLimit} characters.
 */
public final class HistoryCondenser {

    public static final String TRUNCATION_MARKER = "…";

    private HistoryCondenser() {
    }

    public static List<String> condense(List<ConversationTurn> history, int historyLimit, int charLimit) {
        if (history == null || history.isEmpty() || historyLimit <= 0) {
            return List.of();
        }
        int from = Math.max(0, history.size() - historyLimit);
        return history.subList(from, history.size()).stream()
                .map(turn -> truncate(turn != null ? turn.getContent() : null, charLimit))
                .toList();
    }

    static String truncate(String content, int charLimit) {
        if (content == null) {
            return "";
        }
        if (charLimit < 0 || content.length() <= charLimit) {
            return content;
        }
        return content.substring(0, charLimit) + TRUNCATION_MARKER;
    }
}
