package me.golemcore.webai.domain.model;

import java.util.List;

/**
 * Input handed to every tool of a request.
 *
 * @param prompt
 *            the trimmed user prompt
 * @param condensedHistory
 *            history contents already cut to the plan window
 * @param tokenBudget
 *            the plan token budget, may be null
 */
public record ToolInput(String prompt, List<String> condensedHistory, Integer tokenBudget) {

    public ToolInput {
        condensedHistory = condensedHistory != null ? List.copyOf(condensedHistory) : List.of();
    }
}
