package me.golemcore.webai.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Text generated by the answer backend plus its reported token usage (if any).
 */
@Value
@Builder
public class AnswerResponse {

    String text;
    Integer tokensUsed;
}
