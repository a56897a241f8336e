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
import me.golemcore.webai.domain.model.ToolDescriptor;
import me.golemcore.webai.domain.model.ToolInput;
import me.golemcore.webai.domain.model.ToolOutput;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tool for simple arithmetic ({@code math}).
 *
 * <p>
 * Finds the first {@code <integer> <op> <integer>} expression in the prompt
 * ({@code + - * /}) and contributes {@code "— Computation: <expr> = <result>"}.
 * Prompts without an expression, and division by zero, produce empty text.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class MathTool implements ToolComponent {

    static final String TOOL_ID = "math";
    private static final Pattern EXPRESSION = Pattern.compile("(\\d+)\\s*([+\\-*/])\\s*(\\d+)");

    private final WebAiProperties properties;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getMath().isEnabled();
    }

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .id(TOOL_ID)
                .name("Math")
                .description("Evaluates math")
                .timeoutMs(properties.getTools().getMath().getTimeoutMs())
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> run(ToolInput input) {
        return CompletableFuture.completedFuture(evaluate(input.prompt()));
    }

    ToolOutput evaluate(String prompt) {
        if (prompt == null) {
            return ToolOutput.empty();
        }
        Matcher matcher = EXPRESSION.matcher(prompt);
        if (!matcher.find()) {
            return ToolOutput.empty();
        }

        BigDecimal left = new BigDecimal(matcher.group(1));
        BigDecimal right = new BigDecimal(matcher.group(3));
        BigDecimal result;
        switch (matcher.group(2)) {
        case "+" -> result = left.add(right);
        case "-" -> result = left.subtract(right);
        case "*" -> result = left.multiply(right);
        default -> {
            if (right.signum() == 0) {
                return ToolOutput.empty();
            }
            result = left.divide(right, MathContext.DECIMAL64);
        }
        }

        return ToolOutput.text("\n\n— Computation: " + matcher.group(0) + " = "
                + result.stripTrailingZeros().toPlainString());
    }
}
