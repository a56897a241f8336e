package me.golemcore.webai.tools;

import me.golemcore.webai.domain.model.ToolInput;
import me.golemcore.webai.domain.model.ToolOutput;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MathToolTest {

    private WebAiProperties properties;
    private MathTool tool;

    @BeforeEach
    void setUp() {
        properties = new WebAiProperties();
        tool = new MathTool(properties);
    }

    @Test
    void shouldContributeComputationLine() throws Exception {
        ToolOutput output = tool.run(new ToolInput("what is 2 + 2?", List.of(), 1000)).get();

        assertEquals("\n\n— Computation: 2 + 2 = 4", output.getText());
        assertTrue(output.getCitations().isEmpty());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "12*3|12*3 = 36",
            "10 - 25|10 - 25 = -15",
            "7 / 2|7 / 2 = 3.5",
            "9/3|9/3 = 3",
            "1 / 3|1 / 3 = 0.3333333333333333"
    })
    void shouldEvaluateBinaryExpressions(String prompt, String expected) {
        assertEquals("\n\n— Computation: " + expected, tool.evaluate(prompt).getText());
    }

    @Test
    void shouldUseFirstExpressionOnly() {
        assertEquals("\n\n— Computation: 3+4 = 7", tool.evaluate("3+4 and then 5*6").getText());
    }

    @ParameterizedTest
    @ValueSource(strings = { "hello there", "2 +", "8 / 0", "" })
    void shouldContributeNothingWithoutComputableExpression(String prompt) {
        assertFalse(tool.evaluate(prompt).hasText());
    }

    @Test
    void shouldHandleNullPrompt() {
        assertFalse(tool.evaluate(null).hasText());
    }

    @Test
    void shouldDescribeItselfFromConfig() {
        properties.getTools().getMath().setTimeoutMs(900);

        assertEquals("math", tool.getToolId());
        assertEquals("Math", tool.getDescriptor().getName());
        assertEquals(900L, tool.getDescriptor().getTimeoutMs());
        assertTrue(tool.isEnabled());

        properties.getTools().getMath().setEnabled(false);
        assertFalse(tool.isEnabled());
    }
}
