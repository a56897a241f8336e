package me.golemcore.webai.domain.service;

import me.golemcore.webai.domain.component.ToolComponent;
import me.golemcore.webai.domain.model.PlanPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    @Test
    void shouldKeepRegistrationOrder() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("web", true), tool("math", true)));

        assertEquals(List.of("web", "math"), ids(registry.eligibleFor(PlanResolver.ENTERPRISE)));
    }

    @Test
    void shouldRejectDuplicateIds() {
        List<ToolComponent> tools = List.of(tool("web", true), tool("web", true));

        assertThrows(IllegalStateException.class, () -> new ToolRegistry(tools));
    }

    @Test
    void shouldSkipToolsWithoutId() {
        ToolRegistry registry = new ToolRegistry(List.of(tool(" ", true), tool("math", true)));

        assertEquals(List.of("math"), ids(registry.eligibleFor(PlanResolver.ENTERPRISE)));
    }

    @Test
    void shouldFilterByPlanAndEnabledFlag() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("web", true), tool("math", true)));

        assertEquals(List.of("math"), ids(registry.eligibleFor(PlanResolver.FREE)));
        assertEquals(List.of("web", "math"), ids(registry.eligibleFor(PlanResolver.PRO)));
    }

    @Test
    void shouldExcludeDisabledTools() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("web", false), tool("math", true)));

        assertEquals(List.of("math"), ids(registry.eligibleFor(PlanResolver.ENTERPRISE)));
    }

    @Test
    void shouldReturnNothingForPlanWithoutTools() {
        ToolRegistry registry = new ToolRegistry(List.of(tool("web", true)));
        PlanPolicy none = PlanPolicy.builder().name("none").tokenBudget(1).historyLimit(0).build();

        assertTrue(registry.eligibleFor(none).isEmpty());
    }

    private static List<String> ids(List<ToolComponent> tools) {
        return tools.stream().map(ToolComponent::getToolId).toList();
    }

    private static ToolComponent tool(String id, boolean enabled) {
        ToolComponent tool = mock(ToolComponent.class);
        when(tool.getToolId()).thenReturn(id);
        when(tool.isEnabled()).thenReturn(enabled);
        return tool;
    }
}
