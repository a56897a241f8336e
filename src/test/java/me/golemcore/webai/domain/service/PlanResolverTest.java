package me.golemcore.webai.domain.service;

import me.golemcore.webai.domain.model.Entitlement;
import me.golemcore.webai.domain.model.EntitlementSource;
import me.golemcore.webai.domain.model.PlanPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanResolverTest {

    private final PlanResolver resolver = new PlanResolver();

    @Test
    void shouldResolveFreeTierForInactiveEntitlement() {
        PlanPolicy policy = resolver.policyFor(Entitlement.inactive());

        assertEquals("free", policy.getName());
        assertEquals(1000, policy.getTokenBudget());
        assertEquals(4, policy.getHistoryLimit());
        assertEquals(Set.of("math"), policy.getEnabledTools());
    }

    @Test
    void shouldResolveFreeTierForNullEntitlement() {
        assertSame(PlanResolver.FREE, resolver.policyFor(null));
    }

    @Test
    void shouldResolveProTierForAnyActivePlan() {
        PlanPolicy policy = resolver.policyFor(Entitlement.active("price_pro_monthly", EntitlementSource.WHOP));

        assertEquals("pro", policy.getName());
        assertEquals(8000, policy.getTokenBudget());
        assertEquals(10, policy.getHistoryLimit());
        assertEquals(Set.of("web", "math"), policy.getEnabledTools());
    }

    @Test
    void shouldResolveProTierForActiveEntitlementWithoutPlan() {
        assertSame(PlanResolver.PRO, resolver.policyFor(Entitlement.active(null, EntitlementSource.REVENUECAT)));
    }

    @ParameterizedTest
    @ValueSource(strings = { "enterprise", "webai_enterprise_yearly", "plan-enterprise" })
    void shouldResolveEnterpriseTierBySubstring(String plan) {
        PlanPolicy policy = resolver.policyFor(Entitlement.active(plan, EntitlementSource.WHOP));

        assertEquals("enterprise", policy.getName());
        assertEquals(16000, policy.getTokenBudget());
        assertEquals(14, policy.getHistoryLimit());
    }

    @Test
    void shouldMatchEnterpriseCaseSensitively() {
        assertSame(PlanResolver.PRO, resolver.policyFor(Entitlement.active("Enterprise", EntitlementSource.WHOP)));
    }

    @Test
    void shouldAllowOnlyListedTools() {
        assertTrue(PlanResolver.FREE.allowsTool("math"));
        assertFalse(PlanResolver.FREE.allowsTool("web"));
        assertFalse(PlanResolver.FREE.allowsTool(null));
    }
}
