package me.golemcore.webai.domain.service;

import me.golemcore.webai.adapter.outbound.cache.InMemoryEntitlementCache;
import me.golemcore.webai.domain.model.Entitlement;
import me.golemcore.webai.domain.model.EntitlementSource;
import me.golemcore.webai.domain.model.ProviderMembership;
import me.golemcore.webai.infrastructure.config.WebAiProperties;
import me.golemcore.webai.port.outbound.EntitlementProviderPort;
import me.golemcore.webai.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class EntitlementServiceTest {

    private static final String USER_ID = "user-1";

    private EntitlementProviderPort whop;
    private EntitlementProviderPort revenueCat;
    private InMemoryEntitlementCache cache;
    private WebAiProperties properties;
    private MutableClock clock;
    private EntitlementService service;

    @BeforeEach
    void setUp() {
        whop = provider(EntitlementSource.WHOP, 10);
        revenueCat = provider(EntitlementSource.REVENUECAT, 20);
        cache = new InMemoryEntitlementCache();
        properties = new WebAiProperties();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        // deliberately registered out of priority order
        service = new EntitlementService(List.of(revenueCat, whop), cache, properties, clock);
    }

    @Test
    void shouldReturnInactiveForMissingUserWithoutQueryingProviders() {
        assertFalse(service.resolve(null).isActive());
        assertFalse(service.resolve("   ").isActive());

        verify(whop, never()).lookup(anyString());
        verify(revenueCat, never()).lookup(anyString());
    }

    @Test
    void shouldPreferWhopWhenBothAreActive() {
        when(whop.lookup(USER_ID)).thenReturn(ProviderMembership.active("price_pro"));
        when(revenueCat.lookup(USER_ID)).thenReturn(ProviderMembership.active("premium"));

        Entitlement entitlement = service.resolve(USER_ID);

        assertTrue(entitlement.isActive());
        assertEquals("price_pro", entitlement.getPlan());
        assertEquals(EntitlementSource.WHOP, entitlement.getSource());
        verify(revenueCat, never()).lookup(anyString());
    }

    @Test
    void shouldFallBackToRevenueCatWhenWhopHasNoActiveMembership() {
        when(whop.lookup(USER_ID)).thenReturn(ProviderMembership.notFound());
        when(revenueCat.lookup(USER_ID)).thenReturn(ProviderMembership.active("premium"));

        Entitlement entitlement = service.resolve(USER_ID);

        assertTrue(entitlement.isActive());
        assertEquals("premium", entitlement.getPlan());
        assertEquals(EntitlementSource.REVENUECAT, entitlement.getSource());
    }

    @Test
    void shouldTreatProviderFailureAsNotFound() {
        when(whop.lookup(USER_ID)).thenThrow(new IllegalStateException("whop down"));
        when(revenueCat.lookup(USER_ID)).thenReturn(ProviderMembership.active("premium"));

        Entitlement entitlement = service.resolve(USER_ID);

        assertTrue(entitlement.isActive());
        assertEquals(EntitlementSource.REVENUECAT, entitlement.getSource());
    }

    @Test
    void shouldReturnInactiveWhenAllProvidersFail() {
        when(whop.lookup(USER_ID)).thenThrow(new IllegalStateException("whop down"));
        when(revenueCat.lookup(USER_ID)).thenThrow(new IllegalStateException("revenuecat down"));

        Entitlement entitlement = service.resolve(USER_ID);

        assertFalse(entitlement.isActive());
        assertEquals(EntitlementSource.NONE, entitlement.getSource());
    }

    @Test
    void shouldSkipUnconfiguredProviders() {
        when(whop.isConfigured()).thenReturn(false);
        when(revenueCat.lookup(USER_ID)).thenReturn(ProviderMembership.active("premium"));

        Entitlement entitlement = service.resolve(USER_ID);

        assertEquals(EntitlementSource.REVENUECAT, entitlement.getSource());
        verify(whop, never()).lookup(anyString());
    }

    @Test
    void shouldServeCachedEntitlementWithinTtl() {
        when(whop.lookup(USER_ID)).thenReturn(ProviderMembership.active("price_pro"));

        service.resolve(USER_ID);
        clock.advance(Duration.ofMinutes(4));
        Entitlement second = service.resolve(USER_ID);

        assertTrue(second.isActive());
        verify(whop, times(1)).lookup(USER_ID);
    }

    @Test
    void shouldQueryAgainAfterTtlExpires() {
        when(whop.lookup(USER_ID)).thenReturn(ProviderMembership.active("price_pro"));

        service.resolve(USER_ID);
        clock.advance(Duration.ofMillis(properties.getEntitlement().getCacheTtlMs()));
        service.resolve(USER_ID);

        verify(whop, times(2)).lookup(USER_ID);
    }

    @Test
    void shouldCacheInactiveResolutionToo() {
        when(whop.lookup(USER_ID)).thenReturn(ProviderMembership.notFound());
        when(revenueCat.lookup(USER_ID)).thenReturn(ProviderMembership.notFound());

        assertFalse(service.resolve(USER_ID).isActive());
        assertFalse(service.resolve(USER_ID).isActive());

        verify(whop, times(1)).lookup(USER_ID);
        verify(revenueCat, times(1)).lookup(USER_ID);
    }

    @Test
    void shouldQueryProvidersAgainAfterEvict() {
        when(whop.lookup(USER_ID)).thenReturn(ProviderMembership.active("price_pro"));

        service.resolve(USER_ID);
        service.evict(USER_ID);
        service.resolve(USER_ID);

        verify(whop, times(2)).lookup(USER_ID);
    }

    @Test
    void shouldShareOneProviderRoundForConcurrentMisses() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        when(whop.lookup(USER_ID)).thenAnswer(invocation -> {
            calls.incrementAndGet();
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return ProviderMembership.active("price_pro");
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<Entitlement>> results = new ArrayList<>();
            results.add(pool.submit(() -> service.resolve(USER_ID)));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 3; i++) {
                results.add(pool.submit(() -> service.resolve(USER_ID)));
            }
            // give the followers time to join the pending round
            Thread.sleep(100);
            release.countDown();

            for (Future<Entitlement> result : results) {
                assertEquals("price_pro", result.get(5, TimeUnit.SECONDS).getPlan());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, calls.get());
    }

    @Test
    void shouldReleaseWaitingCallersWhenLeaderFailsWithError() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(whop.lookup(USER_ID)).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            throw new LinkageError("provider class broken");
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Entitlement> leader = pool.submit(() -> service.resolve(USER_ID));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<Entitlement> follower = pool.submit(() -> service.resolve(USER_ID));
            Thread.sleep(100);
            release.countDown();

            ExecutionException leaderError = assertThrows(ExecutionException.class,
                    () -> leader.get(5, TimeUnit.SECONDS));
            assertInstanceOf(LinkageError.class, leaderError.getCause());
            ExecutionException followerError = assertThrows(ExecutionException.class,
                    () -> follower.get(5, TimeUnit.SECONDS));
            assertInstanceOf(LinkageError.class, followerError.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private static EntitlementProviderPort provider(EntitlementSource source, int priority) {
        EntitlementProviderPort provider = mock(EntitlementProviderPort.class);
        when(provider.getSource()).thenReturn(source);
        when(provider.getPriority()).thenReturn(priority);
        when(provider.isConfigured()).thenReturn(true);
        when(provider.lookup(anyString())).thenReturn(ProviderMembership.notFound());
        return provider;
    }
}
