/*
 * Copyright 2012 TouK
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
 */
package pl.touk.charon.failover;

import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import pl.touk.charon.ConnectionManager;
import pl.touk.charon.FailoverConfig;
import pl.touk.charon.cache.CacheAccessException;
import pl.touk.charon.cache.InMemoryStatusCache;
import pl.touk.charon.cache.StatusCache;
import pl.touk.charon.event.FailoverEvent;
import pl.touk.charon.event.FailoverEventDispatcher;
import pl.touk.charon.event.RecordingFailoverListener;
import pl.touk.charon.health.ConnectionStateStore;
import pl.touk.charon.health.ConnectionStatus;
import pl.touk.charon.health.ScriptedHealthProbe;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static pl.touk.charon.event.FailoverEvent.Kind.CACHE_UNAVAILABLE;
import static pl.touk.charon.event.FailoverEvent.Kind.CONNECTION_HEALTHY;
import static pl.touk.charon.event.FailoverEvent.Kind.EXITED_LIMITED_FUNCTIONALITY;
import static pl.touk.charon.event.FailoverEvent.Kind.LIMITED_FUNCTIONALITY_ACTIVATED;
import static pl.touk.charon.event.FailoverEvent.Kind.PRIMARY_RESTORED;
import static pl.touk.charon.event.FailoverEvent.Kind.SWITCHED_TO_FAILOVER;
import static pl.touk.charon.event.FailoverEvent.Kind.SWITCHED_TO_PRIMARY;

/**
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class FailoverCoordinatorTest {

    private final FailoverConfig config = new FailoverConfig("primary", "failover", "blocking", 1, 300);

    private ScriptedHealthProbe probe;
    private RecordingFailoverListener listener;
    private FailoverEventDispatcher dispatcher;
    private ConnectionStateStore store;
    private ConnectionManager manager;
    private FailoverCoordinator coordinator;

    @Before
    public void setUp() {
        probe = new ScriptedHealthProbe();
        listener = new RecordingFailoverListener();
        dispatcher = new FailoverEventDispatcher();
        dispatcher.addListener(listener);
        store = new ConnectionStateStore(config, probe, new InMemoryStatusCache(), dispatcher);
        manager = mock(ConnectionManager.class);
        when(manager.getActiveConnection()).thenReturn("primary");
        coordinator = new FailoverCoordinator(config, store, manager, dispatcher);
    }

    private void given(ConnectionStatus primary, ConnectionStatus failover) {
        store.setConnectionStatus("primary", primary);
        store.setConnectionStatus("failover", failover);
    }

    @Test
    public void shouldPreferPrimaryWhenBothHealthy() {
        given(ConnectionStatus.HEALTHY, ConnectionStatus.HEALTHY);
        assertEquals("primary", coordinator.resolveActiveConnection());
    }

    @Test
    public void shouldChooseFailoverWhenPrimaryDown() {
        given(ConnectionStatus.DOWN, ConnectionStatus.HEALTHY);
        assertEquals("failover", coordinator.resolveActiveConnection());
    }

    @Test
    public void shouldChooseBlockingWhenBothDown() {
        given(ConnectionStatus.DOWN, ConnectionStatus.DOWN);
        assertEquals("blocking", coordinator.resolveActiveConnection());
    }

    @Test
    public void shouldChoosePrimaryWhenNothingIsKnown() {
        assertEquals("primary", coordinator.resolveActiveConnection());
    }

    @Test
    public void shouldChooseFailoverWhenPrimaryUnknownWithFailures() {
        // given:
        store.setConnectionStatus("primary", ConnectionStatus.UNKNOWN, 1);
        store.setConnectionStatus("failover", ConnectionStatus.HEALTHY);

        // then:
        assertEquals("failover", coordinator.resolveActiveConnection());
    }

    @Test
    public void shouldChooseBlockingWhenBothUnknownWithFailures() {
        // given:
        store.setConnectionStatus("primary", ConnectionStatus.UNKNOWN, 1);
        store.setConnectionStatus("failover", ConnectionStatus.UNKNOWN, 0);

        // then:
        assertEquals("blocking", coordinator.resolveActiveConnection());
    }

    @Test
    public void shouldNotTrustEmptyStateWhenOptimisticDefaultIsOff() {
        // given:
        FailoverConfig pessimistic = new FailoverConfig("primary", "failover", "blocking", "SELECT 1", 5, 1,
                "0 * * * * ?", "charon", 300, false, true);
        ConnectionStateStore s = new ConnectionStateStore(pessimistic, probe, new InMemoryStatusCache(), dispatcher);
        FailoverCoordinator c = new FailoverCoordinator(pessimistic, s, manager, dispatcher);

        // then:
        assertEquals("blocking", c.resolveActiveConnection());
    }

    @Test
    public void shouldAnnounceFirstDecisionWithoutPrevious() {
        // given:
        given(ConnectionStatus.HEALTHY, ConnectionStatus.HEALTHY);

        // when:
        String active = coordinator.determineAndSetConnection();

        // then:
        assertEquals("primary", active);
        verify(manager).setActiveConnection("primary");
        assertEquals(Collections.singletonList(SWITCHED_TO_PRIMARY), listener.getKinds());
        FailoverEvent e = listener.last(SWITCHED_TO_PRIMARY);
        assertNull(e.getPreviousConnectionName());
        assertEquals("primary", e.getConnectionName());
    }

    @Test
    public void shouldNotRepeatSwitchWhenNothingChanged() {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.HEALTHY);
        coordinator.determineAndSetConnection();
        listener.clear();

        // when:
        String active = coordinator.determineAndSetConnection();

        // then:
        assertEquals("failover", active);
        verify(manager, times(1)).setActiveConnection("failover");
        assertTrue(listener.getEvents().isEmpty());
    }

    @Test
    public void shouldActivateLimitedFunctionalityOnceAndExitWithPrimary() {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.DOWN);

        // when:
        coordinator.determineAndSetConnection();
        coordinator.determineAndSetConnection();
        coordinator.determineAndSetConnection();

        // then:
        assertEquals(Collections.singletonList(LIMITED_FUNCTIONALITY_ACTIVATED), listener.getKinds());
        assertEquals("blocking", listener.last(LIMITED_FUNCTIONALITY_ACTIVATED).getConnectionName());

        // when:
        listener.clear();
        probe.set("primary", true);
        store.updateConnectionStatus("primary");
        String active = coordinator.determineAndSetConnection();

        // then:
        assertEquals("primary", active);
        assertEquals(Arrays.asList(CONNECTION_HEALTHY, PRIMARY_RESTORED, SWITCHED_TO_PRIMARY, EXITED_LIMITED_FUNCTIONALITY),
                listener.getKinds());
        assertEquals("blocking", listener.last(SWITCHED_TO_PRIMARY).getPreviousConnectionName());
        assertEquals("primary", listener.last(EXITED_LIMITED_FUNCTIONALITY).getConnectionName());
    }

    @Test
    public void shouldExitLimitedFunctionalityWithFailover() {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.DOWN);
        coordinator.determineAndSetConnection();
        listener.clear();

        // when:
        store.setConnectionStatus("failover", ConnectionStatus.HEALTHY);
        coordinator.determineAndSetConnection();

        // then:
        assertEquals(Arrays.asList(SWITCHED_TO_FAILOVER, EXITED_LIMITED_FUNCTIONALITY), listener.getKinds());
        assertEquals("blocking", listener.last(SWITCHED_TO_FAILOVER).getPreviousConnectionName());
    }

    @Test
    public void shouldSurviveUnavailableCache() throws CacheAccessException {
        // given:
        StatusCache broken = mock(StatusCache.class);
        when(broken.get(anyString())).thenThrow(new CacheAccessException("timeout"));
        ConnectionStateStore s = new ConnectionStateStore(config, probe, broken, dispatcher);
        FailoverCoordinator c = new FailoverCoordinator(config, s, manager, dispatcher);

        // when:
        String active = c.determineAndSetConnection();

        // then:
        assertEquals("primary", active);
        assertEquals(4, listener.count(CACHE_UNAVAILABLE));
        assertEquals(1, listener.count(SWITCHED_TO_PRIMARY));
    }

    @Test
    public void shouldPropagateFailureToApplyAndRetryNextTime() {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.HEALTHY);
        doThrow(new IllegalArgumentException("unknown connection")).when(manager).setActiveConnection("failover");

        // when:
        try {
            coordinator.determineAndSetConnection();
            fail("IllegalArgumentException expected");
        } catch (IllegalArgumentException e) {
            // then:
            assertTrue(listener.getEvents().isEmpty());
            assertEquals("primary", coordinator.getCurrentActiveConnectionName());
        }
    }

    @Test
    public void shouldForceSwitchToPrimaryResettingHealth() {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.DOWN);
        coordinator.determineAndSetConnection();
        listener.clear();

        // when:
        coordinator.forceSwitchToPrimary();

        // then:
        assertEquals(ConnectionStatus.HEALTHY, store.getConnectionStatus("primary"));
        assertEquals(ConnectionStatus.HEALTHY, store.getConnectionStatus("failover"));
        assertEquals(0, store.getFailureCount("primary"));
        assertEquals("primary", coordinator.getCurrentActiveConnectionName());
        assertEquals(Arrays.asList(SWITCHED_TO_PRIMARY, EXITED_LIMITED_FUNCTIONALITY), listener.getKinds());
    }

    @Test
    public void shouldForceSwitchToFailoverKeepingHealth() {
        // given:
        given(ConnectionStatus.HEALTHY, ConnectionStatus.DOWN);

        // when:
        coordinator.forceSwitchToFailover();
        coordinator.forceSwitchToFailover();

        // then:
        assertEquals(ConnectionStatus.DOWN, store.getConnectionStatus("failover"));
        verify(manager, times(1)).setActiveConnection("failover");
        assertEquals(Collections.singletonList(SWITCHED_TO_FAILOVER), listener.getKinds());
        assertEquals("failover", coordinator.getCurrentActiveConnectionName());
    }

    @Test
    public void shouldFallBackToManagerForCurrentConnectionBeforeFirstDecision() {
        assertEquals("primary", coordinator.getCurrentActiveConnectionName());
        verify(manager, never()).setActiveConnection(anyString());
    }

    @Test
    public void shouldKeepManagerOnAnnouncedConnectionWhenSwitchesOverlap() throws Exception {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.HEALTHY);
        final CountDownLatch switchingToFailover = new CountDownLatch(1);
        final CountDownLatch failoverApplied = new CountDownLatch(1);
        doAnswer(new Answer<Void>() {
            public Void answer(InvocationOnMock invocation) throws Throwable {
                switchingToFailover.countDown();
                failoverApplied.await(5, TimeUnit.SECONDS);
                return null;
            }
        }).when(manager).setActiveConnection("failover");
        final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
        Thread first = startDeterminingConnection(failure);
        assertTrue(switchingToFailover.await(5, TimeUnit.SECONDS));
        store.setConnectionStatus("primary", ConnectionStatus.HEALTHY);

        // when:
        Thread second = startDeterminingConnection(failure);
        waitUntilBlocked(second);
        failoverApplied.countDown();
        first.join(5000);
        second.join(5000);

        // then:
        assertNull(failure.get());
        InOrder order = inOrder(manager);
        order.verify(manager).setActiveConnection("failover");
        order.verify(manager).setActiveConnection("primary");
        assertEquals("primary", coordinator.getCurrentActiveConnectionName());
        assertEquals(Arrays.asList(SWITCHED_TO_FAILOVER, SWITCHED_TO_PRIMARY), listener.getKinds());
        assertEquals("failover", listener.last(SWITCHED_TO_PRIMARY).getPreviousConnectionName());
    }

    @Test
    public void shouldIgnoreOvertakenSwitchToConnectionAlreadyActive() throws Exception {
        // given:
        given(ConnectionStatus.DOWN, ConnectionStatus.HEALTHY);
        final CountDownLatch switchingToFailover = new CountDownLatch(1);
        final CountDownLatch failoverApplied = new CountDownLatch(1);
        doAnswer(new Answer<Void>() {
            public Void answer(InvocationOnMock invocation) throws Throwable {
                switchingToFailover.countDown();
                failoverApplied.await(5, TimeUnit.SECONDS);
                return null;
            }
        }).when(manager).setActiveConnection("failover");
        final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
        Thread first = startDeterminingConnection(failure);
        assertTrue(switchingToFailover.await(5, TimeUnit.SECONDS));

        // when:
        Thread second = startDeterminingConnection(failure);
        waitUntilBlocked(second);
        failoverApplied.countDown();
        first.join(5000);
        second.join(5000);

        // then:
        assertNull(failure.get());
        verify(manager, times(1)).setActiveConnection("failover");
        assertEquals(Collections.singletonList(SWITCHED_TO_FAILOVER), listener.getKinds());
    }

    private Thread startDeterminingConnection(final AtomicReference<Throwable> failure) {
        Thread t = new Thread(new Runnable() {
            public void run() {
                try {
                    coordinator.determineAndSetConnection();
                } catch (Throwable e) {
                    failure.compareAndSet(null, e);
                }
            }
        });
        t.start();
        return t;
    }

    private static void waitUntilBlocked(Thread t) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (t.getState() != Thread.State.BLOCKED && t.isAlive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
    }
}
