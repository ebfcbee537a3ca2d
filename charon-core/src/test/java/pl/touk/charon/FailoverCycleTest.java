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
package pl.touk.charon;

import org.junit.Before;
import org.junit.Test;
import pl.touk.charon.cache.InMemoryStatusCache;
import pl.touk.charon.event.FailoverEvent;
import pl.touk.charon.event.FailoverEventDispatcher;
import pl.touk.charon.event.LoggingFailoverListener;
import pl.touk.charon.event.RecordingFailoverListener;
import pl.touk.charon.failover.FailoverCoordinator;
import pl.touk.charon.health.ConnectionStateStore;
import pl.touk.charon.health.ConnectionStatus;
import pl.touk.charon.health.HealthCheckRunner;
import pl.touk.charon.health.SqlHealthProbe;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static pl.touk.charon.event.FailoverEvent.Kind.CONNECTION_HEALTHY;
import static pl.touk.charon.event.FailoverEvent.Kind.EXITED_LIMITED_FUNCTIONALITY;
import static pl.touk.charon.event.FailoverEvent.Kind.FAILOVER_DOWN;
import static pl.touk.charon.event.FailoverEvent.Kind.LIMITED_FUNCTIONALITY_ACTIVATED;
import static pl.touk.charon.event.FailoverEvent.Kind.PRIMARY_DOWN;
import static pl.touk.charon.event.FailoverEvent.Kind.PRIMARY_RESTORED;
import static pl.touk.charon.event.FailoverEvent.Kind.SWITCHED_TO_FAILOVER;
import static pl.touk.charon.event.FailoverEvent.Kind.SWITCHED_TO_PRIMARY;

/**
 * Full cycle: primary fails, failover takes over, failover fails, limited functionality, primary comes back.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class FailoverCycleTest {

    private final FailoverConfig config = new FailoverConfig("primary", "failover", "blocking", "SELECT 1", 5, 1,
            "0 * * * * ?", "cycle", 60, true, false);

    private DataSource primaryDs;
    private DataSource failoverDs;
    private Connection primaryConnection;
    private Connection failoverConnection;
    private RecordingFailoverListener listener;
    private ConnectionStateStore store;
    private HealthCheckRunner runner;
    private FailoverCoordinator coordinator;
    private Charon charon;

    @Before
    public void setUp() throws SQLException {
        primaryDs = mock(DataSource.class);
        failoverDs = mock(DataSource.class);
        primaryConnection = workingConnection();
        failoverConnection = workingConnection();
        Map<String, DataSource> m = new HashMap<String, DataSource>();
        m.put("primary", primaryDs);
        m.put("failover", failoverDs);
        charon = new Charon(config, m);

        listener = new RecordingFailoverListener();
        FailoverEventDispatcher dispatcher = new FailoverEventDispatcher();
        dispatcher.addListener(new LoggingFailoverListener());
        dispatcher.addListener(listener);

        store = new ConnectionStateStore(config, new SqlHealthProbe(config, charon), new InMemoryStatusCache(), dispatcher);
        runner = new HealthCheckRunner(config, store, charon, dispatcher);
        coordinator = new FailoverCoordinator(config, store, charon, dispatcher);
        charon.init(coordinator);
    }

    private static Connection workingConnection() throws SQLException {
        Connection c = mock(Connection.class);
        when(c.prepareStatement(anyString())).thenReturn(mock(PreparedStatement.class));
        return c;
    }

    private void up(DataSource ds, Connection c) throws SQLException {
        doReturn(c).when(ds).getConnection();
    }

    private void down(DataSource ds) throws SQLException {
        doThrow(new SQLException("Connection refused")).when(ds).getConnection();
    }

    @Test
    public void shouldGoThroughFullFailoverCycle() throws SQLException {
        // primary fails:
        down(primaryDs);
        runner.check("primary");
        assertEquals(ConnectionStatus.DOWN, store.getConnectionStatus("primary"));
        assertEquals(1, store.getFailureCount("primary"));
        assertEquals(Collections.singletonList(PRIMARY_DOWN), listener.getKinds());

        // failover works:
        listener.clear();
        up(failoverDs, failoverConnection);
        runner.check("failover");
        assertEquals(ConnectionStatus.HEALTHY, store.getConnectionStatus("failover"));

        // failover takes over:
        listener.clear();
        assertEquals("failover", coordinator.determineAndSetConnection());
        assertEquals(Collections.singletonList(SWITCHED_TO_FAILOVER), listener.getKinds());
        FailoverEvent switched = listener.last(SWITCHED_TO_FAILOVER);
        assertNull(switched.getPreviousConnectionName());
        assertEquals("failover", switched.getConnectionName());
        assertSame(failoverConnection, charon.getConnection());

        // failover fails:
        listener.clear();
        down(failoverDs);
        runner.check("failover");
        assertEquals(Collections.singletonList(FAILOVER_DOWN), listener.getKinds());

        // limited functionality:
        listener.clear();
        assertEquals("blocking", coordinator.determineAndSetConnection());
        assertEquals(Collections.singletonList(LIMITED_FUNCTIONALITY_ACTIVATED), listener.getKinds());
        assertEquals("blocking", listener.last(LIMITED_FUNCTIONALITY_ACTIVATED).getConnectionName());
        try {
            charon.getConnection();
            fail("AllConnectionsUnavailableException expected");
        } catch (AllConnectionsUnavailableException e) {
            // expected
        }
        assertEquals(1, listener.count(LIMITED_FUNCTIONALITY_ACTIVATED));

        // primary comes back:
        listener.clear();
        up(primaryDs, primaryConnection);
        runner.check("primary");
        assertEquals(Arrays.asList(CONNECTION_HEALTHY, PRIMARY_RESTORED), listener.getKinds());

        listener.clear();
        assertEquals("primary", coordinator.determineAndSetConnection());
        assertEquals(Arrays.asList(SWITCHED_TO_PRIMARY, EXITED_LIMITED_FUNCTIONALITY), listener.getKinds());
        assertEquals("blocking", listener.last(SWITCHED_TO_PRIMARY).getPreviousConnectionName());
        assertEquals("primary", listener.last(SWITCHED_TO_PRIMARY).getConnectionName());
        assertEquals("primary", listener.last(EXITED_LIMITED_FUNCTIONALITY).getConnectionName());
        assertSame(primaryConnection, charon.getConnection());
    }
}
