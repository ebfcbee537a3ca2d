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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.touk.charon.failover.FailoverCoordinator;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A data source which routes connection requests to one of several named data sources: the primary one, the
 * failover one and the blocking one (plus any other that the host wants to switch to). Which data source is used is
 * not determined by this class itself. It is the responsibility of the {@link FailoverCoordinator} associated with
 * it, which calls {@link #setActiveConnection(String)}.
 * <p>
 * This class should be used as follows:
 * <pre>
 * Map&lt;String, DataSource&gt; dataSources = new HashMap&lt;String, DataSource&gt;();
 * dataSources.put("primary", primaryDs);
 * dataSources.put("failover", failoverDs);
 *
 * FailoverConfig config = FailoverConfig.load("/charon.properties");
 * Charon charon = new Charon(config, dataSources); // the blocking data source is added automatically
 *
 * FailoverEventDispatcher dispatcher = new FailoverEventDispatcher();
 * dispatcher.addListener(new LoggingFailoverListener());
 * ConnectionStateStore store = new ConnectionStateStore(config, new SqlHealthProbe(config, charon), cache, dispatcher);
 * FailoverCoordinator coordinator = new FailoverCoordinator(config, store, charon, dispatcher);
 * charon.init(coordinator);
 *
 * // Now the health of the connections must be checked periodically, for example by QuartzHealthCheckScheduler
 * // or by calling new HealthCheckRunner(config, store, charon, dispatcher).checkAll() from a timer.
 *
 * Connection c = charon.getConnection(); // asks the coordinator first, then returns a connection from the
 *                                        // primary, the failover or (if both are down) fails immediately
 *                                        // with AllConnectionsUnavailableException
 * </pre>
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class Charon implements DataSource, ConnectionManager, ConnectionResolver {

    private final static Logger logger = LoggerFactory.getLogger(Charon.class);

    private final static String errorMsg = "this class wraps several data sources so this method is irrelevant as it does not give the possibility to specify which data source should it operate on";

    private final FailoverConfig config;
    private final Map<String, DataSource> dataSources;
    private final AtomicReference<String> activeConnection;
    private final AtomicReference<String> pinnedConnection;
    private final AtomicReference<FailoverCoordinator> coordinator;

    public Charon(FailoverConfig config, Map<String, ? extends DataSource> dataSources) {
        Utils.assertNotNull(config, "config");
        Utils.assertNotNull(dataSources, "dataSources");
        Utils.assertNotNull(dataSources.get(config.getPrimary()), "data source named " + config.getPrimary() + " (primary)");
        Utils.assertNotNull(dataSources.get(config.getFailover()), "data source named " + config.getFailover() + " (failover)");

        LinkedHashMap<String, DataSource> m = new LinkedHashMap<String, DataSource>(dataSources);
        if (!m.containsKey(config.getBlocking())) {
            m.put(config.getBlocking(), new BlockingDataSource(config.getBlocking()));
        }
        this.config = config;
        this.dataSources = Collections.unmodifiableMap(m);
        this.activeConnection = new AtomicReference<String>(config.getPrimary());
        this.pinnedConnection = new AtomicReference<String>();
        this.coordinator = new AtomicReference<FailoverCoordinator>();
    }

    public void init(FailoverCoordinator coordinator) {
        Utils.assertNotNull(coordinator, "coordinator");
        if (coordinator.getConnectionManager() != this) {
            throw new IllegalArgumentException("coordinator.connectionManager != this; ensure that each association of charon and a coordinator is one-to-one");
        }
        if (!this.coordinator.compareAndSet(null, coordinator)) {
            throw new IllegalStateException("charon already associated with a coordinator");
        }
    }

    /**
     * Invokes {@link javax.sql.DataSource#getConnection() getConnection()} on the data source which is active after
     * asking the associated coordinator to determine it. The coordinator is not asked if a data source is pinned
     * (see {@link #pin(String)}) or if no coordinator is associated yet.
     *
     * @return connection from the active data source
     * @throws AllConnectionsUnavailableException if the blocking data source is active
     * @throws SQLException if getting a connection from the active data source throws the exception
     */
    public Connection getConnection() throws SQLException {
        return getConnection(effectiveConnectionName(), false, null, null);
    }

    /**
     * The same as {@link #getConnection()} but with {@link javax.sql.DataSource#getConnection(String, String)}
     * invoked on the active data source.
     */
    public Connection getConnection(String username, String password) throws SQLException {
        return getConnection(effectiveConnectionName(), true, username, password);
    }

    private Connection getConnection(String name, boolean withAuth, String username, String password) throws SQLException {
        DataSource ds = dataSources.get(name);
        String logPrefix = "[" + this + "] ";
        long start = System.nanoTime();
        Connection connection;
        try {
            connection = withAuth ? ds.getConnection(username, password) : ds.getConnection();
        } catch (AllConnectionsUnavailableException e) {
            logger.debug(logPrefix + "refused" + connDesc(withAuth, username, name) + "in limited functionality mode");
            throw e;
        } catch (SQLException e) {
            throw handleException(logPrefix, e, start, connDesc(withAuth, username, name));
        } catch (RuntimeException e) {
            throw handleException(logPrefix, e, start, connDesc(withAuth, username, name));
        }
        if (logger.isDebugEnabled()) {
            logger.debug(logPrefix + "successfully got" + connDesc(withAuth, username, name) + "in " + Utils.nanosToMillisAsStr(System.nanoTime() - start));
        }
        return connection;
    }

    private String connDesc(boolean withAuth, String username, String name) {
        return " a connection" + (withAuth ? " for username " + username : "") + " to " + desc(name) + " ";
    }

    private <T extends Throwable> T handleException(String logPrefix, T e, long start, String connDesc) {
        logger.error(logPrefix + "exception while getting" + connDesc + "caught in " + Utils.nanosToMillisAsStr(System.nanoTime() - start), e);
        return e;
    }

    private String effectiveConnectionName() {
        String pinned = pinnedConnection.get();
        if (pinned != null) {
            return pinned;
        }
        FailoverCoordinator c = coordinator.get();
        if (c != null) {
            return c.determineAndSetConnection();
        }
        return activeConnection.get();
    }

    public DataSource resolve(String connectionName) {
        return connectionName != null ? dataSources.get(connectionName) : null;
    }

    public void setActiveConnection(String connectionName) {
        assertKnown(connectionName);
        String previous = activeConnection.getAndSet(connectionName);
        if (!connectionName.equals(previous)) {
            logger.info("[" + this + "] active data source changed from " + desc(previous) + " to " + desc(connectionName));
        }
    }

    public String getActiveConnection() {
        return activeConnection.get();
    }

    /**
     * Pins the named data source. From now on methods {@link #getConnection()} and
     * {@link #getConnection(String, String)} will get connections from it without asking the coordinator.
     */
    public void pin(String connectionName) {
        assertKnown(connectionName);
        pinnedConnection.set(connectionName);
        logger.info("[" + this + "] pinned " + desc(connectionName));
    }

    /**
     * Removes the pin enabled by {@link #pin(String)}.
     */
    public void removePin() {
        String previous = pinnedConnection.getAndSet(null);
        if (previous != null) {
            logger.info("[" + this + "] removed pin of " + desc(previous));
        }
    }

    public String getPinnedConnection() {
        return pinnedConnection.get();
    }

    private void assertKnown(String connectionName) {
        if (connectionName == null || !dataSources.containsKey(connectionName)) {
            throw new IllegalArgumentException("unknown connection '" + connectionName + "'; known connections: " + dataSources.keySet());
        }
    }

    public String desc(String connectionName) {
        String role;
        switch (config.classifyRole(connectionName)) {
            case PRIMARY:  role = "primary";  break;
            case FAILOVER: role = "failover"; break;
            case BLOCKING: role = "blocking"; break;
            default:       role = "other";    break;
        }
        return connectionName + " (" + role + " ds)";
    }

    @Override
    public String toString() {
        return config.toString();
    }

    /**
     * Throws <code>UnsupportedOperationException</code>.
     *
     * @throws UnsupportedOperationException always
     */
    public int getLoginTimeout() throws SQLException {
        throw new UnsupportedOperationException(errorMsg);
    }

    /**
     * Throws <code>UnsupportedOperationException</code>.
     *
     * @throws UnsupportedOperationException always
     */
    public PrintWriter getLogWriter() throws SQLException {
        throw new UnsupportedOperationException(errorMsg);
    }

    /**
     * Sets the given login timeout on all enclosed data sources.
     */
    public void setLoginTimeout(int loginTimeout) throws SQLException {
        for (DataSource ds : dataSources.values()) {
            ds.setLoginTimeout(loginTimeout);
        }
    }

    /**
     * Sets the given print writer as the log writer on all enclosed data sources.
     */
    public void setLogWriter(PrintWriter printWriter) throws SQLException {
        for (DataSource ds : dataSources.values()) {
            ds.setLogWriter(printWriter);
        }
    }

    public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException(errorMsg);
    }

    public <T> T unwrap(Class<T> iface) throws SQLException {
        throw new UnsupportedOperationException(errorMsg);
    }

    public boolean isWrapperFor(Class<?> iface) throws SQLException {
        throw new UnsupportedOperationException(errorMsg);
    }

    public FailoverCoordinator getCoordinator() {
        return coordinator.get();
    }

    public FailoverConfig getConfig() {
        return config;
    }

    public Map<String, DataSource> getDataSources() {
        return dataSources;
    }
}
