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
package pl.touk.charon.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.touk.charon.ConnectionResolver;
import pl.touk.charon.FailoverConfig;
import pl.touk.charon.Utils;
import pl.touk.charon.sql.exception.ConnException;
import pl.touk.charon.sql.exception.ProbeException;
import pl.touk.charon.sql.exception.SqlExecException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.concurrent.Executor;

/**
 * {@link HealthProbe} executing the configured query (<code>SELECT 1</code> by default) on a connection taken from
 * the resolved data source.
 * <p>
 * The configured timeout bounds only the probe: it is set as the query timeout of the probe statement and, for the
 * time of the probe, as the network timeout of the connection. The previous network timeout is restored before the
 * connection is closed (i.e. returned to its pool) regardless of the probe result. No threads are created: the
 * executor handed to the driver runs its tasks in the calling thread.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class SqlHealthProbe implements HealthProbe {

    static private final Logger logger = LoggerFactory.getLogger(SqlHealthProbe.class);

    private static final int notNarrowed = -1;

    private static final Executor callingThreadExecutor = new Executor() {
        public void execute(Runnable command) {
            command.run();
        }
    };

    private final ConnectionResolver resolver;
    private final String query;
    private final int timeoutSeconds;

    public SqlHealthProbe(FailoverConfig config, ConnectionResolver resolver) {
        Utils.assertNotNull(config, "config");
        Utils.assertNotNull(resolver, "resolver");
        this.resolver = resolver;
        this.query = config.getProbeQuery();
        this.timeoutSeconds = config.getProbeTimeoutSeconds();
    }

    public boolean isHealthy(String connectionName) {
        String logPrefix = "[probe " + connectionName + "] ";
        long start = System.nanoTime();
        Connection c = null;
        PreparedStatement ps = null;
        int previousNetworkTimeout = notNarrowed;
        try {
            DataSource ds = resolver.resolve(connectionName);
            if (ds == null) {
                logger.warn(logPrefix + "connection is not configured");
                return false;
            }
            c = getConnection(logPrefix, ds, connectionName);
            previousNetworkTimeout = narrowNetworkTimeout(logPrefix, c);
            ps = Utils.safelyPrepareStatement(logPrefix, c, connectionName, timeoutSeconds, query);
            execute(logPrefix, ps);
            if (logger.isDebugEnabled()) {
                logger.debug(logPrefix + "'" + query + "' succeeded in " + Utils.nanosToMillisAsStr(System.nanoTime() - start));
            }
            return true;
        } catch (ProbeException e) {
            logger.warn(logPrefix + "probe failed after " + Utils.nanosToMillisAsStr(System.nanoTime() - start) + ": " + describe(e));
            return false;
        } catch (RuntimeException e) {
            logger.error(logPrefix + "unexpected exception while probing", e);
            return false;
        } finally {
            Utils.close(logPrefix, null, ps, null);
            restoreNetworkTimeout(logPrefix, c, previousNetworkTimeout);
            Utils.close(logPrefix, null, null, c);
        }
    }

    private Connection getConnection(String logPrefix, DataSource ds, String connectionName) throws ConnException {
        try {
            Connection c = ds.getConnection();
            if (c == null) {
                throw new ConnException(logPrefix, connectionName + " returned null connection");
            }
            return c;
        } catch (SQLException e) {
            throw new ConnException(logPrefix, e);
        } catch (RuntimeException e) {
            throw new ConnException(logPrefix, e);
        }
    }

    private int narrowNetworkTimeout(String logPrefix, Connection c) {
        if (timeoutSeconds <= 0) {
            return notNarrowed;
        }
        try {
            int previous = c.getNetworkTimeout();
            c.setNetworkTimeout(callingThreadExecutor, timeoutSeconds * 1000);
            return previous;
        } catch (SQLFeatureNotSupportedException e) {
            logger.debug(logPrefix + "network timeout not supported by the driver; relying on query timeout only");
            return notNarrowed;
        } catch (SQLException e) {
            logger.warn(logPrefix + "failed to set network timeout; relying on query timeout only", e);
            return notNarrowed;
        } catch (AbstractMethodError e) {
            logger.debug(logPrefix + "driver predates network timeouts; relying on query timeout only");
            return notNarrowed;
        }
    }

    private void restoreNetworkTimeout(String logPrefix, Connection c, int previous) {
        if (c == null || previous == notNarrowed) {
            return;
        }
        try {
            c.setNetworkTimeout(callingThreadExecutor, previous);
        } catch (SQLException e) {
            logger.warn(logPrefix + "failed to restore network timeout " + previous + " ms", e);
        } catch (RuntimeException e) {
            logger.warn(logPrefix + "failed to restore network timeout " + previous + " ms", e);
        }
    }

    private void execute(String logPrefix, PreparedStatement ps) throws SqlExecException {
        try {
            ps.execute();
        } catch (SQLException e) {
            throw new SqlExecException(logPrefix, e);
        }
    }

    private static String describe(ProbeException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return e.getClass().getSimpleName() + " (" + cause + ")";
    }

    public String getQuery() {
        return query;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
