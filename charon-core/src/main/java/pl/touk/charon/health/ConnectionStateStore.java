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
import pl.touk.charon.ConnectionRole;
import pl.touk.charon.FailoverConfig;
import pl.touk.charon.Utils;
import pl.touk.charon.cache.CacheAccessException;
import pl.touk.charon.cache.GroupInvalidatingStatusCache;
import pl.touk.charon.cache.StatusCache;
import pl.touk.charon.event.FailoverEvent;
import pl.touk.charon.event.FailoverEventDispatcher;

/**
 * Keeps the health of connections in a {@link StatusCache} and turns probe results into statuses.
 * <p>
 * A connection becomes {@link ConnectionStatus#DOWN DOWN} only after <code>failureThreshold</code> consecutive failed
 * probes; until then it stays (or becomes) {@link ConnectionStatus#UNKNOWN UNKNOWN} with the failure count growing.
 * A single successful probe makes it {@link ConnectionStatus#HEALTHY HEALTHY} with no failures. Health events follow
 * the probe result even if storing it fails; the failed write is announced first as
 * {@link FailoverEvent.Kind#CACHE_UNAVAILABLE CACHE_UNAVAILABLE}. A connection that stays down is never announced
 * down again.
 * <p>
 * No method throws because of the cache. Every cache failure is reported as
 * {@link FailoverEvent.Kind#CACHE_UNAVAILABLE CACHE_UNAVAILABLE} and the documented default is returned instead.
 * <p>
 * The failure count is incremented with a read followed by a write and no lock. Two overlapping probes of the same
 * connection may therefore lose one increment, which delays <code>DOWN</code> by at most one probe.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class ConnectionStateStore {

    static private final Logger logger = LoggerFactory.getLogger(ConnectionStateStore.class);

    private static final String statusKeyInfix = "_conn_status_";
    private static final String failureCountKeyInfix = "_conn_failure_count_";

    private final FailoverConfig config;
    private final HealthProbe probe;
    private final StatusCache cache;
    private final FailoverEventDispatcher dispatcher;

    public ConnectionStateStore(FailoverConfig config,
                                HealthProbe probe,
                                StatusCache cache,
                                FailoverEventDispatcher dispatcher) {
        Utils.assertNotNull(config, "config");
        Utils.assertNotNull(probe, "probe");
        Utils.assertNotNull(cache, "cache");
        Utils.assertNotNull(dispatcher, "dispatcher");
        this.config = config;
        this.probe = probe;
        this.cache = cache;
        this.dispatcher = dispatcher;
    }

    /**
     * Probes the named connection and stores the resulting status.
     */
    public void updateConnectionStatus(String connectionName) {
        Utils.assertNonEmpty(connectionName, "connectionName");
        String logPrefix = "[" + connectionName + "] ";

        boolean healthy = probe.isHealthy(connectionName);
        ConnectionStatus previous = getConnectionStatus(connectionName);

        if (healthy) {
            write(logPrefix, connectionName, ConnectionStatus.HEALTHY, 0);
            dispatcher.dispatch(FailoverEvent.connectionHealthy(connectionName));
            if (previous == ConnectionStatus.DOWN) {
                connectionRestored(logPrefix, connectionName);
            }
        } else {
            int failures = getFailureCount(connectionName) + 1;
            if (previous == ConnectionStatus.DOWN) {
                write(logPrefix, connectionName, ConnectionStatus.DOWN, Math.max(failures, config.getFailureThreshold()));
                logger.debug(logPrefix + "still down, failure count: " + failures);
            } else if (failures >= config.getFailureThreshold()) {
                write(logPrefix, connectionName, ConnectionStatus.DOWN, failures);
                logger.warn(logPrefix + "marked as DOWN after " + failures + " consecutive failures");
                connectionDown(logPrefix, connectionName);
            } else {
                write(logPrefix, connectionName, ConnectionStatus.UNKNOWN, failures);
                logger.debug(logPrefix + "unhealthy, failure count: " + failures + " (threshold: " + config.getFailureThreshold() + ")");
            }
        }
    }

    private void connectionRestored(String logPrefix, String connectionName) {
        ConnectionRole role = config.classifyRole(connectionName);
        if (role == ConnectionRole.PRIMARY) {
            logger.info(logPrefix + "primary connection restored");
            dispatcher.dispatch(FailoverEvent.primaryRestored(connectionName));
        } else if (role == ConnectionRole.FAILOVER) {
            logger.info(logPrefix + "failover connection restored");
            dispatcher.dispatch(FailoverEvent.failoverRestored(connectionName));
        }
    }

    private void connectionDown(String logPrefix, String connectionName) {
        ConnectionRole role = config.classifyRole(connectionName);
        if (role == ConnectionRole.PRIMARY) {
            dispatcher.dispatch(FailoverEvent.primaryDown(connectionName));
        } else if (role == ConnectionRole.FAILOVER) {
            dispatcher.dispatch(FailoverEvent.failoverDown(connectionName));
        } else {
            logger.warn(logPrefix + "connection is neither primary nor failover; no down event dispatched");
        }
    }

    /**
     * @return the stored status or <code>UNKNOWN</code> if there is none, it is malformed or the cache is unavailable
     */
    public ConnectionStatus getConnectionStatus(String connectionName) {
        Utils.assertNonEmpty(connectionName, "connectionName");
        String key = statusKey(connectionName);
        String value;
        try {
            value = cache.get(key);
        } catch (CacheAccessException e) {
            return cacheUnavailable(ConnectionStatus.UNKNOWN, "failed to read " + key, e);
        } catch (RuntimeException e) {
            return cacheUnavailable(ConnectionStatus.UNKNOWN, "unexpected exception while reading " + key, e);
        }
        if (value == null) {
            return ConnectionStatus.UNKNOWN;
        }
        ConnectionStatus status = ConnectionStatus.parse(value);
        if (status == null) {
            return cacheUnavailable(ConnectionStatus.UNKNOWN, "malformed status", new CacheAccessException(key + " holds malformed status '" + value + "'"));
        }
        return status;
    }

    /**
     * @return the stored number of consecutive failures or <code>0</code> if there is none, it is malformed or the
     * cache is unavailable
     */
    public int getFailureCount(String connectionName) {
        Utils.assertNonEmpty(connectionName, "connectionName");
        String key = failureCountKey(connectionName);
        String value;
        try {
            value = cache.get(key);
        } catch (CacheAccessException e) {
            return cacheUnavailable(0, "failed to read " + key, e);
        } catch (RuntimeException e) {
            return cacheUnavailable(0, "unexpected exception while reading " + key, e);
        }
        if (value == null) {
            return 0;
        }
        try {
            int failures = Integer.parseInt(value.trim());
            if (failures < 0) {
                throw new NumberFormatException("negative");
            }
            return failures;
        } catch (NumberFormatException e) {
            return cacheUnavailable(0, "malformed failure count", new CacheAccessException(key + " holds malformed failure count '" + value + "'", e));
        }
    }

    public ConnectionHealthRecord getHealthRecord(String connectionName) {
        return new ConnectionHealthRecord(connectionName, getConnectionStatus(connectionName), getFailureCount(connectionName));
    }

    /**
     * Overwrites the stored status without probing and without dispatching health events. A <code>null</code>
     * failure count means the default for the status: <code>0</code> for <code>HEALTHY</code> and
     * <code>UNKNOWN</code>, the failure threshold for <code>DOWN</code>. <code>HEALTHY</code> is always stored with
     * no failures and <code>DOWN</code> with at least the threshold.
     */
    public void setConnectionStatus(String connectionName, ConnectionStatus status, Integer failureCount) {
        Utils.assertNonEmpty(connectionName, "connectionName");
        Utils.assertNotNull(status, "status");
        if (failureCount != null) {
            Utils.assertNonNegative(failureCount, "failureCount");
        }
        int failures;
        switch (status) {
            case HEALTHY:
                failures = 0;
                break;
            case DOWN:
                failures = failureCount != null ? Math.max(failureCount, config.getFailureThreshold()) : config.getFailureThreshold();
                break;
            default:
                failures = failureCount != null ? failureCount : 0;
                break;
        }
        String logPrefix = "[" + connectionName + "] ";
        if (write(logPrefix, connectionName, status, failures)) {
            logger.info(logPrefix + "status explicitly set to " + status + " with failure count " + failures);
        }
    }

    public void setConnectionStatus(String connectionName, ConnectionStatus status) {
        setConnectionStatus(connectionName, status, null);
    }

    public boolean isConnectionHealthy(String connectionName) {
        return getConnectionStatus(connectionName) == ConnectionStatus.HEALTHY;
    }

    public boolean isConnectionDown(String connectionName) {
        return getConnectionStatus(connectionName) == ConnectionStatus.DOWN;
    }

    public boolean isConnectionUnknown(String connectionName) {
        return getConnectionStatus(connectionName) == ConnectionStatus.UNKNOWN;
    }

    /**
     * Removes all stored statuses. Works only with a {@link GroupInvalidatingStatusCache}; with any other cache it
     * only logs a warning.
     */
    public void flushAllStatuses() {
        if (!(cache instanceof GroupInvalidatingStatusCache)) {
            logger.warn("cache " + cache + " cannot invalidate groups of entries; statuses not flushed, clear them manually if needed");
            return;
        }
        String prefix = config.getCachePrefix() + "_conn_";
        try {
            int removed = ((GroupInvalidatingStatusCache) cache).invalidateGroup(prefix);
            logger.info("all statuses flushed from cache (prefix '" + prefix + "', removed: " + removed + ")");
        } catch (CacheAccessException e) {
            cacheUnavailable(null, "failed to flush statuses", e);
        } catch (RuntimeException e) {
            cacheUnavailable(null, "unexpected exception while flushing statuses", e);
        }
    }

    private boolean write(String logPrefix, String connectionName, ConnectionStatus status, int failures) {
        int ttl = config.getCacheTtlSeconds();
        try {
            cache.put(statusKey(connectionName), status.name(), ttl);
            cache.put(failureCountKey(connectionName), Integer.toString(failures), ttl);
            return true;
        } catch (CacheAccessException e) {
            cacheUnavailable(null, logPrefix + "failed to store " + status + " with failure count " + failures, e);
            return false;
        } catch (RuntimeException e) {
            cacheUnavailable(null, logPrefix + "unexpected exception while storing " + status + " with failure count " + failures, e);
            return false;
        }
    }

    private <T> T cacheUnavailable(T defaultValue, String msg, Exception e) {
        logger.error(msg + "; cache unavailable" + (defaultValue != null ? ", assuming " + defaultValue : ""), e);
        dispatcher.dispatch(FailoverEvent.cacheUnavailable(e));
        return defaultValue;
    }

    String statusKey(String connectionName) {
        return config.getCachePrefix() + statusKeyInfix + connectionName;
    }

    String failureCountKey(String connectionName) {
        return config.getCachePrefix() + failureCountKeyInfix + connectionName;
    }

    public FailoverConfig getConfig() {
        return config;
    }
}
