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

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Immutable configuration shared by the probe, the state store, the coordinator and the schedulers.
 * <p>
 * Connection role names are the only values that are tolerated when missing: a blank role name is reported as a
 * warning and replaced with the built-in default ({@link #defaultPrimary}, {@link #defaultFailover},
 * {@link #defaultBlocking}). Every other invalid value causes <code>IllegalArgumentException</code>.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public final class FailoverConfig {

    static private final Logger logger = LoggerFactory.getLogger(FailoverConfig.class);

    public static final String defaultPrimary = "primary";
    public static final String defaultFailover = "failover";
    public static final String defaultBlocking = "blocking";
    public static final String defaultProbeQuery = "SELECT 1";
    public static final int defaultProbeTimeoutSeconds = 5;
    public static final int defaultFailureThreshold = 3;
    public static final String defaultCron = "0 * * * * ?";
    public static final String defaultCachePrefix = "dynamic_db_failover_status";
    public static final int defaultCacheTtlSeconds = 300;

    private static final String keyPrefix = "charon.";
    public static final String primaryKey = keyPrefix + "connections.primary";
    public static final String failoverKey = keyPrefix + "connections.failover";
    public static final String blockingKey = keyPrefix + "connections.blocking";
    public static final String probeQueryKey = keyPrefix + "healthCheck.query";
    public static final String probeTimeoutSecondsKey = keyPrefix + "healthCheck.timeoutSeconds";
    public static final String failureThresholdKey = keyPrefix + "healthCheck.failureThreshold";
    public static final String cronKey = keyPrefix + "healthCheck.cron";
    public static final String cachePrefixKey = keyPrefix + "cache.prefix";
    public static final String cacheTtlSecondsKey = keyPrefix + "cache.ttlSeconds";
    public static final String defaultToPrimaryOnEmptyStateKey = keyPrefix + "defaultToPrimaryOnEmptyState";
    public static final String dispatchHealthCheckLifecycleEventsKey = keyPrefix + "dispatchHealthCheckLifecycleEvents";

    private final String primary;
    private final String failover;
    private final String blocking;
    private final String probeQuery;
    private final int probeTimeoutSeconds;
    private final int failureThreshold;
    private final String cron;
    private final String cachePrefix;
    private final int cacheTtlSeconds;
    private final boolean defaultToPrimaryOnEmptyState;
    private final boolean dispatchHealthCheckLifecycleEvents;

    public FailoverConfig(String primary, String failover, String blocking, int failureThreshold, int cacheTtlSeconds) {
        this(primary, failover, blocking, defaultProbeQuery, defaultProbeTimeoutSeconds, failureThreshold, defaultCron,
                defaultCachePrefix, cacheTtlSeconds, true, true);
    }

    public FailoverConfig(String primary,
                          String failover,
                          String blocking,
                          String probeQuery,
                          int probeTimeoutSeconds,
                          int failureThreshold,
                          String cron,
                          String cachePrefix,
                          int cacheTtlSeconds,
                          boolean defaultToPrimaryOnEmptyState,
                          boolean dispatchHealthCheckLifecycleEvents) {
        Utils.assertNonEmpty(probeQuery, "probeQuery");
        Utils.assertNonNegative(probeTimeoutSeconds, "probeTimeoutSeconds");
        Utils.assertPositive(failureThreshold, "failureThreshold");
        Utils.assertNonEmpty(cron, "cron");
        Utils.assertNonEmpty(cachePrefix, "cachePrefix");
        Utils.assertPositive(cacheTtlSeconds, "cacheTtlSeconds");

        if (Utils.isBlank(primary) || Utils.isBlank(failover) || Utils.isBlank(blocking)) {
            logger.warn("one or more connection names (primary, failover, blocking) are not configured correctly: "
                    + "primary='" + primary + "', failover='" + failover + "', blocking='" + blocking
                    + "'; falling back to default names for the missing ones");
        }
        this.primary = orDefault(primary, defaultPrimary);
        this.failover = orDefault(failover, defaultFailover);
        this.blocking = orDefault(blocking, defaultBlocking);
        this.probeQuery = probeQuery;
        this.probeTimeoutSeconds = probeTimeoutSeconds;
        this.failureThreshold = failureThreshold;
        this.cron = cron;
        this.cachePrefix = cachePrefix;
        this.cacheTtlSeconds = cacheTtlSeconds;
        this.defaultToPrimaryOnEmptyState = defaultToPrimaryOnEmptyState;
        this.dispatchHealthCheckLifecycleEvents = dispatchHealthCheckLifecycleEvents;
    }

    public static FailoverConfig fromProperties(Properties p) {
        Utils.assertNotNull(p, "properties");
        return new FailoverConfig(
                p.getProperty(primaryKey, defaultPrimary),
                p.getProperty(failoverKey, defaultFailover),
                p.getProperty(blockingKey, defaultBlocking),
                p.getProperty(probeQueryKey, defaultProbeQuery),
                intProperty(p, probeTimeoutSecondsKey, defaultProbeTimeoutSeconds),
                intProperty(p, failureThresholdKey, defaultFailureThreshold),
                p.getProperty(cronKey, defaultCron),
                p.getProperty(cachePrefixKey, defaultCachePrefix),
                intProperty(p, cacheTtlSecondsKey, defaultCacheTtlSeconds),
                booleanProperty(p, defaultToPrimaryOnEmptyStateKey, true),
                booleanProperty(p, dispatchHealthCheckLifecycleEventsKey, true));
    }

    public static FailoverConfig load(String classpathResource) {
        Utils.assertNonEmpty(classpathResource, "classpathResource");
        InputStream in = FailoverConfig.class.getResourceAsStream(classpathResource);
        if (in == null) {
            throw new IllegalArgumentException("no such classpath resource: " + classpathResource);
        }
        try {
            Properties p = new Properties();
            p.load(in);
            return fromProperties(p);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read " + classpathResource, e);
        } finally {
            try {
                in.close();
            } catch (IOException e) {
                logger.warn("failed to close " + classpathResource, e);
            }
        }
    }

    private static int intProperty(Properties p, String key, int defaultValue) {
        String s = p.getProperty(key);
        if (Utils.isBlank(s)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer but is '" + s + "'", e);
        }
    }

    private static boolean booleanProperty(Properties p, String key, boolean defaultValue) {
        String s = p.getProperty(key);
        if (Utils.isBlank(s)) {
            return defaultValue;
        }
        s = s.trim();
        return "true".equalsIgnoreCase(s) || "1".equals(s) || "yes".equalsIgnoreCase(s) || "on".equalsIgnoreCase(s);
    }

    private static String orDefault(String name, String defaultName) {
        return Utils.isBlank(name) ? defaultName : name.trim();
    }

    public ConnectionRole classifyRole(String connectionName) {
        if (primary.equals(connectionName)) {
            return ConnectionRole.PRIMARY;
        } else if (failover.equals(connectionName)) {
            return ConnectionRole.FAILOVER;
        } else if (blocking.equals(connectionName)) {
            return ConnectionRole.BLOCKING;
        } else {
            return ConnectionRole.OTHER;
        }
    }

    public String getPrimary() {
        return primary;
    }

    public String getFailover() {
        return failover;
    }

    public String getBlocking() {
        return blocking;
    }

    public String getProbeQuery() {
        return probeQuery;
    }

    public int getProbeTimeoutSeconds() {
        return probeTimeoutSeconds;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public String getCron() {
        return cron;
    }

    public String getCachePrefix() {
        return cachePrefix;
    }

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public boolean isDefaultToPrimaryOnEmptyState() {
        return defaultToPrimaryOnEmptyState;
    }

    public boolean isDispatchHealthCheckLifecycleEvents() {
        return dispatchHealthCheckLifecycleEvents;
    }

    @Override
    public String toString() {
        return primary + "/" + failover;
    }
}
