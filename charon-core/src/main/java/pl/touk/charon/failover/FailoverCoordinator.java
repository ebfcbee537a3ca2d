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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.touk.charon.ConnectionManager;
import pl.touk.charon.ConnectionRole;
import pl.touk.charon.FailoverConfig;
import pl.touk.charon.Utils;
import pl.touk.charon.event.FailoverEvent;
import pl.touk.charon.event.FailoverEventDispatcher;
import pl.touk.charon.health.ConnectionStateStore;
import pl.touk.charon.health.ConnectionStatus;

/**
 * Decides which connection should be active and applies the decision to the {@link ConnectionManager}.
 * <p>
 * The decision depends only on the statuses kept in {@link ConnectionStateStore}:
 * <ol>
 * <li>primary if both primary and failover are <code>UNKNOWN</code> without failures (nothing is known yet, so
 * the primary is trusted; can be turned off with
 * {@link FailoverConfig#isDefaultToPrimaryOnEmptyState()}),</li>
 * <li>primary if it is <code>HEALTHY</code>,</li>
 * <li>failover if it is <code>HEALTHY</code>,</li>
 * <li>blocking otherwise.</li>
 * </ol>
 * The coordinator remembers the connection it applied last. That memory is local to this instance: a new
 * coordinator starts with none and announces its first decision even if another process already made the same one.
 * A decision equal to the remembered connection is neither applied nor announced.
 * <p>
 * Methods may be called concurrently (per request and from a scheduled job). Decisions are made without locking.
 * Applying a switch is serialized on one monitor, which covers both the call to the connection manager and the
 * announcement. The manager thus always ends up on the remembered connection, and switches are announced once each
 * in the order they were applied. A caller whose decision was based on a connection that another
 * caller has replaced in the meantime switches from the replacing one, or does nothing if it is already there.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class FailoverCoordinator {

    static private final Logger logger = LoggerFactory.getLogger(FailoverCoordinator.class);

    private final FailoverConfig config;
    private final ConnectionStateStore stateStore;
    private final ConnectionManager connectionManager;
    private final FailoverEventDispatcher dispatcher;

    private final Object switchMonitor = new Object();
    private volatile String previousConnection;

    public FailoverCoordinator(FailoverConfig config,
                               ConnectionStateStore stateStore,
                               ConnectionManager connectionManager,
                               FailoverEventDispatcher dispatcher) {
        Utils.assertNotNull(config, "config");
        Utils.assertNotNull(stateStore, "stateStore");
        Utils.assertNotNull(connectionManager, "connectionManager");
        Utils.assertNotNull(dispatcher, "dispatcher");
        this.config = config;
        this.stateStore = stateStore;
        this.connectionManager = connectionManager;
        this.dispatcher = dispatcher;
    }

    /**
     * Resolves the connection that should be active and applies it if it differs from the one applied before.
     *
     * @return the resolved connection name, whether applied now or before
     * @throws RuntimeException if the connection manager fails to apply the decision
     */
    public String determineAndSetConnection() {
        String logPrefix = "[" + config + "] ";
        FailoverDecision decision = decide();
        if (decision.isSwitch()) {
            apply(logPrefix, decision);
        } else if (logger.isDebugEnabled()) {
            logger.debug(logPrefix + "no change in active connection, still using '" + decision.getActiveConnectionName() + "'");
        }
        return decision.getActiveConnectionName();
    }

    /**
     * Resolves the connection that should be active without applying it.
     */
    public FailoverDecision decide() {
        return new FailoverDecision(resolveActiveConnection(), previousConnection);
    }

    public String resolveActiveConnection() {
        String logPrefix = "[" + config + "] ";
        String primary = config.getPrimary();
        String failover = config.getFailover();

        ConnectionStatus primaryStatus = stateStore.getConnectionStatus(primary);
        ConnectionStatus failoverStatus = stateStore.getConnectionStatus(failover);

        if (config.isDefaultToPrimaryOnEmptyState()
                && primaryStatus == ConnectionStatus.UNKNOWN
                && failoverStatus == ConnectionStatus.UNKNOWN
                && stateStore.getFailureCount(primary) == 0
                && stateStore.getFailureCount(failover) == 0) {
            logger.warn(logPrefix + "statuses not determined yet or cache unavailable; defaulting to primary '" + primary + "'");
            return primary;
        }
        if (primaryStatus == ConnectionStatus.HEALTHY) {
            logger.debug(logPrefix + "primary '" + primary + "' is HEALTHY");
            return primary;
        }
        logger.warn(logPrefix + "primary '" + primary + "' is not healthy (status: " + primaryStatus + "); checking failover");
        if (failoverStatus == ConnectionStatus.HEALTHY) {
            logger.info(logPrefix + "failover '" + failover + "' is HEALTHY");
            return failover;
        }
        logger.error(logPrefix + "both primary ('" + primary + "', status: " + primaryStatus + ") and failover ('"
                + failover + "', status: " + failoverStatus + ") are unavailable; activating blocking connection '"
                + config.getBlocking() + "'");
        return config.getBlocking();
    }

    /**
     * Declares both primary and failover healthy and switches to the primary.
     */
    public void forceSwitchToPrimary() {
        String logPrefix = "[" + config + ", forced] ";
        logger.info(logPrefix + "forcing switch to primary '" + config.getPrimary() + "', previous: " + previousConnection);
        stateStore.setConnectionStatus(config.getPrimary(), ConnectionStatus.HEALTHY, 0);
        stateStore.setConnectionStatus(config.getFailover(), ConnectionStatus.HEALTHY, 0);
        forceSwitch(logPrefix, config.getPrimary());
    }

    /**
     * Switches to the failover without touching the stored statuses.
     */
    public void forceSwitchToFailover() {
        String logPrefix = "[" + config + ", forced] ";
        logger.info(logPrefix + "forcing switch to failover '" + config.getFailover() + "', previous: " + previousConnection);
        forceSwitch(logPrefix, config.getFailover());
    }

    private void forceSwitch(String logPrefix, String target) {
        FailoverDecision decision = new FailoverDecision(target, previousConnection);
        if (decision.isSwitch()) {
            apply(logPrefix, decision);
        } else {
            logger.info(logPrefix + "already on '" + target + "'; no switch needed");
        }
    }

    private void apply(String logPrefix, FailoverDecision decision) {
        synchronized (switchMonitor) {
            if (!equal(previousConnection, decision.getPreviousConnectionName())) {
                logger.debug(logPrefix + "switch " + decision + " overtaken by a concurrent caller; active connection is now '" + previousConnection + "'");
                decision = new FailoverDecision(decision.getActiveConnectionName(), previousConnection);
                if (!decision.isSwitch()) {
                    return;
                }
            }
            String target = decision.getActiveConnectionName();
            String previous = decision.getPreviousConnectionName();
            logger.info(logPrefix + "switching active connection from '" + previous + "' to '" + target + "'");

            connectionManager.setActiveConnection(target);
            previousConnection = target;

            announce(logPrefix, previous, target);
        }
    }

    private void announce(String logPrefix, String previous, String target) {
        String blocking = config.getBlocking();
        ConnectionRole role = config.classifyRole(target);
        if (role == ConnectionRole.PRIMARY) {
            logger.info(logPrefix + "switched to PRIMARY '" + target + "' from '" + previous + "'");
            dispatcher.dispatch(FailoverEvent.switchedToPrimary(previous, target));
            exitLimitedFunctionalityIfBlocked(logPrefix, previous, target);
        } else if (role == ConnectionRole.FAILOVER) {
            logger.info(logPrefix + "switched to FAILOVER '" + target + "' from '" + previous + "'");
            dispatcher.dispatch(FailoverEvent.switchedToFailover(previous, target));
            exitLimitedFunctionalityIfBlocked(logPrefix, previous, target);
        } else if (role == ConnectionRole.BLOCKING && !blocking.equals(previous)) {
            logger.warn(logPrefix + "switched to blocking connection '" + target + "'; limited functionality mode activated");
            dispatcher.dispatch(FailoverEvent.limitedFunctionalityActivated(target));
        }
    }

    private void exitLimitedFunctionalityIfBlocked(String logPrefix, String previous, String target) {
        if (config.getBlocking().equals(previous)) {
            logger.info(logPrefix + "exiting limited functionality mode; switched to '" + target + "'");
            dispatcher.dispatch(FailoverEvent.exitedLimitedFunctionality(target));
        }
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    /**
     * @return the connection applied last by this coordinator or, if it has not applied any, the connection manager's
     * active connection
     */
    public String getCurrentActiveConnectionName() {
        String s = previousConnection;
        return s != null ? s : connectionManager.getActiveConnection();
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public ConnectionStateStore getStateStore() {
        return stateStore;
    }

    public FailoverConfig getConfig() {
        return config;
    }
}
