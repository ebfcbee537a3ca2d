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
import pl.touk.charon.event.FailoverEvent;
import pl.touk.charon.event.FailoverEventDispatcher;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static pl.touk.charon.Utils.indent;

/**
 * Checks the health of one or all monitored connections right now. This is what a scheduler or a command line tool
 * runs periodically.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class HealthCheckRunner {

    static private final Logger logger = LoggerFactory.getLogger(HealthCheckRunner.class);

    private final FailoverConfig config;
    private final ConnectionStateStore stateStore;
    private final ConnectionResolver resolver;
    private final FailoverEventDispatcher dispatcher;

    public HealthCheckRunner(FailoverConfig config,
                             ConnectionStateStore stateStore,
                             ConnectionResolver resolver,
                             FailoverEventDispatcher dispatcher) {
        Utils.assertNotNull(config, "config");
        Utils.assertNotNull(stateStore, "stateStore");
        Utils.assertNotNull(resolver, "resolver");
        Utils.assertNotNull(dispatcher, "dispatcher");
        this.config = config;
        this.stateStore = stateStore;
        this.resolver = resolver;
        this.dispatcher = dispatcher;
    }

    /**
     * Checks the primary and the failover connection.
     */
    public HealthCheckReport checkAll() {
        String logPrefix = "[" + config + ", health check] ";
        List<String> connections = Arrays.asList(config.getPrimary(), config.getFailover());
        started(connections);
        logger.info(logPrefix + "performing health checks for primary and failover connections");
        return run(logPrefix, connections);
    }

    /**
     * Checks the named connection. Fails without checking anything if the connection is not configured.
     */
    public HealthCheckReport check(String connectionName) {
        String logPrefix = "[" + connectionName + ", health check] ";
        List<String> connections = Collections.singletonList(connectionName);
        started(connections);
        if (Utils.isBlank(connectionName) || resolver.resolve(connectionName) == null) {
            logger.error(logPrefix + "connection '" + connectionName + "' is not configured");
            return finished(Collections.<String>emptyList(), Collections.<ConnectionHealthRecord>emptyList(), HealthCheckReport.failure);
        }
        logger.info(logPrefix + "performing health check for connection '" + connectionName + "'");
        return run(logPrefix, connections);
    }

    private HealthCheckReport run(String logPrefix, List<String> connections) {
        List<String> processed = new ArrayList<String>();
        List<ConnectionHealthRecord> records = new ArrayList<ConnectionHealthRecord>();
        for (String name : connections) {
            processed.add(name);
            logger.info(indent(logPrefix) + "checking health of connection '" + name + "'");
            try {
                stateStore.updateConnectionStatus(name);
                ConnectionHealthRecord record = stateStore.getHealthRecord(name);
                records.add(record);
                logger.info(indent(logPrefix) + "connection '" + name + "' status: " + record.getStatus() + ", failures: " + record.getConsecutiveFailures());
            } catch (RuntimeException e) {
                logger.error(indent(logPrefix) + "failed to check health for connection '" + name + "'", e);
            }
        }
        logger.info(logPrefix + "health checks completed");
        return finished(processed, records, HealthCheckReport.success);
    }

    private void started(List<String> connections) {
        if (config.isDispatchHealthCheckLifecycleEvents()) {
            dispatcher.dispatch(FailoverEvent.healthCheckStarted(connections));
        }
    }

    private HealthCheckReport finished(List<String> processed, List<ConnectionHealthRecord> records, int exitCode) {
        if (config.isDispatchHealthCheckLifecycleEvents()) {
            dispatcher.dispatch(FailoverEvent.healthCheckFinished(processed, exitCode));
        }
        return new HealthCheckReport(processed, records, exitCode);
    }

    public FailoverConfig getConfig() {
        return config;
    }
}
