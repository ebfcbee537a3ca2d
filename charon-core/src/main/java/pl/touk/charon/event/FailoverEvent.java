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
package pl.touk.charon.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Notification about a change in connection health or in the active connection. What is filled in depends on the
 * {@link Kind}: switch events carry the previous connection name (<code>null</code> on the first decision of a
 * coordinator), {@link Kind#CACHE_UNAVAILABLE} carries the cause and the health check lifecycle events carry the
 * checked connections and, when finished, the exit code.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public final class FailoverEvent {

    public static enum Kind {
        CONNECTION_HEALTHY,
        PRIMARY_DOWN,
        FAILOVER_DOWN,
        PRIMARY_RESTORED,
        FAILOVER_RESTORED,
        SWITCHED_TO_PRIMARY,
        SWITCHED_TO_FAILOVER,
        LIMITED_FUNCTIONALITY_ACTIVATED,
        EXITED_LIMITED_FUNCTIONALITY,
        CACHE_UNAVAILABLE,
        HEALTH_CHECK_STARTED,
        HEALTH_CHECK_FINISHED
    }

    private final Kind kind;
    private final String connectionName;
    private final String previousConnectionName;
    private final Throwable cause;
    private final List<String> connections;
    private final int exitCode;
    private final long timeMillis;

    private FailoverEvent(Kind kind,
                          String connectionName,
                          String previousConnectionName,
                          Throwable cause,
                          List<String> connections,
                          int exitCode) {
        this.kind = kind;
        this.connectionName = connectionName;
        this.previousConnectionName = previousConnectionName;
        this.cause = cause;
        this.connections = connections != null
                ? Collections.unmodifiableList(new ArrayList<String>(connections))
                : Collections.<String>emptyList();
        this.exitCode = exitCode;
        this.timeMillis = System.currentTimeMillis();
    }

    public static FailoverEvent connectionHealthy(String connectionName) {
        return new FailoverEvent(Kind.CONNECTION_HEALTHY, connectionName, null, null, null, 0);
    }

    public static FailoverEvent primaryDown(String connectionName) {
        return new FailoverEvent(Kind.PRIMARY_DOWN, connectionName, null, null, null, 0);
    }

    public static FailoverEvent failoverDown(String connectionName) {
        return new FailoverEvent(Kind.FAILOVER_DOWN, connectionName, null, null, null, 0);
    }

    public static FailoverEvent primaryRestored(String connectionName) {
        return new FailoverEvent(Kind.PRIMARY_RESTORED, connectionName, null, null, null, 0);
    }

    public static FailoverEvent failoverRestored(String connectionName) {
        return new FailoverEvent(Kind.FAILOVER_RESTORED, connectionName, null, null, null, 0);
    }

    public static FailoverEvent switchedToPrimary(String previousConnectionName, String connectionName) {
        return new FailoverEvent(Kind.SWITCHED_TO_PRIMARY, connectionName, previousConnectionName, null, null, 0);
    }

    public static FailoverEvent switchedToFailover(String previousConnectionName, String connectionName) {
        return new FailoverEvent(Kind.SWITCHED_TO_FAILOVER, connectionName, previousConnectionName, null, null, 0);
    }

    public static FailoverEvent limitedFunctionalityActivated(String blockingConnectionName) {
        return new FailoverEvent(Kind.LIMITED_FUNCTIONALITY_ACTIVATED, blockingConnectionName, null, null, null, 0);
    }

    public static FailoverEvent exitedLimitedFunctionality(String connectionName) {
        return new FailoverEvent(Kind.EXITED_LIMITED_FUNCTIONALITY, connectionName, null, null, null, 0);
    }

    public static FailoverEvent cacheUnavailable(Throwable cause) {
        return new FailoverEvent(Kind.CACHE_UNAVAILABLE, null, null, cause, null, 0);
    }

    public static FailoverEvent healthCheckStarted(List<String> connections) {
        return new FailoverEvent(Kind.HEALTH_CHECK_STARTED, null, null, null, connections, 0);
    }

    public static FailoverEvent healthCheckFinished(List<String> connections, int exitCode) {
        return new FailoverEvent(Kind.HEALTH_CHECK_FINISHED, null, null, null, connections, exitCode);
    }

    public Kind getKind() {
        return kind;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public String getPreviousConnectionName() {
        return previousConnectionName;
    }

    public Throwable getCause() {
        return cause;
    }

    public List<String> getConnections() {
        return connections;
    }

    public int getExitCode() {
        return exitCode;
    }

    public long getTimeMillis() {
        return timeMillis;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (connectionName != null) {
            sb.append(" connection=").append(connectionName);
        }
        if (previousConnectionName != null) {
            sb.append(" previous=").append(previousConnectionName);
        }
        if (cause != null) {
            sb.append(" cause=").append(cause);
        }
        if (kind == Kind.HEALTH_CHECK_STARTED || kind == Kind.HEALTH_CHECK_FINISHED) {
            sb.append(" connections=").append(connections);
        }
        if (kind == Kind.HEALTH_CHECK_FINISHED) {
            sb.append(" exitCode=").append(exitCode);
        }
        return sb.toString();
    }
}
