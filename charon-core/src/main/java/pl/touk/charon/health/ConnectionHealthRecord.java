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

import pl.touk.charon.Utils;

/**
 * Snapshot of the persisted health of one connection.
 */
public final class ConnectionHealthRecord {

    private final String connectionName;
    private final ConnectionStatus status;
    private final int consecutiveFailures;

    public ConnectionHealthRecord(String connectionName, ConnectionStatus status, int consecutiveFailures) {
        Utils.assertNonEmpty(connectionName, "connectionName");
        Utils.assertNotNull(status, "status");
        Utils.assertNonNegative(consecutiveFailures, "consecutiveFailures");
        this.connectionName = connectionName;
        this.status = status;
        this.consecutiveFailures = consecutiveFailures;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public ConnectionStatus getStatus() {
        return status;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConnectionHealthRecord that = (ConnectionHealthRecord) o;
        return consecutiveFailures == that.consecutiveFailures
                && connectionName.equals(that.connectionName)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        int result = connectionName.hashCode();
        result = 31 * result + status.hashCode();
        result = 31 * result + consecutiveFailures;
        return result;
    }

    @Override
    public String toString() {
        return connectionName + ": " + status + " (failures: " + consecutiveFailures + ")";
    }
}
