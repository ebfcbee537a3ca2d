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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one health check run: the connections processed, the health read back for each of them (a connection
 * whose check failed unexpectedly has no record) and the exit code.
 */
public final class HealthCheckReport {

    public static final int success = 0;
    public static final int failure = 1;

    private final List<String> processedConnections;
    private final List<ConnectionHealthRecord> records;
    private final int exitCode;

    public HealthCheckReport(List<String> processedConnections, List<ConnectionHealthRecord> records, int exitCode) {
        this.processedConnections = Collections.unmodifiableList(new ArrayList<String>(processedConnections));
        this.records = Collections.unmodifiableList(new ArrayList<ConnectionHealthRecord>(records));
        this.exitCode = exitCode;
    }

    public List<String> getProcessedConnections() {
        return processedConnections;
    }

    public List<ConnectionHealthRecord> getRecords() {
        return records;
    }

    public ConnectionHealthRecord getRecord(String connectionName) {
        for (ConnectionHealthRecord r : records) {
            if (r.getConnectionName().equals(connectionName)) {
                return r;
            }
        }
        return null;
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isSuccess() {
        return exitCode == success;
    }

    @Override
    public String toString() {
        return "exitCode=" + exitCode + " " + records;
    }
}
