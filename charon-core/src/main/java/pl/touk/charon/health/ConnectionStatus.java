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

/**
 * Health status of a single connection. <code>UNKNOWN</code> is the status of a connection that has never been probed
 * and the status reported whenever the persisted state cannot be read. It does not mean <code>DOWN</code>.
 */
public enum ConnectionStatus {
    HEALTHY,
    DOWN,
    UNKNOWN;

    /**
     * Parses a persisted value. Returns <code>null</code> for <code>null</code> or unrecognized values.
     */
    public static ConnectionStatus parse(String s) {
        if (s == null) {
            return null;
        }
        for (ConnectionStatus status : values()) {
            if (status.name().equalsIgnoreCase(s.trim())) {
                return status;
            }
        }
        return null;
    }
}
