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

/**
 * Result of resolving which connection should be active, together with the connection the coordinator applied
 * before (<code>null</code> if it has not applied any yet).
 */
public final class FailoverDecision {

    private final String activeConnectionName;
    private final String previousConnectionName;

    public FailoverDecision(String activeConnectionName, String previousConnectionName) {
        this.activeConnectionName = activeConnectionName;
        this.previousConnectionName = previousConnectionName;
    }

    public String getActiveConnectionName() {
        return activeConnectionName;
    }

    public String getPreviousConnectionName() {
        return previousConnectionName;
    }

    public boolean isSwitch() {
        return !activeConnectionName.equals(previousConnectionName);
    }

    @Override
    public String toString() {
        return previousConnectionName + " -> " + activeConnectionName;
    }
}
