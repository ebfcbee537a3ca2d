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
 * Liveness check of a named connection.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public interface HealthProbe {

    /**
     * Checks whether the named connection is able to execute a query within the configured time. Never throws:
     * an unknown connection, a failure to get a connection, a timeout and any error during execution all result in
     * <code>false</code>.
     *
     * @param connectionName name of the connection to check
     * @return <code>true</code> if the connection works, <code>false</code> otherwise
     */
    boolean isHealthy(String connectionName);
}
