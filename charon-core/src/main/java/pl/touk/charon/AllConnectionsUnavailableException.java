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

import java.sql.SQLTransientConnectionException;

/**
 * Thrown when a connection is requested while neither the primary nor the failover connection is usable.
 */
public class AllConnectionsUnavailableException extends SQLTransientConnectionException {

    public static final String defaultMessage = "All configured database connections (primary and failover) are "
            + "currently unavailable. Application is in limited functionality mode.";

    public AllConnectionsUnavailableException() {
        super(defaultMessage);
    }

    public AllConnectionsUnavailableException(String msg) {
        super(msg);
    }
}
