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
package pl.touk.charon.sql.exception;

/**
 * Base class of failures that may happen while probing a connection. Probe failures never leave
 * {@link pl.touk.charon.health.SqlHealthProbe}; they only carry the log prefix of the probe run
 * in which they occurred so that the probe can log them consistently.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
abstract public class ProbeException extends Exception {

    private final String logPrefix;

    public ProbeException(String logPrefix, Exception e) {
        super(e);
        this.logPrefix = logPrefix;
    }

    public ProbeException(String logPrefix, String msg) {
        super(msg);
        this.logPrefix = logPrefix;
    }

    public String getLogPrefix() {
        return logPrefix;
    }
}
