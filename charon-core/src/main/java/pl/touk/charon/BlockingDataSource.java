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

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.logging.Logger;

/**
 * Data source used in limited functionality mode. It never opens a connection: every attempt fails immediately with
 * {@link AllConnectionsUnavailableException} so that callers do not wait on a dead database.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class BlockingDataSource implements DataSource {

    private final String name;
    private volatile PrintWriter logWriter;
    private volatile int loginTimeout;

    public BlockingDataSource(String name) {
        Utils.assertNonEmpty(name, "name");
        this.name = name;
    }

    /**
     * @throws AllConnectionsUnavailableException always
     */
    public Connection getConnection() throws SQLException {
        throw new AllConnectionsUnavailableException();
    }

    /**
     * @throws AllConnectionsUnavailableException always
     */
    public Connection getConnection(String username, String password) throws SQLException {
        throw new AllConnectionsUnavailableException();
    }

    public PrintWriter getLogWriter() {
        return logWriter;
    }

    public void setLogWriter(PrintWriter out) {
        this.logWriter = out;
    }

    public void setLoginTimeout(int seconds) {
        this.loginTimeout = seconds;
    }

    public int getLoginTimeout() {
        return loginTimeout;
    }

    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException(name + " does not use java.util.logging");
    }

    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        throw new SQLException(name + " does not wrap " + iface.getName());
    }

    public boolean isWrapperFor(Class<?> iface) {
        return iface.isInstance(this);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name + " (blocking ds)";
    }
}
