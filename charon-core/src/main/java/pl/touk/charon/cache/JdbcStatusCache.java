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
package pl.touk.charon.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.touk.charon.Utils;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * {@link StatusCache} kept in a database table so that many application instances share connection health:
 * <pre>
 * CREATE TABLE CHARON_STATUSES (
 *     CACHE_KEY      VARCHAR(255) NOT NULL PRIMARY KEY,
 *     CACHE_VALUE    VARCHAR(255) NOT NULL,
 *     EXPIRES_MILLIS BIGINT       NOT NULL
 * )
 * </pre>
 * The data source given here must of course not be one of the monitored ones.
 *
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class JdbcStatusCache implements GroupInvalidatingStatusCache {

    private static final Logger logger = LoggerFactory.getLogger(JdbcStatusCache.class);

    private static final String table = "CHARON_STATUSES";

    private static final char likeEscape = '\\';

    public static enum StatusColumn {
        key           ("CACHE_KEY"     , Types.VARCHAR),
        value         ("CACHE_VALUE"   , Types.VARCHAR),
        expiresMillis ("EXPIRES_MILLIS", Types.BIGINT);

        private final String name;
        private final int type;

        StatusColumn(String name, int type) {
            this.name = name;
            this.type = type;
        }

        public static String list() {
            return list(false);
        }

        public static String questionMarkList() {
            return list(true);
        }

        public void bind(PreparedStatement ps, Object o) throws SQLException {
            ps.setObject(ordinal() + 1, o, type);
        }

        public void bind(PreparedStatement ps, Object o, int index) throws SQLException {
            ps.setObject(index, o, type);
        }

        private static String list(boolean questionMarks) {
            StringBuilder sb = new StringBuilder(questionMarks ? "?" : values()[0].name);
            for (int i = 1; i < values().length; i++) {
                sb.append(", ").append(questionMarks ? "?" : values()[i].name);
            }
            return sb.toString();
        }

        public String toString() {
            return name;
        }
    }

    static final String insert =
            "INSERT INTO " + table + " (" + StatusColumn.list() + ") VALUES (" + StatusColumn.questionMarkList() + ")";

    static final String update =
            "UPDATE " +
                    table + " " +
            "SET " +
                    StatusColumn.value + " = ?, " +
                    StatusColumn.expiresMillis + " = ? " +
            "WHERE " +
                    StatusColumn.key + " = ?";

    static final String select =
            "SELECT " +
                    StatusColumn.value + " " +
            "FROM " +
                    table + " " +
            "WHERE " +
                    StatusColumn.key + " = ? " +
                    "AND " + StatusColumn.expiresMillis + " > ?";

    static final String deleteGroup =
            "DELETE FROM " +
                    table + " " +
            "WHERE " +
                    StatusColumn.key + " LIKE ? ESCAPE '" + likeEscape + "'";

    private final DataSource dataSource;
    private final int sqlExecTimeout;
    private final String desc;

    public JdbcStatusCache(DataSource dataSource, int sqlExecTimeout, String desc) {
        Utils.assertNotNull(dataSource, "dataSource");
        Utils.assertNonNegative(sqlExecTimeout, "sqlExecTimeout");
        Utils.assertNonEmpty(desc, "desc");
        this.dataSource = dataSource;
        this.sqlExecTimeout = sqlExecTimeout;
        this.desc = desc;
    }

    public String get(String key) throws CacheAccessException {
        Utils.assertNotNull(key, "key");
        String logPrefix = "[" + desc + ", get " + key + "] ";
        Connection c = null;
        PreparedStatement ps = null;
        ResultSet rs = null;
        try {
            c = getConnection(logPrefix);
            ps = prepare(c, select);
            int i = 1;
            StatusColumn.key.bind(ps, key, i++);
            StatusColumn.expiresMillis.bind(ps, currentTimeMillis(), i++);
            rs = ps.executeQuery();
            return rs.next() ? rs.getString(StatusColumn.value.name) : null;
        } catch (SQLException e) {
            throw fail(logPrefix, "failed to read entry", e);
        } catch (RuntimeException e) {
            throw fail(logPrefix, "unexpected exception while reading entry", e);
        } finally {
            Utils.close(logPrefix, rs, ps, c);
        }
    }

    public void put(String key, String value, int ttlSeconds) throws CacheAccessException {
        Utils.assertNotNull(key, "key");
        Utils.assertNotNull(value, "value");
        Utils.assertPositive(ttlSeconds, "ttlSeconds");
        String logPrefix = "[" + desc + ", put " + key + "] ";
        long expiresMillis = currentTimeMillis() + ttlSeconds * 1000L;
        Connection c = null;
        try {
            c = getConnection(logPrefix);
            c.setAutoCommit(true);
            if (update(logPrefix, c, key, value, expiresMillis) == 0) {
                logger.debug(logPrefix + "trying insert because nothing updated");
                try {
                    insert(logPrefix, c, key, value, expiresMillis);
                } catch (SQLException e) {
                    // Another instance may have inserted the same key in the meantime.
                    logger.debug(logPrefix + "insert failed; retrying update", e);
                    if (update(logPrefix, c, key, value, expiresMillis) == 0) {
                        throw e;
                    }
                }
            }
        } catch (SQLException e) {
            throw fail(logPrefix, "failed to store '" + value + "'", e);
        } catch (RuntimeException e) {
            throw fail(logPrefix, "unexpected exception while storing '" + value + "'", e);
        } finally {
            Utils.close(logPrefix, null, null, c);
        }
    }

    public int invalidateGroup(String keyPrefix) throws CacheAccessException {
        Utils.assertNotNull(keyPrefix, "keyPrefix");
        String logPrefix = "[" + desc + ", invalidate " + keyPrefix + "*] ";
        Connection c = null;
        PreparedStatement ps = null;
        try {
            c = getConnection(logPrefix);
            c.setAutoCommit(true);
            ps = prepare(c, deleteGroup);
            StatusColumn.key.bind(ps, escapeLike(keyPrefix) + "%", 1);
            int deleted = ps.executeUpdate();
            logger.info(logPrefix + "deleted " + deleted + " entries");
            return deleted;
        } catch (SQLException e) {
            throw fail(logPrefix, "failed to delete entries", e);
        } catch (RuntimeException e) {
            throw fail(logPrefix, "unexpected exception while deleting entries", e);
        } finally {
            Utils.close(logPrefix, null, ps, c);
        }
    }

    private int update(String logPrefix, Connection c, String key, String value, long expiresMillis) throws SQLException {
        PreparedStatement ps = null;
        try {
            ps = prepare(c, update);
            int i = 1;
            StatusColumn.value.bind(ps, value, i++);
            StatusColumn.expiresMillis.bind(ps, expiresMillis, i++);
            StatusColumn.key.bind(ps, key, i++);
            int updatedCount = ps.executeUpdate();
            if (updatedCount > 1) {
                logger.error(logPrefix + "updated " + updatedCount + " records (expected 1)");
            }
            return updatedCount;
        } finally {
            Utils.close(logPrefix, null, ps, null);
        }
    }

    private void insert(String logPrefix, Connection c, String key, String value, long expiresMillis) throws SQLException {
        PreparedStatement ps = null;
        try {
            ps = prepare(c, insert);
            StatusColumn.key.bind(ps, key);
            StatusColumn.value.bind(ps, value);
            StatusColumn.expiresMillis.bind(ps, expiresMillis);
            ps.executeUpdate();
            logger.debug(logPrefix + "inserted '" + value + "'");
        } finally {
            Utils.close(logPrefix, null, ps, null);
        }
    }

    private Connection getConnection(String logPrefix) throws SQLException {
        Connection c = dataSource.getConnection();
        if (c == null) {
            throw new SQLException(logPrefix + "data source returned null connection");
        }
        return c;
    }

    private PreparedStatement prepare(Connection c, String sql) throws SQLException {
        PreparedStatement ps = c.prepareStatement(sql);
        if (sqlExecTimeout > 0) {
            try {
                ps.setQueryTimeout(sqlExecTimeout);
            } catch (SQLException e) {
                ps.close();
                throw e;
            }
        }
        return ps;
    }

    private CacheAccessException fail(String logPrefix, String msg, Exception e) {
        logger.error(logPrefix + msg, e);
        return new CacheAccessException(desc + ": " + msg, e);
    }

    static String escapeLike(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' || ch == '_' || ch == likeEscape) {
                sb.append(likeEscape);
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    protected long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public String toString() {
        return desc;
    }
}
