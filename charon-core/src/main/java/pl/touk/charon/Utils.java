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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.touk.charon.sql.exception.PrepareStmtException;
import pl.touk.charon.sql.exception.TimeoutSettingException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.text.DecimalFormat;

public class Utils {

    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private static final long nanosInMillisecond = 1000000L;

    private static final String indentation = "  ";

    private Utils() {
    }

    public static String indent(String s) {
        return s + indentation;
    }

    public static PreparedStatement safelyPrepareStatement(String logPrefix, Connection c, String dsDesc, int sqlExecTimeout, String sql)
            throws PrepareStmtException, TimeoutSettingException {
        PreparedStatement ps = null;
        try {
            ps = c.prepareStatement(sql);
            if (sqlExecTimeout > 0) {
                ps.setQueryTimeout(sqlExecTimeout);
            }
            return ps;
        } catch (Exception e) {
            logger.error(logPrefix + "exception while " + (ps == null ? "preparing statement" : "setting query timeout") + " for " + dsDesc, e);
            if (ps == null) {
                throw new PrepareStmtException(logPrefix, e);
            } else {
                close(logPrefix, null, ps, null);
                throw new TimeoutSettingException(logPrefix, e);
            }
        }
    }

    public static void close(String logPrefix, ResultSet rs, PreparedStatement ps, Connection c) {
        if (rs != null) {
            try {
                rs.close();
            } catch (SQLException e) {
                logger.error(logPrefix + "failed to close result set", e);
            }
        }
        if (ps != null) {
            try {
                ps.close();
            } catch (SQLException e) {
                logger.error(logPrefix + "failed to close prepared statement", e);
            }
        }
        if (c != null) {
            try {
                c.close();
            } catch (SQLException e) {
                logger.error(logPrefix + "failed to close connection", e);
            }
        }
    }

    public static String nanosToMillisAsStr(long l) {
        return new DecimalFormat("#0.000 ms").format(((double) l) / nanosInMillisecond);
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().length() == 0;
    }

    public static String assertNonEmpty(String s, String name) {
        if (s == null || s.length() == 0) {
            throw new IllegalArgumentException(name + " must not be null or empty");
        }
        return s;
    }

    public static void assertNotNull(Object field, String fieldName) {
        if (field == null) {
            throw new IllegalArgumentException("null " + fieldName);
        }
    }

    public static void assertNonNegative(int field, String fieldName) {
        if (field < 0) {
            throw new IllegalArgumentException(fieldName + " must be equal to or greater than zero");
        }
    }

    public static void assertNonNegative(long field, String fieldName) {
        if (field < 0) {
            throw new IllegalArgumentException(fieldName + " must be equal to or greater than zero");
        }
    }

    public static void assertPositive(int field, String fieldName) {
        if (field <= 0) {
            throw new IllegalArgumentException(fieldName + " must be greater than zero");
        }
    }
}
