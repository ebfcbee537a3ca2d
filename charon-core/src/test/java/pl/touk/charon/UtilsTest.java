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

import org.junit.Test;
import pl.touk.charon.sql.exception.PrepareStmtException;
import pl.touk.charon.sql.exception.TimeoutSettingException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author <a href="mailto:msk@touk.pl">Michal Sokolowski</a>
 */
public class UtilsTest {

    @Test
    public void shouldPrepareStatementWithQueryTimeout() throws Exception {
        // given:
        Connection c = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(c.prepareStatement("SELECT 1")).thenReturn(ps);

        // when:
        PreparedStatement result = Utils.safelyPrepareStatement("", c, "ds", 3, "SELECT 1");

        // then:
        assertSame(ps, result);
        verify(ps).setQueryTimeout(3);
    }

    @Test(expected = PrepareStmtException.class)
    public void shouldReportFailedPreparation() throws Exception {
        Connection c = mock(Connection.class);
        when(c.prepareStatement("SELECT 1")).thenThrow(new SQLException("closed"));
        Utils.safelyPrepareStatement("", c, "ds", 3, "SELECT 1");
    }

    @Test
    public void shouldCloseStatementWhenSettingTimeoutFails() throws Exception {
        // given:
        Connection c = mock(Connection.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(c.prepareStatement("SELECT 1")).thenReturn(ps);
        doThrow(new SQLException("unsupported")).when(ps).setQueryTimeout(3);

        // when:
        try {
            Utils.safelyPrepareStatement("", c, "ds", 3, "SELECT 1");
            throw new AssertionError("TimeoutSettingException expected");
        } catch (TimeoutSettingException e) {
            // then:
            verify(ps).close();
        }
    }

    @Test
    public void shouldCloseEverythingEvenIfClosingFails() throws SQLException {
        // given:
        ResultSet rs = mock(ResultSet.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        Connection c = mock(Connection.class);
        doThrow(new SQLException("rs")).when(rs).close();
        doThrow(new SQLException("ps")).when(ps).close();

        // when:
        Utils.close("", rs, ps, c);

        // then:
        verify(c).close();
    }

    @Test
    public void shouldFormatNanosAsMillis() {
        assertEquals("1.500 ms", Utils.nanosToMillisAsStr(1500000).replace(',', '.'));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shouldRejectEmptyString() {
        Utils.assertNonEmpty("", "s");
    }
}
