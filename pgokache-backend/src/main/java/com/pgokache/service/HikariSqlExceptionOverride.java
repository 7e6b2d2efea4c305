package com.pgokache.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

/**
 * HikariCP SQL exception override that keeps monitoring connections in the pool for
 * expected, statement-level errors.
 *
 * <p>Readiness probes routinely hit {@code SHOW pg_stat_statements.*} on servers where the
 * extension is not loaded (SQLSTATE 42704), and long-running harvests may be cancelled by
 * {@code statement_timeout} (57014). Neither breaks the session.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {
    static final String UNDEFINED_OBJECT = "42704";
    static final String QUERY_CANCELED = "57014";

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlState.startsWith("0A")) {
            // 0A000: feature not supported
            return Override.DO_NOT_EVICT;
        }
        if (UNDEFINED_OBJECT.equals(sqlState) || QUERY_CANCELED.equals(sqlState)) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
