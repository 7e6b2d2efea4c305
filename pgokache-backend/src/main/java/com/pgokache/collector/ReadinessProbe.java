package com.pgokache.collector;

import com.pgokache.model.ReadinessChecks;
import com.pgokache.model.ReadinessReport;
import com.pgokache.model.ReadinessStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Inspects whether pg_stat_statements is usable on a connected database.
 *
 * <p>Runs six mandatory queries (any failure aborts the probe) and four best-effort
 * {@code SHOW pg_stat_statements.*} queries whose failures only drop that parameter.
 */
@Slf4j
@Component
public class ReadinessProbe {
    static final String EXTENSION = "pg_stat_statements";

    static final String SQL_SERVER_VERSION = "SHOW server_version";
    static final String SQL_SERVER_VERSION_NUM = "SHOW server_version_num";
    static final String SQL_SHARED_PRELOAD_LIBRARIES = "SHOW shared_preload_libraries";
    static final String SQL_AVAILABLE =
            "SELECT EXISTS (SELECT 1 FROM pg_available_extensions WHERE name = 'pg_stat_statements') AS available";
    static final String SQL_CREATED =
            "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'pg_stat_statements') AS created";
    static final String SQL_HAS_VIEW =
            "SELECT to_regclass('public.pg_stat_statements') IS NOT NULL AS has_view";

    static final List<String> TRACKING_PARAMS = List.of(
            "pg_stat_statements.track",
            "pg_stat_statements.max",
            "pg_stat_statements.save",
            "pg_stat_statements.track_utility"
    );

    /**
     * Probes the database behind {@code conn}.
     *
     * @param conn open connection, left open
     * @return readiness report
     * @throws ProbeCheckException if a mandatory check fails
     */
    public ReadinessReport probe(Connection conn) {
        ReadinessChecks checks = ReadinessChecks.builder()
                .serverVersion(queryString(conn, "server_version", SQL_SERVER_VERSION))
                .serverVersionNum(parseVersionNum(queryString(conn, "server_version_num", SQL_SERVER_VERSION_NUM)))
                .sharedPreloadLibraries(queryString(conn, "shared_preload_libraries", SQL_SHARED_PRELOAD_LIBRARIES))
                .available(queryBoolean(conn, "available", SQL_AVAILABLE))
                .created(queryBoolean(conn, "created", SQL_CREATED))
                .hasView(queryBoolean(conn, "has_view", SQL_HAS_VIEW))
                .build();

        boolean preloadOk = isPreloaded(checks.getSharedPreloadLibraries());
        boolean ready = checks.isAvailable() && preloadOk && checks.isCreated() && checks.isHasView();
        ReadinessStatus status = classify(checks.isAvailable(), preloadOk, checks.isCreated());

        Map<String, String> params = new LinkedHashMap<>();
        for (String param : TRACKING_PARAMS) {
            readParam(conn, param).ifPresent(value -> params.put(param, value));
        }

        log.debug("Readiness probe: status={}, ready={}, version_num={}, params={}",
                status, ready, checks.getServerVersionNum(), params.keySet());

        return ReadinessReport.builder()
                .status(status)
                .ready(ready)
                .pgVersionNum(checks.getServerVersionNum())
                .preloadOk(preloadOk)
                .extCreated(checks.isCreated())
                .checks(checks)
                .params(params)
                .build();
    }

    /**
     * Classifies setup state. The view check is deliberately not part of this.
     *
     * @param available extension available on the server
     * @param preloadOk extension listed in shared_preload_libraries
     * @param created extension created in the current database
     * @return status
     */
    static ReadinessStatus classify(boolean available, boolean preloadOk, boolean created) {
        if (!available) {
            return ReadinessStatus.BLOCKED;
        }
        if (!preloadOk) {
            return ReadinessStatus.NEEDS_PRELOAD;
        }
        if (!created) {
            return ReadinessStatus.NEEDS_CREATE_EXTENSION;
        }
        return ReadinessStatus.READY;
    }

    static boolean isPreloaded(String sharedPreloadLibraries) {
        if (sharedPreloadLibraries == null || sharedPreloadLibraries.isBlank()) {
            return false;
        }
        return Arrays.stream(sharedPreloadLibraries.split(","))
                .map(s -> s.strip().toLowerCase(Locale.ROOT))
                .anyMatch(EXTENSION::equals);
    }

    /**
     * Reads one tracking parameter. On failure the transaction is rolled back so the session stays usable.
     */
    private Optional<String> readParam(Connection conn, String param) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SHOW " + param)) {
            return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
        } catch (SQLException e) {
            log.debug("Parameter {} unavailable: {}", param, e.getMessage());
            rollback(conn, param);
            return Optional.empty();
        }
    }

    private void rollback(Connection conn, String param) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            throw new ProbeCheckException("Rollback after failed check of " + param + " failed", e);
        }
    }

    private String queryString(Connection conn, String check, String sql) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            if (!rs.next()) {
                throw new ProbeCheckException("Readiness check returned no rows: " + check, null);
            }
            return rs.getString(1);
        } catch (SQLException e) {
            throw new ProbeCheckException("Readiness check failed: " + check, e);
        }
    }

    private boolean queryBoolean(Connection conn, String check, String sql) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            if (!rs.next()) {
                throw new ProbeCheckException("Readiness check returned no rows: " + check, null);
            }
            return rs.getBoolean(1);
        } catch (SQLException e) {
            throw new ProbeCheckException("Readiness check failed: " + check, e);
        }
    }

    private static int parseVersionNum(String value) {
        try {
            return Integer.parseInt(value != null ? value.strip() : "");
        } catch (NumberFormatException e) {
            throw new ProbeCheckException("Unexpected server_version_num: " + value, e);
        }
    }
}
