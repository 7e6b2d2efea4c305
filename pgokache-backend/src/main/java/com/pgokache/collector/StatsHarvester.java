package com.pgokache.collector;

import com.pgokache.model.QueryStat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the most expensive statements of the current database from pg_stat_statements.
 *
 * <p>Threshold filtering happens after the query so that {@code limit} always caps the rows read,
 * not the rows kept.
 */
@Slf4j
@Component
public class StatsHarvester {
    /** server_version_num from which pg_stat_statements exposes *_exec_time and wal_bytes. */
    static final int PG13 = 130000;

    static final String SQL_VERSION_NUM = "SELECT current_setting('server_version_num')::int";

    static final String SQL_TOP_QUERIES = "SELECT queryid::text AS queryid, query, calls, "
            + "%s AS total_time, %s AS mean_time, rows, "
            + "COALESCE(shared_blks_read, 0) AS shared_blks_read, "
            + "COALESCE(shared_blks_hit, 0) AS shared_blks_hit, "
            + "COALESCE(temp_blks_written, 0) AS temp_blks_written, "
            + "%s AS wal_bytes "
            + "FROM pg_stat_statements "
            + "WHERE dbid = (SELECT oid FROM pg_database WHERE datname = current_database()) "
            + "ORDER BY %s DESC "
            + "LIMIT ?";

    /**
     * Harvests top queries.
     *
     * @param conn open connection, left open
     * @param options thresholds and text policy
     * @return surviving rows in descending total time order, without ids
     * @throws HarvestException on any SQL failure
     */
    public List<QueryStat> harvest(Connection conn, HarvestOptions options) {
        HarvestOptions opts = options != null ? options : HarvestOptions.defaults();
        if (opts.getLimit() <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }

        String sql = topQueriesSql(serverVersionNum(conn));
        List<QueryStat> out = new ArrayList<>();
        int read = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, opts.getLimit());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    read++;
                    long calls = rs.getLong("calls");
                    double totalTime = rs.getDouble("total_time");
                    if (calls < opts.getMinCalls() || totalTime < opts.getMinTotalTimeMs()) {
                        continue;
                    }
                    String query = rs.getString("query");
                    out.add(QueryStat.builder()
                            .queryid(rs.getString("queryid"))
                            .queryNorm(opts.isStoreFullQueryText()
                                    ? (query != null ? query : "")
                                    : QueryNormalizer.normalize(query))
                            .calls(calls)
                            .totalTimeMs(totalTime)
                            .meanTimeMs(rs.getDouble("mean_time"))
                            .rows(rs.getLong("rows"))
                            .sharedBlksRead(rs.getLong("shared_blks_read"))
                            .sharedBlksHit(rs.getLong("shared_blks_hit"))
                            .tempBlksWritten(rs.getLong("temp_blks_written"))
                            .walBytes(rs.getLong("wal_bytes"))
                            .build());
                }
            }
        } catch (SQLException e) {
            throw new HarvestException("pg_stat_statements query failed: " + e.getMessage(), e);
        }

        log.debug("Harvested {} of {} pg_stat_statements rows (limit={}, min_calls={}, min_total_time_ms={})",
                out.size(), read, opts.getLimit(), opts.getMinCalls(), opts.getMinTotalTimeMs());
        return out;
    }

    static String topQueriesSql(int serverVersionNum) {
        if (serverVersionNum >= PG13) {
            return String.format(SQL_TOP_QUERIES,
                    "total_exec_time", "mean_exec_time", "COALESCE(wal_bytes, 0)", "total_exec_time");
        }
        return String.format(SQL_TOP_QUERIES, "total_time", "mean_time", "0", "total_time");
    }

    private int serverVersionNum(Connection conn) {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(SQL_VERSION_NUM)) {
            if (!rs.next()) {
                throw new HarvestException("server_version_num returned no rows", null);
            }
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new HarvestException("Failed to read server_version_num: " + e.getMessage(), e);
        }
    }
}
