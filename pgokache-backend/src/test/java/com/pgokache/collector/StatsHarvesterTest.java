package com.pgokache.collector;

import com.pgokache.model.QueryStat;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StatsHarvesterTest {

    private final StatsHarvester harvester = new StatsHarvester();

    @Test
    void keepsRowsMeetingThresholdsInQueryOrder() throws SQLException {
        Connection conn = connection(160002, List.of(
                row("101", "SELECT *  FROM users WHERE id = 1", 100, 5000, 50),
                row("102", "SELECT 1", 4, 4000, 1000),
                row("103", "SELECT 2", 10, 10, 1),
                row("104", "UPDATE t SET x = 'a'", 5, 50, 10)));

        List<QueryStat> stats = harvester.harvest(conn, HarvestOptions.defaults());

        assertThat(stats).extracting(QueryStat::getQueryid).containsExactly("101", "104");
        QueryStat first = stats.get(0);
        assertThat(first.getQueryNorm()).isEqualTo("SELECT * FROM users WHERE id = ?");
        assertThat(first.getCalls()).isEqualTo(100);
        assertThat(first.getTotalTimeMs()).isEqualTo(5000);
        assertThat(first.getMeanTimeMs()).isEqualTo(50);
        assertThat(first.getSharedBlksHit()).isEqualTo(900);
        assertThat(first.getWalBytes()).isEqualTo(4096);
        assertThat(first.getId()).isNull();
        assertThat(first.getSnapshotId()).isNull();
        assertThat(stats.get(1).getQueryNorm()).isEqualTo("UPDATE t SET x = ?");
    }

    @Test
    void storesRawTextWhenConfigured() throws SQLException {
        Connection conn = connection(160002, List.of(row("101", "SELECT *  FROM users WHERE id = 1", 100, 5000, 50)));

        List<QueryStat> stats = harvester.harvest(conn,
                HarvestOptions.builder().storeFullQueryText(true).build());

        assertThat(stats.get(0).getQueryNorm()).isEqualTo("SELECT *  FROM users WHERE id = 1");
    }

    @Test
    void missingQueryTextBecomesEmpty() throws SQLException {
        Connection conn = connection(160002, List.of(row("101", null, 100, 5000, 50)));

        assertThat(harvester.harvest(conn, HarvestOptions.defaults()).get(0).getQueryNorm()).isEmpty();
    }

    @Test
    void bindsLimitAsParameter() throws SQLException {
        Connection conn = connection(160002, List.of());

        harvester.harvest(conn, HarvestOptions.defaults());
        verify(conn.prepareStatement("ignored")).setInt(1, 200);

        Connection other = connection(160002, List.of());
        harvester.harvest(other, HarvestOptions.builder().limit(10).build());
        verify(other.prepareStatement("ignored")).setInt(1, 10);
    }

    @Test
    void usesExecTimeColumnsFromPostgres13() throws SQLException {
        Connection conn = connection(130000, List.of());

        harvester.harvest(conn, HarvestOptions.defaults());

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(conn).prepareStatement(sql.capture());
        assertThat(sql.getValue())
                .contains("total_exec_time AS total_time")
                .contains("mean_exec_time AS mean_time")
                .contains("COALESCE(wal_bytes, 0) AS wal_bytes")
                .contains("ORDER BY total_exec_time DESC");
    }

    @Test
    void usesLegacyColumnsBeforePostgres13() throws SQLException {
        Connection conn = connection(120015, List.of());

        harvester.harvest(conn, HarvestOptions.defaults());

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(conn).prepareStatement(sql.capture());
        assertThat(sql.getValue())
                .contains("total_time AS total_time")
                .contains("0 AS wal_bytes")
                .doesNotContain("exec_time");
    }

    @Test
    void restrictsToCurrentDatabase() {
        assertThat(StatsHarvester.topQueriesSql(160000))
                .contains("WHERE dbid = (SELECT oid FROM pg_database WHERE datname = current_database())")
                .endsWith("LIMIT ?");
    }

    @Test
    void queryFailureBecomesHarvestException() throws SQLException {
        Connection conn = connection(160002, List.of());
        PreparedStatement ps = conn.prepareStatement("ignored");
        when(ps.executeQuery()).thenThrow(new SQLException("relation \"pg_stat_statements\" does not exist", "42P01"));

        assertThatThrownBy(() -> harvester.harvest(conn, HarvestOptions.defaults()))
                .isInstanceOf(HarvestException.class)
                .hasCauseInstanceOf(SQLException.class);
    }

    @Test
    void rejectsNonPositiveLimit() throws SQLException {
        Connection conn = connection(160002, List.of());

        assertThatThrownBy(() -> harvester.harvest(conn, HarvestOptions.builder().limit(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Map<String, Object> row(String queryid, String query, long calls, double totalTime, double meanTime) {
        Map<String, Object> row = new HashMap<>();
        row.put("queryid", queryid);
        row.put("query", query);
        row.put("calls", calls);
        row.put("total_time", totalTime);
        row.put("mean_time", meanTime);
        row.put("rows", calls);
        row.put("shared_blks_read", 100L);
        row.put("shared_blks_hit", 900L);
        row.put("temp_blks_written", 0L);
        row.put("wal_bytes", 4096L);
        return row;
    }

    private static Connection connection(int versionNum, List<Map<String, Object>> rows) throws SQLException {
        ResultSet versionRs = mock(ResultSet.class);
        when(versionRs.next()).thenReturn(true, false);
        when(versionRs.getInt(1)).thenReturn(versionNum);
        Statement st = mock(Statement.class);
        when(st.executeQuery(StatsHarvester.SQL_VERSION_NUM)).thenReturn(versionRs);

        AtomicInteger cursor = new AtomicInteger(-1);
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenAnswer(inv -> cursor.incrementAndGet() < rows.size());
        when(rs.getString(anyString())).thenAnswer(inv -> (String) rows.get(cursor.get()).get(inv.getArgument(0)));
        when(rs.getLong(anyString())).thenAnswer(inv -> ((Number) rows.get(cursor.get()).get(inv.getArgument(0))).longValue());
        when(rs.getDouble(anyString())).thenAnswer(inv -> ((Number) rows.get(cursor.get()).get(inv.getArgument(0))).doubleValue());
        PreparedStatement ps = mock(PreparedStatement.class);
        when(ps.executeQuery()).thenReturn(rs);

        Connection conn = mock(Connection.class);
        when(conn.createStatement()).thenReturn(st);
        when(conn.prepareStatement(anyString())).thenReturn(ps);
        return conn;
    }
}
