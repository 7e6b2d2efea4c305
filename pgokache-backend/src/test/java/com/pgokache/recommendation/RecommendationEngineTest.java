package com.pgokache.recommendation;

import com.pgokache.collector.Fingerprints;
import com.pgokache.model.Confidence;
import com.pgokache.model.Instance;
import com.pgokache.model.QueryStat;
import com.pgokache.model.Recommendation;
import com.pgokache.model.RecommendationType;
import com.pgokache.model.Snapshot;
import com.pgokache.store.InMemoryRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationEngineTest {

    private InMemoryRecordStore store;
    private RecommendationEngine engine;
    private long instanceId;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        engine = new RecommendationEngine(store);
        instanceId = store.saveInstance(Instance.builder()
                .name("prod").host("db").dbname("app").user("mon").passwordEnc(new byte[]{1})
                .build()).getId();
    }

    @Test
    void emptySnapshotProducesNothing() {
        Snapshot snapshot = store.createSnapshot(instanceId, List.of());

        assertThat(engine.generate(snapshot, List.of())).isEmpty();
        assertThat(store.listRecommendations(instanceId)).isEmpty();
    }

    @Test
    void readHeavyWorkloadSuggestsReplica() {
        List<QueryStat> stats = collect(
                stat("1", "SELECT * FROM orders WHERE id = ?", 10, 12000, 1200),
                stat("2", "select count(*) from orders", 10, 8000, 800));

        List<Recommendation> recs = engine.generate(snapshot(stats), stats);

        assertThat(recs).hasSize(1);
        Recommendation rec = recs.get(0);
        assertThat(rec.getType()).isEqualTo(RecommendationType.READ_REPLICA);
        assertThat(rec.getFingerprint()).isEqualTo(Fingerprints.forReadReplica(instanceId));
        assertThat(rec.getTitle()).isEqualTo("Read-heavy workload detected");
        assertThat(rec.getDetails()).isEqualTo("100% of total query time comes from SELECT statements. "
                + "A read replica can absorb reporting/analytics workloads.");
        assertThat(rec.getScore()).isEqualTo(100.0);
        assertThat(rec.getConfidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(rec.getSql()).isEmpty();
        assertThat(rec.getStatus()).isEqualTo(Recommendation.STATUS_OPEN);
    }

    @Test
    void replicaThresholdsAreInclusive() {
        List<QueryStat> stats = collect(
                stat("1", "SELECT 1", 10, 8000, 800),
                stat("2", "UPDATE t SET a = ?", 10, 2000, 200));

        List<Recommendation> recs = engine.generate(snapshot(stats), stats);

        assertThat(recs).singleElement().satisfies(rec -> {
            assertThat(rec.getType()).isEqualTo(RecommendationType.READ_REPLICA);
            assertThat(rec.getScore()).isEqualTo(80.0);
        });
    }

    @Test
    void noReplicaBelowSelectRatio() {
        List<QueryStat> stats = collect(
                stat("1", "SELECT 1", 10, 7000, 700),
                stat("2", "DELETE FROM t", 10, 3000, 300));

        assertThat(engine.generate(snapshot(stats), stats)).isEmpty();
    }

    @Test
    void noReplicaBelowTotalTime() {
        List<QueryStat> stats = collect(stat("1", "SELECT 1", 10, 9999, 999.9));

        assertThat(engine.generate(snapshot(stats), stats)).isEmpty();
    }

    @Test
    void indexCandidatesAreFrequentSlowSelects() {
        List<QueryStat> stats = collect(
                stat("400", "UPDATE t SET a = ?", 100, 20000, 200),
                stat("100", "SELECT * FROM t WHERE a = ?", 100, 12000, 120),
                stat("300", "SELECT * FROM u WHERE b = ?", 24, 12000, 500),
                stat("200", "SELECT * FROM v WHERE c = ?", 25, 1250, 50));

        List<Recommendation> recs = engine.generate(snapshot(stats), stats);

        assertThat(recs).extracting(Recommendation::getType).containsOnly(RecommendationType.INDEX);
        assertThat(recs).extracting(Recommendation::getFingerprint).containsExactly(
                Fingerprints.forQuery("100", instanceId),
                Fingerprints.forQuery("200", instanceId));

        Recommendation medium = recs.get(0);
        assertThat(medium.getTitle()).isEqualTo("Index opportunity for query 100");
        assertThat(medium.getDetails()).isEqualTo("Mean time 120.0 ms across 100 calls. "
                + "Consider EXPLAIN (ANALYZE, BUFFERS) and indexing filter/join columns.");
        assertThat(medium.getConfidence()).isEqualTo(Confidence.MEDIUM);
        assertThat(medium.getScore()).isEqualTo(26.5);

        Recommendation low = recs.get(1);
        assertThat(low.getConfidence()).isEqualTo(Confidence.LOW);
        assertThat(low.getScore()).isEqualTo(2.8);
    }

    @Test
    void onlyTopFiveByTotalTimeAreConsidered() {
        List<QueryStat> stats = collect(
                stat("1", "SELECT 1", 100, 600, 60),
                stat("2", "SELECT 2", 100, 500, 60),
                stat("3", "SELECT 3", 100, 400, 60),
                stat("4", "SELECT 4", 100, 300, 60),
                stat("5", "SELECT 5", 100, 200, 60),
                stat("6", "SELECT 6", 100, 100, 60));

        List<Recommendation> recs = engine.generate(snapshot(stats), stats);

        assertThat(recs).hasSize(5);
        assertThat(recs).extracting(Recommendation::getFingerprint)
                .doesNotContain(Fingerprints.forQuery("6", instanceId));
    }

    @Test
    void rerunOnSameSnapshotChangesNothing() {
        List<QueryStat> stats = collect(
                stat("1", "SELECT * FROM t WHERE a = ?", 100, 15000, 150));
        Snapshot snapshot = snapshot(stats);

        List<Recommendation> first = engine.generate(snapshot, stats);
        List<Recommendation> second = engine.generate(snapshot, stats);

        assertThat(first).hasSize(2);
        assertThat(second).isEqualTo(first);
        assertThat(store.listRecommendations(instanceId)).hasSize(2);
        assertThat(store.listRecommendations(instanceId))
                .filteredOn(r -> r.getType() == RecommendationType.READ_REPLICA)
                .hasSize(1);
    }

    @Test
    void regenerationKeepsStatusAndCreatedAt() {
        Recommendation dismissed = store.upsertRecommendation(Recommendation.builder()
                .instanceId(instanceId)
                .fingerprint(Fingerprints.forReadReplica(instanceId))
                .type(RecommendationType.READ_REPLICA)
                .title("old")
                .details("old")
                .confidence(Confidence.LOW)
                .score(1)
                .status("dismissed")
                .build());
        List<QueryStat> stats = collect(stat("1", "SELECT 1", 10, 20000, 2000));

        List<Recommendation> recs = engine.generate(snapshot(stats), stats);

        assertThat(recs).singleElement().satisfies(rec -> {
            assertThat(rec.getId()).isEqualTo(dismissed.getId());
            assertThat(rec.getStatus()).isEqualTo("dismissed");
            assertThat(rec.getCreatedAt()).isEqualTo(dismissed.getCreatedAt());
            assertThat(rec.getTitle()).isEqualTo("Read-heavy workload detected");
            assertThat(rec.getScore()).isEqualTo(100.0);
        });
    }

    @Test
    void roundsToOneDecimal() {
        assertThat(RecommendationEngine.round1(26.519)).isEqualTo(26.5);
        assertThat(RecommendationEngine.round1(2.762)).isEqualTo(2.8);
        assertThat(RecommendationEngine.round1(100)).isEqualTo(100.0);
    }

    @Test
    void roundsExactHalvesToEven() {
        assertThat(RecommendationEngine.round1(81.25)).isEqualTo(81.2);
        assertThat(RecommendationEngine.round1(81.75)).isEqualTo(81.8);
        assertThat(RecommendationEngine.round1(0.15)).isEqualTo(0.1);
        assertThat(RecommendationEngine.round1(0.0)).isEqualTo(0.0);
    }

    @Test
    void replicaScoreRoundsHalfToEven() {
        List<QueryStat> stats = collect(
                stat("1", "SELECT 1", 10, 8125, 812.5),
                stat("2", "UPDATE t SET a = ?", 10, 1875, 187.5));

        List<Recommendation> recs = engine.generate(snapshot(stats), stats);

        assertThat(recs).singleElement().satisfies(rec -> {
            assertThat(rec.getScore()).isEqualTo(81.2);
            assertThat(rec.getDetails()).startsWith("81% of total query time");
        });
    }

    private Snapshot snapshot(List<QueryStat> stats) {
        return store.findSnapshot(stats.get(0).getSnapshotId()).orElseThrow();
    }

    private List<QueryStat> collect(QueryStat... rows) {
        Snapshot snapshot = store.createSnapshot(instanceId, List.of(rows));
        return store.listQueryStats(snapshot.getId());
    }

    private static QueryStat stat(String queryid, String queryNorm, long calls, double totalTimeMs, double meanTimeMs) {
        return QueryStat.builder()
                .queryid(queryid)
                .queryNorm(queryNorm)
                .calls(calls)
                .totalTimeMs(totalTimeMs)
                .meanTimeMs(meanTimeMs)
                .build();
    }
}
