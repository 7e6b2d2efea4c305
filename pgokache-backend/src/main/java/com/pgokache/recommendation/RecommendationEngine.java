package com.pgokache.recommendation;

import com.pgokache.collector.Fingerprints;
import com.pgokache.collector.QueryNormalizer;
import com.pgokache.model.Confidence;
import com.pgokache.model.QueryStat;
import com.pgokache.model.Recommendation;
import com.pgokache.model.RecommendationType;
import com.pgokache.model.Snapshot;
import com.pgokache.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Rule-based recommendations over one snapshot.
 *
 * <p>Two heuristics:
 * <ul>
 *   <li>read replica: the workload is large and dominated by SELECT time;</li>
 *   <li>index: a frequent, slow SELECT is among the five most expensive statements.</li>
 * </ul>
 * Results are upserted by (instance, fingerprint), so running twice on the same snapshot
 * changes nothing.
 */
@Slf4j
@Service
public class RecommendationEngine {
    static final double READ_REPLICA_MIN_TOTAL_TIME_MS = 10_000;
    static final double READ_REPLICA_MIN_SELECT_RATIO = 0.8;

    static final int INDEX_TOP_N = 5;
    static final long INDEX_MIN_CALLS = 25;
    static final double INDEX_MIN_MEAN_TIME_MS = 50;
    static final double INDEX_MEDIUM_MEAN_TIME_MS = 100;

    private final RecordStore recordStore;

    public RecommendationEngine(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    /**
     * Generates and upserts recommendations for a snapshot.
     *
     * @param snapshot snapshot the rows belong to
     * @param stats query stats of that snapshot
     * @return the stored recommendations touched by this run, read replica first
     */
    public List<Recommendation> generate(Snapshot snapshot, List<QueryStat> stats) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (stats == null || stats.isEmpty()) {
            return List.of();
        }
        long instanceId = snapshot.getInstanceId();

        double totalTime = 0;
        double selectTime = 0;
        for (QueryStat stat : stats) {
            totalTime += stat.getTotalTimeMs();
            if (QueryNormalizer.isSelect(stat.getQueryNorm())) {
                selectTime += stat.getTotalTimeMs();
            }
        }
        double selectRatio = totalTime > 0 ? selectTime / totalTime : 0;

        List<Recommendation> out = new ArrayList<>();
        if (totalTime >= READ_REPLICA_MIN_TOTAL_TIME_MS && selectRatio >= READ_REPLICA_MIN_SELECT_RATIO) {
            out.add(recordStore.upsertRecommendation(readReplica(instanceId, selectRatio)));
        }

        List<QueryStat> top = stats.stream()
                .sorted(Comparator.comparingDouble(QueryStat::getTotalTimeMs).reversed())
                .limit(INDEX_TOP_N)
                .toList();
        for (QueryStat stat : top) {
            if (isIndexCandidate(stat)) {
                out.add(recordStore.upsertRecommendation(index(instanceId, stat, totalTime)));
            }
        }

        log.debug("Generated {} recommendation(s) for snapshot {} (instance {}, total_time_ms={}, select_ratio={})",
                out.size(), snapshot.getId(), instanceId, totalTime, selectRatio);
        return out;
    }

    static boolean isIndexCandidate(QueryStat stat) {
        return QueryNormalizer.isSelect(stat.getQueryNorm())
                && stat.getCalls() >= INDEX_MIN_CALLS
                && stat.getMeanTimeMs() >= INDEX_MIN_MEAN_TIME_MS;
    }

    private static Recommendation readReplica(long instanceId, double selectRatio) {
        return Recommendation.builder()
                .instanceId(instanceId)
                .fingerprint(Fingerprints.forReadReplica(instanceId))
                .type(RecommendationType.READ_REPLICA)
                .title("Read-heavy workload detected")
                .details(String.format(Locale.ROOT,
                        "%.0f%% of total query time comes from SELECT statements. "
                                + "A read replica can absorb reporting/analytics workloads.",
                        selectRatio * 100))
                .sql("")
                .confidence(Confidence.MEDIUM)
                .score(round1(selectRatio * 100))
                .build();
    }

    private static Recommendation index(long instanceId, QueryStat stat, double totalTime) {
        double share = totalTime > 0 ? round1(stat.getTotalTimeMs() / totalTime * 100) : 0;
        return Recommendation.builder()
                .instanceId(instanceId)
                .fingerprint(Fingerprints.forQuery(stat.getQueryid(), instanceId))
                .type(RecommendationType.INDEX)
                .title("Index opportunity for query " + stat.getQueryid())
                .details(String.format(Locale.ROOT,
                        "Mean time %.1f ms across %d calls. "
                                + "Consider EXPLAIN (ANALYZE, BUFFERS) and indexing filter/join columns.",
                        stat.getMeanTimeMs(), stat.getCalls()))
                .sql("")
                .confidence(stat.getMeanTimeMs() >= INDEX_MEDIUM_MEAN_TIME_MS ? Confidence.MEDIUM : Confidence.LOW)
                .score(Math.min(100, share))
                .build();
    }

    /**
     * Rounds to one decimal, half to even on the exact binary value ({@code 81.25 -> 81.2}).
     */
    static double round1(double value) {
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }
}
