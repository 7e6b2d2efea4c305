package com.pgokache.store;

import com.pgokache.model.Instance;
import com.pgokache.model.QueryStat;
import com.pgokache.model.Recommendation;
import com.pgokache.model.SetupState;
import com.pgokache.model.Snapshot;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link RecordStore}. State is lost on restart.
 *
 * <p>Compound operations (cascading delete, snapshot creation, upserts) synchronize on the store
 * so readers never observe a snapshot without its rows.
 */
@Component
public class InMemoryRecordStore implements RecordStore {
    private final Clock clock;

    private final AtomicLong instanceIds = new AtomicLong();
    private final AtomicLong snapshotIds = new AtomicLong();
    private final AtomicLong queryStatIds = new AtomicLong();
    private final AtomicLong recommendationIds = new AtomicLong();

    private final Map<Long, Instance> instances = new ConcurrentHashMap<>();
    private final Map<Long, SetupState> setupStates = new ConcurrentHashMap<>();
    private final Map<Long, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<Long, List<QueryStat>> queryStatsBySnapshot = new ConcurrentHashMap<>();
    private final Map<String, Recommendation> recommendations = new ConcurrentHashMap<>();

    public InMemoryRecordStore() {
        this(Clock.systemUTC());
    }

    public InMemoryRecordStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Instance saveInstance(Instance instance) {
        Objects.requireNonNull(instance, "instance");
        Instance stored;
        if (instance.getId() == null) {
            stored = instance.toBuilder()
                    .id(instanceIds.incrementAndGet())
                    .createdAt(OffsetDateTime.now(clock))
                    .build();
        } else {
            Instance existing = instances.get(instance.getId());
            if (existing == null) {
                throw new IllegalArgumentException("Unknown instance: " + instance.getId());
            }
            stored = instance.toBuilder().createdAt(existing.getCreatedAt()).build();
        }
        instances.put(stored.getId(), copy(stored));
        return copy(stored);
    }

    @Override
    public Optional<Instance> findInstance(long instanceId) {
        return Optional.ofNullable(instances.get(instanceId)).map(InMemoryRecordStore::copy);
    }

    @Override
    public List<Instance> listInstances() {
        return instances.values().stream()
                .sorted(Comparator.comparing(Instance::getId).reversed())
                .map(InMemoryRecordStore::copy)
                .toList();
    }

    @Override
    public synchronized boolean deleteInstance(long instanceId) {
        if (instances.remove(instanceId) == null) {
            return false;
        }
        setupStates.remove(instanceId);
        snapshots.values().removeIf(s -> {
            if (s.getInstanceId() == instanceId) {
                queryStatsBySnapshot.remove(s.getId());
                return true;
            }
            return false;
        });
        recommendations.values().removeIf(r -> r.getInstanceId() == instanceId);
        return true;
    }

    @Override
    public synchronized SetupState upsertSetupState(SetupState state) {
        Objects.requireNonNull(state, "state");
        Long instanceId = Objects.requireNonNull(state.getInstanceId(), "instanceId");
        requireInstance(instanceId);
        SetupState stored = state.toBuilder().build();
        if (stored.getLastCheckedAt() == null) {
            stored.setLastCheckedAt(OffsetDateTime.now(clock));
        }
        setupStates.put(instanceId, stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<SetupState> findSetupState(long instanceId) {
        return Optional.ofNullable(setupStates.get(instanceId)).map(s -> s.toBuilder().build());
    }

    @Override
    public List<SetupState> listSetupStates() {
        return setupStates.values().stream()
                .sorted(Comparator.comparing(SetupState::getLastCheckedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public List<SetupState> listReadySetupStates() {
        return setupStates.values().stream()
                .filter(SetupState::isReady)
                .sorted(Comparator.comparing(SetupState::getInstanceId))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public void touchLastChecked(long instanceId, OffsetDateTime checkedAt) {
        setupStates.computeIfPresent(instanceId, (id, s) -> s.toBuilder().lastCheckedAt(checkedAt).build());
    }

    @Override
    public synchronized Snapshot createSnapshot(long instanceId, List<QueryStat> rows) {
        Objects.requireNonNull(rows, "rows");
        requireInstance(instanceId);

        // Build everything first so a bad row leaves no trace.
        long snapshotId = snapshotIds.incrementAndGet();
        List<QueryStat> stored = new ArrayList<>(rows.size());
        for (QueryStat row : rows) {
            Objects.requireNonNull(row, "row");
            stored.add(row.toBuilder()
                    .id(queryStatIds.incrementAndGet())
                    .snapshotId(snapshotId)
                    .build());
        }
        Snapshot snapshot = Snapshot.builder()
                .id(snapshotId)
                .instanceId(instanceId)
                .capturedAt(OffsetDateTime.now(clock))
                .build();

        queryStatsBySnapshot.put(snapshotId, List.copyOf(stored));
        snapshots.put(snapshotId, snapshot);
        return snapshot.toBuilder().build();
    }

    @Override
    public Optional<Snapshot> findSnapshot(long snapshotId) {
        return Optional.ofNullable(snapshots.get(snapshotId)).map(s -> s.toBuilder().build());
    }

    @Override
    public List<Snapshot> listSnapshots(Long instanceId) {
        return snapshots.values().stream()
                .filter(s -> instanceId == null || instanceId.equals(s.getInstanceId()))
                .sorted(Comparator.comparing(Snapshot::getId).reversed())
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public List<QueryStat> listQueryStats(long snapshotId) {
        List<QueryStat> rows = queryStatsBySnapshot.get(snapshotId);
        if (rows == null) {
            return List.of();
        }
        return rows.stream().map(r -> r.toBuilder().build()).toList();
    }

    @Override
    public synchronized Recommendation upsertRecommendation(Recommendation recommendation) {
        Objects.requireNonNull(recommendation, "recommendation");
        Long instanceId = Objects.requireNonNull(recommendation.getInstanceId(), "instanceId");
        String fingerprint = Objects.requireNonNull(recommendation.getFingerprint(), "fingerprint");
        requireInstance(instanceId);

        String key = instanceId + ":" + fingerprint;
        Recommendation existing = recommendations.get(key);
        Recommendation stored;
        if (existing == null) {
            stored = recommendation.toBuilder()
                    .id(recommendationIds.incrementAndGet())
                    .status(recommendation.getStatus() != null ? recommendation.getStatus() : Recommendation.STATUS_OPEN)
                    .createdAt(OffsetDateTime.now(clock))
                    .build();
        } else {
            stored = existing.toBuilder()
                    .type(recommendation.getType())
                    .title(recommendation.getTitle())
                    .details(recommendation.getDetails())
                    .sql(recommendation.getSql())
                    .confidence(recommendation.getConfidence())
                    .score(recommendation.getScore())
                    .build();
        }
        recommendations.put(key, stored);
        return stored.toBuilder().build();
    }

    @Override
    public List<Recommendation> listRecommendations(Long instanceId) {
        return recommendations.values().stream()
                .filter(r -> instanceId == null || instanceId.equals(r.getInstanceId()))
                .sorted(Comparator.comparing(Recommendation::getId).reversed())
                .map(r -> r.toBuilder().build())
                .toList();
    }

    private void requireInstance(long instanceId) {
        if (!instances.containsKey(instanceId)) {
            throw new IllegalArgumentException("Unknown instance: " + instanceId);
        }
    }

    private static Instance copy(Instance instance) {
        byte[] enc = instance.getPasswordEnc();
        return instance.toBuilder().passwordEnc(enc != null ? enc.clone() : null).build();
    }
}
