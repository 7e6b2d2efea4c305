package com.pgokache.service;

import com.pgokache.collector.CollectorSettings;
import com.pgokache.collector.ReadinessProbe;
import com.pgokache.collector.StatsHarvester;
import com.pgokache.crypto.CredentialVault;
import com.pgokache.model.Instance;
import com.pgokache.model.QueryStat;
import com.pgokache.model.ReadinessReport;
import com.pgokache.model.Recommendation;
import com.pgokache.model.SetupState;
import com.pgokache.model.Snapshot;
import com.pgokache.recommendation.RecommendationEngine;
import com.pgokache.store.RecordStore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Instance registration, readiness checks and collection.
 *
 * <p>Used by the HTTP layer for on-demand operations and by the background scheduler. Methods are
 * strict: errors propagate and the caller decides whether to isolate them.
 */
@Slf4j
@Service
public class CollectorService {
    private final RecordStore recordStore;
    private final CredentialVault credentialVault;
    private final ConnectionFactory connectionFactory;
    private final ReadinessProbe readinessProbe;
    private final StatsHarvester statsHarvester;
    private final RecommendationEngine recommendationEngine;
    private final CollectorSettings settings;
    private final Clock clock;

    /**
     * Result of one successful collection.
     */
    @Value
    @Builder
    public static class CollectionOutcome {
        Snapshot snapshot;
        List<QueryStat> stats;
        List<Recommendation> recommendations;
    }

    @Autowired
    public CollectorService(
            RecordStore recordStore,
            CredentialVault credentialVault,
            ConnectionFactory connectionFactory,
            ReadinessProbe readinessProbe,
            StatsHarvester statsHarvester,
            RecommendationEngine recommendationEngine,
            CollectorSettings settings
    ) {
        this(recordStore, credentialVault, connectionFactory, readinessProbe, statsHarvester,
                recommendationEngine, settings, Clock.systemUTC());
    }

    CollectorService(
            RecordStore recordStore,
            CredentialVault credentialVault,
            ConnectionFactory connectionFactory,
            ReadinessProbe readinessProbe,
            StatsHarvester statsHarvester,
            RecommendationEngine recommendationEngine,
            CollectorSettings settings,
            Clock clock
    ) {
        this.recordStore = recordStore;
        this.credentialVault = credentialVault;
        this.connectionFactory = connectionFactory;
        this.readinessProbe = readinessProbe;
        this.statsHarvester = statsHarvester;
        this.recommendationEngine = recommendationEngine;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Registers an instance, encrypting its password.
     *
     * @param coordinates connection coordinates, id ignored
     * @param password plaintext password
     * @return stored instance
     */
    public Instance registerInstance(Instance coordinates, String password) {
        Objects.requireNonNull(coordinates, "coordinates");
        if (password == null) {
            throw new IllegalArgumentException("password is required");
        }
        Instance stored = recordStore.saveInstance(coordinates.toBuilder()
                .id(null)
                .passwordEnc(credentialVault.encrypt(password))
                .build());
        log.info("Registered instance {} ({}:{}/{})", stored.getId(), stored.getHost(), stored.getPort(), stored.getDbname());
        return stored;
    }

    /**
     * Updates connection coordinates; the password is replaced only when given.
     *
     * @param instanceId instance id
     * @param coordinates new coordinates
     * @param password new plaintext password, or null to keep the current one
     * @return stored instance
     */
    public Instance updateInstance(long instanceId, Instance coordinates, String password) {
        Instance existing = getInstance(instanceId);
        Instance updated = coordinates.toBuilder()
                .id(instanceId)
                .passwordEnc(password != null ? credentialVault.encrypt(password) : existing.getPasswordEnc())
                .build();
        Instance stored = recordStore.saveInstance(updated);
        connectionFactory.evict(instanceId);
        return stored;
    }

    public Instance getInstance(long instanceId) {
        return recordStore.findInstance(instanceId).orElseThrow(() -> new InstanceNotFoundException(instanceId));
    }

    public List<Instance> listInstances() {
        return recordStore.listInstances();
    }

    public void deleteInstance(long instanceId) {
        if (!recordStore.deleteInstance(instanceId)) {
            throw new InstanceNotFoundException(instanceId);
        }
        connectionFactory.evict(instanceId);
        log.info("Deleted instance {}", instanceId);
    }

    /**
     * Probes an instance and records its setup state.
     *
     * @param instanceId instance id
     * @return probe report
     */
    public ReadinessReport checkSetup(long instanceId) {
        Instance instance = getInstance(instanceId);
        String password = credentialVault.decrypt(instance.getPasswordEnc());

        ReadinessReport report;
        try (Connection conn = connectionFactory.open(instance, password)) {
            report = readinessProbe.probe(conn);
        } catch (SQLException e) {
            throw new InstanceConnectionException("Failed to close connection to instance " + instanceId, e);
        }

        recordStore.upsertSetupState(SetupState.builder()
                .instanceId(instanceId)
                .pgVersionNum(report.getPgVersionNum())
                .preloadOk(report.isPreloadOk())
                .extCreated(report.isExtCreated())
                .ready(report.isReady())
                .lastCheckedAt(OffsetDateTime.now(clock))
                .build());
        log.info("Setup check for instance {}: status={}, ready={}", instanceId, report.getStatus(), report.isReady());
        return report;
    }

    /**
     * Collects an instance now, provided its setup is ready.
     *
     * @param instanceId instance id
     * @return collection outcome
     * @throws SetupNotReadyException if the last readiness check did not pass
     */
    public CollectionOutcome collect(long instanceId) {
        Instance instance = getInstance(instanceId);
        boolean ready = recordStore.findSetupState(instanceId).map(SetupState::isReady).orElse(false);
        if (!ready) {
            throw new SetupNotReadyException(instanceId);
        }
        return collectInstance(instance);
    }

    /**
     * Harvests one instance, persists the snapshot with its rows and refreshes recommendations.
     *
     * <p>Nothing is persisted when decryption, connection or the harvest query fails.
     *
     * @param instance instance
     * @return collection outcome
     */
    public CollectionOutcome collectInstance(Instance instance) {
        String password = credentialVault.decrypt(instance.getPasswordEnc());

        List<QueryStat> rows;
        try (Connection conn = connectionFactory.open(instance, password)) {
            rows = statsHarvester.harvest(conn, settings.toHarvestOptions());
        } catch (SQLException e) {
            throw new InstanceConnectionException("Failed to close connection to instance " + instance.getId(), e);
        }

        Snapshot snapshot = recordStore.createSnapshot(instance.getId(), rows);
        log.info("Collected snapshot {} for instance {} with {} row(s)", snapshot.getId(), instance.getId(), rows.size());

        List<QueryStat> stored = recordStore.listQueryStats(snapshot.getId());
        List<Recommendation> recommendations;
        try {
            recommendations = recommendationEngine.generate(snapshot, stored);
        } catch (RuntimeException e) {
            // The snapshot is kept; POST /v1/snapshots/{id}/recommendations regenerates.
            log.error("Recommendation generation failed for snapshot {} (instance {})", snapshot.getId(), instance.getId(), e);
            recommendations = List.of();
        }

        return CollectionOutcome.builder()
                .snapshot(snapshot)
                .stats(stored)
                .recommendations(recommendations)
                .build();
    }

    /**
     * Re-runs the recommendation engine on a stored snapshot.
     *
     * @param snapshotId snapshot id
     * @return recommendations touched
     */
    public List<Recommendation> generateRecommendations(long snapshotId) {
        Snapshot snapshot = getSnapshot(snapshotId);
        return recommendationEngine.generate(snapshot, recordStore.listQueryStats(snapshotId));
    }

    public Snapshot getSnapshot(long snapshotId) {
        return recordStore.findSnapshot(snapshotId).orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
    }

    public List<QueryStat> listQueryStats(long snapshotId) {
        return recordStore.listQueryStats(snapshotId);
    }

    public List<Snapshot> listSnapshots(Long instanceId) {
        return recordStore.listSnapshots(instanceId);
    }

    public List<SetupState> listSetupStates() {
        return recordStore.listSetupStates();
    }

    public List<Recommendation> listRecommendations(Long instanceId) {
        return recordStore.listRecommendations(instanceId);
    }
}
