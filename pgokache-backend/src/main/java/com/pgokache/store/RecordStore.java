package com.pgokache.store;

import com.pgokache.model.Instance;
import com.pgokache.model.QueryStat;
import com.pgokache.model.Recommendation;
import com.pgokache.model.SetupState;
import com.pgokache.model.Snapshot;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for instances and everything collected from them.
 *
 * <p>Implementations hand out copies: mutating a returned object never changes stored state.
 */
public interface RecordStore {

    /**
     * Creates an instance when {@code id} is null, otherwise replaces the stored one.
     *
     * @param instance instance to save
     * @return stored copy with id and createdAt populated
     */
    Instance saveInstance(Instance instance);

    Optional<Instance> findInstance(long instanceId);

    List<Instance> listInstances();

    /**
     * Deletes an instance with its setup state, snapshots, query stats and recommendations.
     *
     * @param instanceId instance id
     * @return true if the instance existed
     */
    boolean deleteInstance(long instanceId);

    /**
     * Creates or overwrites the setup state of {@code state.getInstanceId()}.
     *
     * @param state setup state
     * @return stored copy
     */
    SetupState upsertSetupState(SetupState state);

    Optional<SetupState> findSetupState(long instanceId);

    List<SetupState> listSetupStates();

    /**
     * Returns setup states with {@code ready == true}, ordered by instance id.
     *
     * @return ready setup states
     */
    List<SetupState> listReadySetupStates();

    /**
     * Updates lastCheckedAt of an existing setup state. No-op when none exists.
     *
     * @param instanceId instance id
     * @param checkedAt timestamp
     */
    void touchLastChecked(long instanceId, OffsetDateTime checkedAt);

    /**
     * Atomically creates a snapshot and its rows. Either both are stored or neither is.
     *
     * @param instanceId owning instance
     * @param rows harvested rows, in harvest order
     * @return the created snapshot
     */
    Snapshot createSnapshot(long instanceId, List<QueryStat> rows);

    Optional<Snapshot> findSnapshot(long snapshotId);

    /**
     * Lists snapshots, newest first.
     *
     * @param instanceId filter, or null for all instances
     * @return snapshots
     */
    List<Snapshot> listSnapshots(Long instanceId);

    List<QueryStat> listQueryStats(long snapshotId);

    /**
     * Creates or updates the recommendation identified by (instanceId, fingerprint).
     *
     * <p>On update, type/title/details/sql/confidence/score are overwritten; id, status and
     * createdAt are kept.
     *
     * @param recommendation recommendation with instanceId and fingerprint set
     * @return stored copy
     */
    Recommendation upsertRecommendation(Recommendation recommendation);

    /**
     * Lists recommendations, newest first.
     *
     * @param instanceId filter, or null for all instances
     * @return recommendations
     */
    List<Recommendation> listRecommendations(Long instanceId);
}
