package com.pgokache.controller;

import com.pgokache.api.CollectResponse;
import com.pgokache.api.InstanceRequest;
import com.pgokache.api.InstanceResponse;
import com.pgokache.api.SnapshotResponse;
import com.pgokache.model.ReadinessReport;
import com.pgokache.model.Recommendation;
import com.pgokache.model.SetupState;
import com.pgokache.model.Snapshot;
import com.pgokache.scheduler.CollectionScheduler;
import com.pgokache.service.CollectorService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class PgokacheController {

    private static final Logger log = LoggerFactory.getLogger(PgokacheController.class);

    private final CollectorService collectorService;
    private final CollectionScheduler collectionScheduler;

    public PgokacheController(CollectorService collectorService, CollectionScheduler collectionScheduler) {
        this.collectorService = collectorService;
        this.collectionScheduler = collectionScheduler;
    }

    /**
     * Register an instance.
     *
     * POST /v1/instances
     *
     * @param request coordinates and password
     * @return created instance, without password
     */
    @PostMapping("/instances")
    public ResponseEntity<InstanceResponse> createInstance(@Valid @RequestBody InstanceRequest request) {
        if (request.getPassword() == null) {
            throw new IllegalArgumentException("password is required");
        }
        var instance = collectorService.registerInstance(request.toInstance(), request.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED).body(InstanceResponse.from(instance));
    }

    @GetMapping("/instances")
    public List<InstanceResponse> listInstances() {
        return collectorService.listInstances().stream().map(InstanceResponse::from).toList();
    }

    @GetMapping("/instances/{id}")
    public InstanceResponse getInstance(@PathVariable("id") long id) {
        return InstanceResponse.from(collectorService.getInstance(id));
    }

    /**
     * Update an instance. Omitting the password keeps the stored one.
     *
     * PUT /v1/instances/{id}
     */
    @PutMapping("/instances/{id}")
    public InstanceResponse updateInstance(@PathVariable("id") long id, @Valid @RequestBody InstanceRequest request) {
        return InstanceResponse.from(collectorService.updateInstance(id, request.toInstance(), request.getPassword()));
    }

    @DeleteMapping("/instances/{id}")
    public ResponseEntity<Void> deleteInstance(@PathVariable("id") long id) {
        collectorService.deleteInstance(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * Probe pg_stat_statements readiness and store the setup state.
     *
     * POST /v1/instances/{id}/check_setup
     *
     * @param id instance id
     * @return readiness report
     */
    @PostMapping("/instances/{id}/check_setup")
    public ReadinessReport checkSetup(@PathVariable("id") long id) {
        return collectorService.checkSetup(id);
    }

    /**
     * Collect a snapshot now. Responds 409 when the instance's setup is not ready.
     *
     * POST /v1/instances/{id}/collect
     *
     * @param id instance id
     * @return snapshot id and row count
     */
    @PostMapping("/instances/{id}/collect")
    public CollectResponse collect(@PathVariable("id") long id) {
        CollectorService.CollectionOutcome outcome = collectorService.collect(id);
        log.debug("On-demand collection for instance {} produced snapshot {}", id, outcome.getSnapshot().getId());
        return CollectResponse.builder()
                .snapshotId(outcome.getSnapshot().getId())
                .rows(outcome.getStats().size())
                .recommendations(outcome.getRecommendations().size())
                .build();
    }

    @GetMapping("/setup-states")
    public List<SetupState> listSetupStates() {
        return collectorService.listSetupStates();
    }

    @GetMapping("/snapshots")
    public List<Snapshot> listSnapshots(@RequestParam(name = "instance_id", required = false) Long instanceId) {
        return collectorService.listSnapshots(instanceId);
    }

    @GetMapping("/snapshots/{id}")
    public SnapshotResponse getSnapshot(@PathVariable("id") long id) {
        Snapshot snapshot = collectorService.getSnapshot(id);
        return SnapshotResponse.from(snapshot, collectorService.listQueryStats(id));
    }

    /**
     * Re-run recommendation generation for a stored snapshot.
     *
     * POST /v1/snapshots/{id}/recommendations
     */
    @PostMapping("/snapshots/{id}/recommendations")
    public List<Recommendation> generateRecommendations(@PathVariable("id") long id) {
        return collectorService.generateRecommendations(id);
    }

    @GetMapping("/recommendations")
    public List<Recommendation> listRecommendations(@RequestParam(name = "instance_id", required = false) Long instanceId) {
        return collectorService.listRecommendations(instanceId);
    }

    @GetMapping("/scheduler/status")
    public CollectionScheduler.SchedulerStatus schedulerStatus() {
        return collectionScheduler.getStatus();
    }
}
