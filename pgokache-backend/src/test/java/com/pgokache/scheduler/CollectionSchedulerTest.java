package com.pgokache.scheduler;

import com.pgokache.collector.CollectorSettings;
import com.pgokache.collector.HarvestException;
import com.pgokache.collector.ReadinessProbe;
import com.pgokache.collector.StatsHarvester;
import com.pgokache.crypto.FakeCredentialVault;
import com.pgokache.model.Instance;
import com.pgokache.model.QueryStat;
import com.pgokache.model.SetupState;
import com.pgokache.recommendation.RecommendationEngine;
import com.pgokache.service.CollectorService;
import com.pgokache.service.ConnectionFactory;
import com.pgokache.store.InMemoryRecordStore;
import com.pgokache.store.RecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CollectionSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-05-01T08:00:00Z");
    private static final OffsetDateTime NEXT_PASS = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusSeconds(60);
    private static final OffsetDateTime EARLIER = OffsetDateTime.parse("2026-04-30T08:00:00Z");

    private final FakeCredentialVault vault = new FakeCredentialVault();
    private final ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
    private final StatsHarvester harvester = mock(StatsHarvester.class);
    private final CollectorSettings settings = CollectorSettings.builder().build();

    private InMemoryRecordStore store;
    private CollectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        CollectorService collectorService = new CollectorService(store, vault, connectionFactory,
                mock(ReadinessProbe.class), harvester, new RecommendationEngine(store), settings);
        scheduler = new CollectionScheduler(store, collectorService, settings, true,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(harvester.harvest(any(), any())).thenReturn(List.of(QueryStat.builder()
                .queryid("1").queryNorm("SELECT ?").calls(10).totalTimeMs(100).meanTimeMs(10).build()));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void failingInstanceDoesNotStopThePass() {
        long first = readyInstance("one");
        long second = readyInstance("two");
        long third = readyInstance("three");
        Connection failing = connectionFor(second);
        connectionFor(first);
        connectionFor(third);
        when(harvester.harvest(eq(failing), any())).thenThrow(new HarvestException("boom", null));

        CollectionScheduler.PassResult result = scheduler.runPass();

        assertThat(result.getCollected()).isEqualTo(2);
        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(store.listSnapshots(first)).hasSize(1);
        assertThat(store.listSnapshots(second)).isEmpty();
        assertThat(store.listSnapshots(third)).hasSize(1);
        assertThat(store.listSetupStates())
                .extracting(SetupState::getLastCheckedAt)
                .containsOnly(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void errorFromOneInstanceDoesNotStopThePass() {
        long first = readyInstance("one");
        long second = readyInstance("two");
        Connection failing = connectionFor(first);
        connectionFor(second);
        when(harvester.harvest(eq(failing), any())).thenThrow(new StackOverflowError("deep query text"));

        CollectionScheduler.PassResult result = scheduler.runPass();

        assertThat(result.getFailed()).isEqualTo(1);
        assertThat(result.getCollected()).isEqualTo(1);
        assertThat(store.listSnapshots(second)).hasSize(1);
        assertThat(store.findSetupState(first)).get()
                .extracting(SetupState::getLastCheckedAt)
                .isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void startedSchedulerRunsAPassAndSchedulesTheNext() throws InterruptedException {
        long id = readyInstance("one");
        connectionFor(id);

        scheduler.start();

        verify(harvester, timeout(5000)).harvest(any(), any());
        awaitNextPass(scheduler);
        assertThat(store.listSnapshots(id)).hasSize(1);
        assertThat(scheduler.getStatus().getPassCount()).isEqualTo(1);
    }

    @Test
    void failedPassStillSchedulesTheNext() throws InterruptedException {
        RecordStore brokenStore = mock(RecordStore.class);
        when(brokenStore.listReadySetupStates()).thenThrow(new StackOverflowError("deep"));
        CollectionScheduler withBrokenStore = new CollectionScheduler(brokenStore, mock(CollectorService.class),
                settings, true, Clock.fixed(NOW, ZoneOffset.UTC));
        try {
            withBrokenStore.start();

            verify(brokenStore, timeout(5000)).listReadySetupStates();
            awaitNextPass(withBrokenStore);
            assertThat(withBrokenStore.isRunning()).isTrue();
            assertThat(withBrokenStore.getStatus().getPassCount()).isZero();
        } finally {
            withBrokenStore.stop();
        }
        assertThat(withBrokenStore.getStatus().getNextPassAt()).isNull();
    }

    @Test
    void undecryptableCredentialIsSkipped() {
        long good = readyInstance("good");
        long broken = readyInstance("broken");
        store.saveInstance(store.findInstance(broken).orElseThrow().toBuilder()
                .passwordEnc(new byte[]{1, 2, 3})
                .build());
        connectionFor(good);

        CollectionScheduler.PassResult result = scheduler.runPass();

        assertThat(result.getCollected()).isEqualTo(1);
        assertThat(result.getSkipped()).isEqualTo(1);
        verify(connectionFactory, never()).open(argThat(i -> i.getId() == broken), anyString());
        assertThat(store.findSetupState(broken)).get()
                .extracting(SetupState::getLastCheckedAt)
                .isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void instancesThatAreNotReadyAreNotVisited() {
        long ready = readyInstance("ready");
        long pending = registeredInstance("pending");
        store.upsertSetupState(SetupState.builder()
                .instanceId(pending).ready(false).lastCheckedAt(EARLIER).build());
        connectionFor(ready);

        scheduler.runPass();

        verify(connectionFactory, never()).open(argThat(i -> i.getId() == pending), anyString());
        assertThat(store.findSetupState(pending)).get()
                .extracting(SetupState::getLastCheckedAt)
                .isEqualTo(EARLIER);
        assertThat(store.listSnapshots(ready)).hasSize(1);
    }

    @Test
    void startIsIdempotentAndStopIsFinal() {
        assertThat(scheduler.start()).isTrue();
        assertThat(scheduler.start()).isFalse();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.start()).isFalse();
    }

    @Test
    void disabledSchedulerDoesNotStartOnApplicationReady() {
        CollectionScheduler disabled = new CollectionScheduler(store, mock(CollectorService.class), settings, false,
                Clock.fixed(NOW, ZoneOffset.UTC));

        disabled.onApplicationReady();

        assertThat(disabled.isRunning()).isFalse();
        assertThat(disabled.getStatus().isEnabled()).isFalse();
    }

    @Test
    void statusReportsFlooredIntervalAndPasses() {
        CollectionScheduler fast = new CollectionScheduler(store, mock(CollectorService.class),
                CollectorSettings.builder().intervalSec(2).build(), true, Clock.fixed(NOW, ZoneOffset.UTC));

        fast.runPass();

        CollectionScheduler.SchedulerStatus status = fast.getStatus();
        assertThat(status.getIntervalSec()).isEqualTo(10);
        assertThat(status.getPassCount()).isEqualTo(1);
        assertThat(status.getLastPassFinishedAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(status.isRunning()).isFalse();
    }

    private static void awaitNextPass(CollectionScheduler handle) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!NEXT_PASS.equals(handle.getStatus().getNextPassAt()) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(handle.getStatus().getNextPassAt()).isEqualTo(NEXT_PASS);
    }

    private long registeredInstance(String name) {
        return store.saveInstance(Instance.builder()
                .name(name)
                .host(name + ".db")
                .dbname("app")
                .user("monitor")
                .passwordEnc(vault.encrypt("pw-" + name))
                .build()).getId();
    }

    private long readyInstance(String name) {
        long id = registeredInstance(name);
        store.upsertSetupState(SetupState.builder()
                .instanceId(id)
                .pgVersionNum(160002)
                .preloadOk(true)
                .extCreated(true)
                .ready(true)
                .lastCheckedAt(EARLIER)
                .build());
        return id;
    }

    private Connection connectionFor(long instanceId) {
        Connection conn = mock(Connection.class);
        when(connectionFactory.open(argThat(i -> i != null && i.getId() == instanceId), anyString())).thenReturn(conn);
        return conn;
    }
}
