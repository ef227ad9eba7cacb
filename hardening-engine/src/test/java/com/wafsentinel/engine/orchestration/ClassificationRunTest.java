package com.wafsentinel.engine.orchestration;

import com.wafsentinel.engine.alert.NotificationKind;
import com.wafsentinel.engine.alert.Notifier;
import com.wafsentinel.engine.classifier.ModelArtifact;
import com.wafsentinel.engine.classifier.TrafficClassifier;
import com.wafsentinel.engine.feature.FeatureExtractor;
import com.wafsentinel.engine.feature.FeatureSchema;
import com.wafsentinel.engine.feature.FeatureVector;
import com.wafsentinel.engine.ingest.LogFetcher;
import com.wafsentinel.engine.ingest.ResultWriter;
import com.wafsentinel.engine.record.BucketGranularity;
import com.wafsentinel.engine.record.TimeBucket;
import com.wafsentinel.engine.store.ClassifiedRecord;
import com.wafsentinel.engine.store.StoreRequestException;
import com.wafsentinel.engine.store.WriteOutcome;
import com.wafsentinel.engine.support.InMemoryAuditLogStore;
import com.wafsentinel.engine.support.InMemoryClassifiedStore;
import com.wafsentinel.engine.support.InMemoryCursorRepository;
import com.wafsentinel.engine.support.Records;
import com.wafsentinel.engine.support.RecordingChannel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationRunTest {

    private static final Instant NOW = Instant.parse("2025-06-19T06:10:00Z");
    private static final TimeBucket FOUR = Records.BUCKET;
    private static final TimeBucket FIVE = FOUR.next();
    private static final int POISON_SCORE = 666;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<ClassificationRun> runs = new ArrayList<>();

    private SimpleMeterRegistry registry;
    private InMemoryAuditLogStore auditStore;
    private InMemoryClassifiedStore classifiedStore;
    private InMemoryCursorRepository cursors;
    private RecordingChannel channel;
    private RunHistory history;

    /** Scores by rule count; refuses records carrying the poison anomaly score. */
    static ModelArtifact model(String schemaVersion) {
        return new ModelArtifact() {
            @Override
            public String modelVersion() {
                return "lr-test";
            }

            @Override
            public String featureSchemaVersion() {
                return schemaVersion;
            }

            @Override
            public double predict(FeatureVector vector) {
                if (vector.get("anomaly_score_total") == POISON_SCORE) {
                    throw new IllegalStateException("poisoned vector");
                }
                return vector.get("rules_total") > 0 ? 0.93 : 0.1;
            }
        };
    }

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        auditStore = new InMemoryAuditLogStore();
        classifiedStore = new InMemoryClassifiedStore();
        cursors = new InMemoryCursorRepository();
        channel = new RecordingChannel();
        history = new RunHistory(20);

        auditStore.add(Records.record(FOUR, "a", FOUR.start().plusSeconds(10), 10, "942100", "930100"));
        auditStore.add(Records.record(FOUR, "b", FOUR.start().plusSeconds(20), 0));
        auditStore.add(Records.record(FOUR, "c", FOUR.start().plusSeconds(30), 5, "942100"));
        auditStore.add(Records.record(FIVE, "d", FIVE.start().plusSeconds(40), 0));
    }

    @AfterEach
    void tearDown() {
        runs.forEach(ClassificationRun::shutdown);
    }

    private ClassificationRun pipeline(InMemoryClassifiedStore store, String schemaVersion) {
        Notifier notifier = new Notifier(List.of(channel), registry);
        notifier.init();
        LogFetcher fetcher = new LogFetcher(auditStore, cursors, BucketGranularity.HOURLY, Duration.ofMinutes(5),
                clock);
        TrafficClassifier classifier = new TrafficClassifier(model(schemaVersion), 0.5, registry);
        PipelineSettings settings = new PipelineSettings(2, 2, 3, Duration.ofMillis(1), Duration.ofHours(2));
        ClassificationRun run = new ClassificationRun(fetcher, new FeatureExtractor(), classifier,
                new ResultWriter(store, registry), notifier, history, settings, clock, registry);
        runs.add(run);
        return run;
    }

    private ClassificationRun pipeline() {
        return pipeline(classifiedStore, FeatureSchema.V1_VERSION);
    }

    @Test
    void shouldClassifyEverySealedBucketAndAdvanceCursor() {
        RunStatus status = pipeline().run();

        assertEquals(RunOutcome.SUCCEEDED, status.outcome());
        assertEquals(4, status.fetched());
        assertEquals(4, status.classified());
        assertEquals(0, status.skipped());
        assertEquals(FIVE.next().label(), cursors.current().bucket());
        assertNull(cursors.current().lastId());
        assertEquals(2, classifiedStore.all().stream().filter(c -> c.result().isMalicious()).count());
        assertEquals(status, history.latest(RunKind.CLASSIFICATION).orElseThrow());

        RunStatus again = pipeline().run();
        assertEquals(RunOutcome.SUCCEEDED, again.outcome());
        assertEquals(0, again.fetched());
        assertEquals(4, classifiedStore.creates());
    }

    @Test
    void shouldAbortAndKeepCursorWhenStoreStaysUnavailable() {
        auditStore.failNext(3);

        RunStatus status = pipeline().run();

        assertEquals(RunOutcome.ABORTED, status.outcome());
        assertEquals(3, auditStore.searches());
        assertNull(cursors.current());
        assertEquals(1, channel.count(NotificationKind.CLASSIFIER_ERROR));
        assertTrue(classifiedStore.all().isEmpty());
        assertEquals(1.0, registry.get("sentinel.runs").tag("outcome", "aborted").counter().count());
    }

    @Test
    void shouldRetryTransientFailuresWithinAttemptBudget() {
        auditStore.failNext(2);

        RunStatus status = pipeline().run();

        assertEquals(RunOutcome.SUCCEEDED, status.outcome());
        assertEquals(4, status.classified());
        assertEquals(0, channel.count(NotificationKind.CLASSIFIER_ERROR));
    }

    @Test
    void shouldNeitherDuplicateNorSkipAfterCrashBeforeCursorSave() {
        cursors.failNextSave();

        RunStatus crashed = pipeline().run();

        assertEquals(RunOutcome.FAILED, crashed.outcome());
        assertEquals(1, crashed.classified());
        assertNull(cursors.current());
        assertEquals(1, channel.count(NotificationKind.CLASSIFIER_ERROR));

        RunStatus restarted = pipeline().run();

        assertEquals(RunOutcome.SUCCEEDED, restarted.outcome());
        assertEquals(1, restarted.duplicates());
        assertEquals(3, restarted.classified());
        assertEquals(0, restarted.skipped());
        assertEquals(4, classifiedStore.creates());
        List<ClassifiedRecord> all = classifiedStore.all();
        assertEquals(4, new HashSet<>(all.stream().map(ClassifiedRecord::documentId).toList()).size());
    }

    @Test
    void shouldRefuseModelTrainedOnAnotherSchema() {
        RunStatus status = pipeline(classifiedStore, "waf-features/0").run();

        assertEquals(RunOutcome.FAILED, status.outcome());
        assertTrue(status.message().contains("waf-features/0"));
        assertEquals(0, auditStore.searches());
        assertNull(cursors.current());
        assertEquals(1, channel.count(NotificationKind.CLASSIFIER_ERROR));
    }

    @Test
    void shouldSkipUnclassifiableRecordAndMovePastIt() {
        auditStore.add(Records.record(FOUR, "bb", FOUR.start().plusSeconds(25), POISON_SCORE, "942100"));

        RunStatus status = pipeline().run();

        assertEquals(RunOutcome.SUCCEEDED, status.outcome());
        assertEquals(5, status.fetched());
        assertEquals(4, status.classified());
        assertEquals(1, status.skipped());
        assertEquals(1.0, registry.get("sentinel.pipeline.records.skipped").counter().count());
        assertEquals(FIVE.next().label(), cursors.current().bucket());
    }

    @Test
    void shouldSkipRecordRejectedByStore() {
        InMemoryClassifiedStore rejecting = new InMemoryClassifiedStore() {
            @Override
            public synchronized WriteOutcome createIfAbsent(TimeBucket bucket, ClassifiedRecord document) {
                if (document.record().id().equals("b")) {
                    throw new StoreRequestException("mapper_parsing_exception", 400, null);
                }
                return super.createIfAbsent(bucket, document);
            }
        };

        RunStatus status = pipeline(rejecting, FeatureSchema.V1_VERSION).run();

        assertEquals(RunOutcome.SUCCEEDED, status.outcome());
        assertEquals(3, status.classified());
        assertEquals(1, status.skipped());
        assertEquals(3, rejecting.all().size());
    }

    @Test
    void shouldStopBetweenRecordsWhenCancelledAndResumeFromLastCommit() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryClassifiedStore slow = new InMemoryClassifiedStore() {
            @Override
            public WriteOutcome createIfAbsent(TimeBucket bucket, ClassifiedRecord document) {
                if (document.record().id().equals("a")) {
                    writing.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.createIfAbsent(bucket, document);
            }
        };
        ClassificationRun run = pipeline(slow, FeatureSchema.V1_VERSION);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<RunStatus> inFlight = executor.submit(run::run);
            assertTrue(writing.await(5, TimeUnit.SECONDS));
            assertTrue(run.isRunning());

            assertTrue(run.cancel());
            release.countDown();
            RunStatus status = inFlight.get(5, TimeUnit.SECONDS);

            assertEquals(RunOutcome.CANCELLED, status.outcome());
            assertEquals(1, status.classified());
            assertEquals(FOUR.label(), cursors.current().bucket());
            assertEquals("a", cursors.current().lastId());
            assertFalse(run.isRunning());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        RunStatus resumed = pipeline(slow, FeatureSchema.V1_VERSION).run();

        assertEquals(RunOutcome.SUCCEEDED, resumed.outcome());
        assertEquals(3, resumed.classified());
        assertEquals(0, resumed.duplicates());
        assertEquals(4, slow.creates());
    }

    @Test
    void shouldReportNothingToCancelWhenIdle() {
        ClassificationRun run = pipeline();

        assertFalse(run.cancel());
        assertFalse(run.isRunning());
    }
}
