package com.wafsentinel.engine.orchestration;

import com.wafsentinel.engine.alert.NotificationEvent;
import com.wafsentinel.engine.alert.Notifier;
import com.wafsentinel.engine.classifier.Classification;
import com.wafsentinel.engine.classifier.ClassificationResult;
import com.wafsentinel.engine.classifier.SchemaMismatchException;
import com.wafsentinel.engine.classifier.TrafficClassifier;
import com.wafsentinel.engine.feature.FeatureExtractor;
import com.wafsentinel.engine.ingest.FetchBatch;
import com.wafsentinel.engine.ingest.FetchWindow;
import com.wafsentinel.engine.ingest.LogFetcher;
import com.wafsentinel.engine.ingest.RecordSequence;
import com.wafsentinel.engine.ingest.ResultWriter;
import com.wafsentinel.engine.record.AuditRecord;
import com.wafsentinel.engine.store.StoreRequestException;
import com.wafsentinel.engine.store.TransientIOException;
import com.wafsentinel.engine.store.WriteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * One pass of the ingestion pipeline: fetch, extract, classify, write, then
 * move the cursor.
 *
 * <p>
 * Records of a page are classified in parallel on a bounded pool; writes and
 * cursor moves happen on the calling thread, in record order, so the cursor
 * never passes a record whose classification is not stored yet. A record that
 * cannot be classified is skipped and the cursor moves past it.
 * </p>
 *
 * <p>
 * Fetches and writes are retried with exponential backoff on
 * {@link TransientIOException}; once the attempts are used up the run aborts,
 * sends a ClassifierError notification and leaves the cursor at the last
 * committed record. A feature schema the model does not accept aborts the run
 * before anything is written.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public class ClassificationRun {

    private static final Logger log = LoggerFactory.getLogger(ClassificationRun.class);

    private final LogFetcher fetcher;
    private final FeatureExtractor extractor;
    private final TrafficClassifier classifier;
    private final ResultWriter writer;
    private final Notifier notifier;
    private final RunHistory history;
    private final PipelineSettings settings;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ExecutorService workers;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private final Counter recordsSkipped;

    public ClassificationRun(LogFetcher fetcher, FeatureExtractor extractor, TrafficClassifier classifier,
            ResultWriter writer, Notifier notifier, RunHistory history, PipelineSettings settings, Clock clock,
            MeterRegistry meterRegistry) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.classifier = classifier;
        this.writer = writer;
        this.notifier = notifier;
        this.history = history;
        this.settings = settings;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.recordsSkipped = Counter.builder("sentinel.pipeline.records.skipped")
                .description("Records skipped because they could not be classified or stored")
                .register(meterRegistry);

        AtomicInteger threadId = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(settings.concurrency(), r -> {
            Thread t = new Thread(r, "classifier-" + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run the pipeline up to the last sealed bucket. Returns immediately with
     * {@link RunOutcome#SKIPPED} if a run is already in progress.
     */
    public RunStatus run() {
        String runId = "classification-" + UUID.randomUUID();
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            RunStatus skipped = RunStatus.skipped(runId, RunKind.CLASSIFICATION, startedAt,
                    "Classification run already in progress");
            history.record(skipped);
            return skipped;
        }

        cancelRequested.set(false);
        Progress progress = new Progress();
        RunOutcome outcome;
        String message;
        try {
            outcome = execute(progress);
            message = outcome == RunOutcome.CANCELLED ? "Cancelled on request" : "Completed";
        } catch (SchemaMismatchException e) {
            outcome = RunOutcome.FAILED;
            message = e.getMessage();
            log.error("Classification run {} refused: {}", runId, message);
            notifier.notify(NotificationEvent.classifierError(runId, message, clock.instant()));
        } catch (TransientIOException e) {
            outcome = RunOutcome.ABORTED;
            message = "Store unavailable after " + settings.maxAttempts() + " attempt(s): " + e.getMessage();
            log.error("Classification run {} aborted: {}", runId, message);
            notifier.notify(NotificationEvent.classifierError(runId, message, clock.instant()));
        } catch (RuntimeException e) {
            outcome = RunOutcome.FAILED;
            message = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Classification run {} failed", runId, e);
            notifier.notify(NotificationEvent.classifierError(runId, message, clock.instant()));
        } finally {
            running.set(false);
        }

        meterRegistry.counter("sentinel.runs", "kind", "classification", "outcome", outcome.name().toLowerCase(Locale.ROOT))
                .increment();
        RunStatus status = new RunStatus(runId, RunKind.CLASSIFICATION, startedAt, clock.instant(), outcome,
                progress.fetched, progress.classified, progress.duplicates, progress.skipped, message);
        history.record(status);
        return status;
    }

    /**
     * Ask the running pass to stop before its next record.
     *
     * @return whether a run was in progress
     */
    public boolean cancel() {
        if (!running.get()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Cancellation of the classification run requested");
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    private RunOutcome execute(Progress progress) {
        if (!classifier.featureSchemaVersion().equals(extractor.schemaVersion())) {
            throw new SchemaMismatchException(classifier.featureSchemaVersion(), extractor.schemaVersion());
        }

        fetcher.reload();
        Instant now = clock.instant();
        FetchWindow window = new FetchWindow(now.minus(settings.initialLookback()), now);
        RecordSequence sequence = withRetry("fetch", () -> fetcher.fetch(window));

        while (true) {
            if (cancelRequested.get()) {
                return RunOutcome.CANCELLED;
            }
            FetchBatch batch = withRetry("fetch", () -> sequence.nextBatch(settings.batchSize()));
            if (batch.isEnd()) {
                return RunOutcome.SUCCEEDED;
            }
            progress.fetched += batch.records().size();

            List<Future<Optional<ClassificationResult>>> verdicts = new ArrayList<>();
            for (AuditRecord record : batch.records()) {
                verdicts.add(workers.submit(() -> classify(record)));
            }

            for (int i = 0; i < batch.records().size(); i++) {
                if (cancelRequested.get()) {
                    verdicts.forEach(f -> f.cancel(true));
                    return RunOutcome.CANCELLED;
                }
                AuditRecord record = batch.records().get(i);
                Optional<ClassificationResult> verdict = await(verdicts.get(i));
                if (verdict.isPresent()) {
                    commit(record, verdict.get(), progress);
                } else {
                    progress.skipped++;
                }
                fetcher.advance(record);
            }

            if (batch.bucketExhausted()) {
                fetcher.completeBucket(batch.bucket());
            }
        }
    }

    private Optional<ClassificationResult> classify(AuditRecord record) {
        try {
            Classification classification = classifier.classify(extractor.extract(record));
            return Optional.of(new ClassificationResult(record.id(), classification.label(),
                    classification.confidence(), classifier.modelVersion(), clock.instant()));
        } catch (SchemaMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            recordsSkipped.increment();
            log.warn("Skipping record {}/{}: {}", record.bucket(), record.id(), e.getMessage());
            return Optional.empty();
        }
    }

    private void commit(AuditRecord record, ClassificationResult result, Progress progress) {
        try {
            WriteOutcome outcome = withRetry("write", () -> writer.write(record, result));
            if (outcome == WriteOutcome.CREATED) {
                progress.classified++;
            } else {
                progress.duplicates++;
            }
        } catch (StoreRequestException e) {
            recordsSkipped.increment();
            progress.skipped++;
            log.warn("Store rejected classification of {}/{} (HTTP {}), skipping: {}",
                    record.bucket(), record.id(), e.getStatus(), e.getMessage());
        }
    }

    private <T> T withRetry(String operation, Supplier<T> call) {
        return Mono.fromSupplier(call)
                .retryWhen(Retry.backoff(settings.maxAttempts() - 1L, settings.initialBackoff())
                        .filter(TransientIOException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("{} failed (attempt {}/{}), retrying: {}",
                                operation, signal.totalRetries() + 1, settings.maxAttempts(),
                                signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .block();
    }

    private static Optional<ClassificationResult> await(Future<Optional<ClassificationResult>> verdict) {
        try {
            return verdict.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a classification", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Classification failed", e.getCause());
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down classification workers");
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private static final class Progress {
        long fetched;
        long classified;
        long duplicates;
        long skipped;
    }
}
