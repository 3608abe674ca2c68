package com.haulage.tickets.service;

import com.haulage.tickets.dto.BatchPolicy;
import com.haulage.tickets.dto.BatchRunResult;
import com.haulage.tickets.dto.FileOutcome;
import com.haulage.tickets.dto.RunCounts;
import com.haulage.tickets.entity.FileState;
import com.haulage.tickets.entity.RunStatus;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.exception.StateConflictException;
import com.haulage.tickets.exception.TerminalInfraException;
import com.haulage.tickets.exception.TicketProcessingException;
import com.haulage.tickets.exception.TransientInfraException;
import com.haulage.tickets.repository.DryRunTicketStore;
import com.haulage.tickets.repository.TicketStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Drives a batch run: discovers source files, processes them on a bounded
 * worker pool, applies retry and rollback policy and keeps the run ledger
 * current.
 * <p>
 * Key Design Decisions:
 * 1. Single writer: workers return a {@link FileOutcome}; only the dispatching
 *    thread applies outcomes to the counters and the ledger
 * 2. Sliding dispatch: at most {@code workers} files are in flight, so a
 *    cancellation or a stop-on-error takes effect before the next file starts
 * 3. Clean retries: partial writes of a failed attempt are discarded before
 *    the file is attempted again
 * 4. Abort: a terminal infrastructure failure stops dispatching and, if the
 *    policy says so, rolls back everything the run wrote
 */
@Service
@Slf4j
public class BatchOrchestrator {

    private static final Duration ATTEMPT_GRACE = Duration.ofSeconds(5);

    private final TicketPageProcessor pageProcessor;
    private final TicketStore store;
    private final RunLedger ledger;
    private final DuplicateDetector duplicateDetector;
    private final MeterRegistry meterRegistry;

    private final Map<String, AtomicBoolean> activeRuns = new ConcurrentHashMap<>();
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private final ExecutorService runLauncher = new MdcAwareThreadPoolExecutor(1, "ticket-run");

    private final Map<FileState, Counter> fileCounters = new EnumMap<>(FileState.class);
    private Counter retryCounter;
    private Timer runTimer;

    public BatchOrchestrator(TicketPageProcessor pageProcessor,
                             TicketStore store,
                             RunLedger ledger,
                             DuplicateDetector duplicateDetector,
                             MeterRegistry meterRegistry) {
        this.pageProcessor = pageProcessor;
        this.store = store;
        this.ledger = ledger;
        this.duplicateDetector = duplicateDetector;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        for (FileState state : List.of(FileState.SUCCEEDED, FileState.FAILED_TERMINAL, FileState.SKIPPED)) {
            fileCounters.put(state, Counter.builder("tickets.files.processed")
                    .description("Source files by final state")
                    .tag("state", state.name())
                    .register(meterRegistry));
        }

        retryCounter = Counter.builder("tickets.files.retries")
                .description("File attempts retried after a transient failure")
                .register(meterRegistry);

        runTimer = Timer.builder("tickets.run.duration")
                .description("Time taken to complete a batch run")
                .register(meterRegistry);
    }

    @PreDestroy
    public void shutdown() {
        runLauncher.shutdownNow();
    }

    /**
     * Runs a batch to completion on the calling thread.
     */
    public BatchRunResult run(Path input, String jobId, BatchPolicy policy) {
        return execute(prepare(input, jobId, policy));
    }

    /**
     * Starts a batch in the background.
     *
     * @return id of the run, already recorded in the ledger
     */
    public String submit(Path input, String jobId, BatchPolicy policy) {
        PreparedRun prepared = prepare(input, jobId, policy);
        try {
            runLauncher.execute(() -> execute(prepared));
        } catch (RuntimeException e) {
            release(prepared.context.getRunId());
            ledger.fail(prepared.context.getRunId(), "Run could not be launched: " + e.getMessage());
            throw e;
        }
        return prepared.context.getRunId();
    }

    /**
     * Stops dispatching new files for the run. Files already in flight finish
     * or time out; the rest are counted as skipped.
     *
     * @throws ResourceNotFoundException if the run is unknown
     * @throws StateConflictException      if the run already finished or was cancelled
     */
    public void cancel(String runId) {
        AtomicBoolean cancelled = activeRuns.get(runId);
        if (cancelled == null) {
            if (ledger.find(runId).isPresent()) {
                throw new StateConflictException("Run " + runId + " is not in progress");
            }
            throw new ResourceNotFoundException("Run not found: " + runId);
        }
        if (!cancelled.compareAndSet(false, true)) {
            throw new StateConflictException("Run " + runId + " is already cancelled");
        }
        log.info("Cancellation requested for run {}", runId);
    }

    public boolean isActive(String runId) {
        return activeRuns.containsKey(runId);
    }

    public boolean isRunInProgress() {
        return isRunning.get();
    }

    private PreparedRun prepare(Path input, String jobId, BatchPolicy policy) {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Batch run already in progress, rejecting new run");
            throw new StateConflictException("A batch run is already in progress");
        }

        try {
            List<Path> files = discoverFiles(input, policy.getFilePattern());
            Path inputRoot = Files.isDirectory(input) ? input : input.toAbsolutePath().getParent();

            Map<String, Object> snapshot = new LinkedHashMap<>(policy.toSnapshot());
            snapshot.put("input", input.toString());
            snapshot.put("jobId", jobId);
            snapshot.put("duplicateWindowDays", duplicateDetector.getWindowDays());
            snapshot.put("files", files.size());

            String runId = ledger.start(jobId, snapshot);
            activeRuns.put(runId, new AtomicBoolean(false));

            TicketStore runStore = policy.isDryRun() ? new DryRunTicketStore(store) : store;
            RunContext context = RunContext.builder()
                    .runId(runId)
                    .jobId(jobId)
                    .policy(policy)
                    .inputRoot(inputRoot)
                    .store(runStore)
                    .build();
            return new PreparedRun(context, files);
        } catch (RuntimeException e) {
            isRunning.set(false);
            throw e;
        }
    }

    private BatchRunResult execute(PreparedRun prepared) {
        String runId = prepared.context.getRunId();
        MDC.put("runId", runId);
        try {
            return runTimer.record(() -> processFiles(prepared));
        } finally {
            release(runId);
            MDC.remove("runId");
        }
    }

    private void release(String runId) {
        activeRuns.remove(runId);
        isRunning.set(false);
    }

    private BatchRunResult processFiles(PreparedRun prepared) {
        RunContext context = prepared.context;
        BatchPolicy policy = context.getPolicy();
        String runId = context.getRunId();
        AtomicBoolean cancelled = activeRuns.get(runId);
        LocalDateTime startedAt = LocalDateTime.now();

        log.info("Run {} processing {} files with {} workers (dryRun={}, reprocess={})",
                runId, prepared.files.size(), policy.getWorkers(), policy.isDryRun(), policy.isReprocess());

        ExecutorService workers = new MdcAwareThreadPoolExecutor(policy.getWorkers(), "ticket-worker");
        ExecutorService attempts = new MdcAwareThreadPoolExecutor(policy.getWorkers() * 2, "ticket-attempt");
        CompletionService<FileOutcome> completion = new ExecutorCompletionService<>(workers);
        Map<Future<FileOutcome>, Path> inFlight = new HashMap<>();
        Iterator<Path> pending = prepared.files.iterator();

        RunCounts totals = RunCounts.ZERO;
        List<FileOutcome> outcomes = new ArrayList<>();
        TerminalInfraException abort = null;
        boolean ledgerWritable = true;
        String stopReason = null;
        boolean interrupted = false;
        List<String> abandoned = new ArrayList<>();

        try {
            while (inFlight.size() < policy.getWorkers() && pending.hasNext()) {
                dispatch(completion, inFlight, context, pending.next(), attempts);
            }

            while (!inFlight.isEmpty()) {
                Future<FileOutcome> done = completion.take();
                Path file = inFlight.remove(done);

                FileOutcome outcome;
                try {
                    outcome = done.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof TerminalInfraException) {
                        if (abort == null) {
                            abort = (TerminalInfraException) cause;
                            stopReason = "Aborted: " + cause.getMessage();
                        }
                        log.error("Terminal failure while processing {}, aborting run {}: {}",
                                context.sourceKey(file), runId, cause.getMessage());
                    } else {
                        log.error("Unexpected failure while processing {}", context.sourceKey(file), cause);
                    }
                    outcome = failedOutcome(context.sourceKey(file), 0, cause, 0);
                }

                outcomes.add(outcome);
                totals = totals.plus(outcome.getCounts());
                Counter counter = fileCounters.get(outcome.getState());
                if (counter != null) {
                    counter.increment();
                }

                if (ledgerWritable) {
                    try {
                        ledger.update(runId, outcome.getCounts());
                    } catch (TerminalInfraException e) {
                        ledgerWritable = false;
                        if (abort == null) {
                            abort = e;
                            stopReason = "Aborted: " + e.getMessage();
                        }
                    } catch (RuntimeException e) {
                        // finish() writes the full totals, a missed delta is recovered there
                        log.warn("Could not record progress of {} in run {}: {}",
                                outcome.getSourceFile(), runId, e.getMessage());
                    }
                }

                if (stopReason == null && !outcome.isSucceeded() && !policy.isContinueOnError()) {
                    stopReason = "Stopped after failure of " + outcome.getSourceFile();
                    log.warn("Run {} stops dispatching: {} failed and continueOnError is off",
                            runId, outcome.getSourceFile());
                }
                if (stopReason == null && cancelled != null && cancelled.get()) {
                    stopReason = "Cancelled";
                    log.info("Run {} cancelled, {} files in flight will finish", runId, inFlight.size());
                }

                if (stopReason == null && pending.hasNext()) {
                    dispatch(completion, inFlight, context, pending.next(), attempts);
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            stopReason = "Interrupted";
            log.warn("Run {} interrupted with {} files in flight", runId, inFlight.size());
            for (Map.Entry<Future<FileOutcome>, Path> entry : inFlight.entrySet()) {
                entry.getKey().cancel(true);
                String key = context.sourceKey(entry.getValue());
                abandoned.add(key);
                FileOutcome outcome = failedOutcome(key, 0, e, 0);
                outcomes.add(outcome);
                totals = totals.plus(outcome.getCounts());
            }
        } finally {
            workers.shutdownNow();
            attempts.shutdownNow();
        }

        if (!abandoned.isEmpty()) {
            awaitTermination(workers, runId);
            awaitTermination(attempts, runId);
            for (String key : abandoned) {
                discardPartialWrites(context, key);
            }
        }

        int skipped = 0;
        while (pending.hasNext()) {
            Path file = pending.next();
            outcomes.add(FileOutcome.builder()
                    .sourceFile(context.sourceKey(file))
                    .state(FileState.SKIPPED)
                    .counts(RunCounts.builder().files(1).filesSkipped(1).build())
                    .build());
            skipped++;
        }
        if (skipped > 0) {
            totals = totals.plus(RunCounts.builder().files(skipped).filesSkipped(skipped).build());
            fileCounters.get(FileState.SKIPPED).increment(skipped);
            log.info("Run {} skipped {} undispatched files", runId, skipped);
        }

        boolean wasCancelled = cancelled != null && cancelled.get();
        boolean rolledBack = false;
        RunStatus status;
        if (abort != null) {
            if (policy.isRollbackOnCritical()) {
                rolledBack = rollback(context);
                status = RunStatus.FAILED;
            } else {
                status = RunStatus.PARTIAL;
            }
        } else {
            status = resolveStatus(totals, wasCancelled);
        }

        if (context.getStore() instanceof DryRunTicketStore) {
            DryRunTicketStore dryRun = (DryRunTicketStore) context.getStore();
            log.info("Dry run {} buffered {} tickets, {} review entries, {} duplicate links; nothing persisted",
                    runId, dryRun.getBufferedTickets().size(), dryRun.getBufferedReviewEntries().size(),
                    dryRun.getBufferedLinks().size());
        }

        String errorMessage = stopReason;
        if (rolledBack) {
            errorMessage = stopReason + " (rolled back)";
        }
        finishInLedger(runId, status, totals, errorMessage);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        return BatchRunResult.builder()
                .runId(runId)
                .jobId(context.getJobId())
                .status(status)
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now())
                .counts(totals)
                .fileOutcomes(outcomes)
                .cancelled(wasCancelled)
                .rolledBack(rolledBack)
                .abortReason(abort == null ? null : abort.getMessage())
                .build();
    }

    private void finishInLedger(String runId, RunStatus status, RunCounts totals, String errorMessage) {
        try {
            ledger.finish(runId, status, totals, errorMessage);
        } catch (RuntimeException e) {
            log.error("Could not finalize run {} as {}: {}", runId, status, e.getMessage());
            try {
                ledger.fail(runId, "Ledger finalization failed: " + e.getMessage());
            } catch (RuntimeException failure) {
                log.error("Run {} left unfinalized in the ledger: {}", runId, failure.getMessage());
            }
        }
    }

    private void awaitTermination(ExecutorService pool, String runId) {
        try {
            if (!pool.awaitTermination(ATTEMPT_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run {} pool did not stop within {}s", runId, ATTEMPT_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(CompletionService<FileOutcome> completion, Map<Future<FileOutcome>, Path> inFlight,
                          RunContext context, Path file, ExecutorService attempts) {
        Future<FileOutcome> future = completion.submit(() -> processFile(context, file, attempts));
        inFlight.put(future, file);
    }

    /**
     * Processes one file with retries. Runs on a worker thread.
     *
     * @throws TerminalInfraException if the run must be aborted
     */
    FileOutcome processFile(RunContext context, Path file, ExecutorService attempts) {
        String key = context.sourceKey(file);
        BatchPolicy policy = context.getPolicy();
        MDC.put("file", key);
        long start = System.nanoTime();
        AtomicInteger attemptCount = new AtomicInteger();

        try {
            RunCounts pages = retryTemplate(policy).execute((RetryContext retry) -> {
                if (retry.getRetryCount() > 0) {
                    retryCounter.increment();
                    log.warn("Retrying {} (attempt {}/{}) after: {}", key, retry.getRetryCount() + 1,
                            policy.maxAttempts(), retry.getLastThrowable().getMessage());
                    context.getStore().discardFile(context.getRunId(), key);
                }
                attemptCount.incrementAndGet();
                return attemptWithTimeout(context, file, key, attempts);
            });

            return FileOutcome.builder()
                    .sourceFile(key)
                    .state(FileState.SUCCEEDED)
                    .attempts(attemptCount.get())
                    .counts(pages.plus(RunCounts.builder().files(1).filesSucceeded(1).build()))
                    .durationMs(elapsedMs(start))
                    .build();
        } catch (TerminalInfraException e) {
            throw e;
        } catch (TransientInfraException e) {
            log.error("Giving up on {} after {} attempts: {}", key, attemptCount.get(), e.getMessage());
            discardPartialWrites(context, key);
            return failedOutcome(key, attemptCount.get(), e, elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("Terminal failure processing {}: {}", key, e.getMessage());
            discardPartialWrites(context, key);
            return failedOutcome(key, attemptCount.get(), e, elapsedMs(start));
        } finally {
            MDC.remove("file");
        }
    }

    /**
     * Runs one attempt, treating a timeout as a transient failure. A timed-out
     * attempt is interrupted and given a short grace period to stop writing
     * before the caller discards its partial writes.
     */
    private RunCounts attemptWithTimeout(RunContext context, Path file, String key, ExecutorService attempts) {
        CountDownLatch finished = new CountDownLatch(1);
        Future<RunCounts> attempt = attempts.submit(() -> {
            try {
                return pageProcessor.processFile(context, file);
            } finally {
                finished.countDown();
            }
        });

        Duration timeout = context.getPolicy().getFileTimeout();
        try {
            return attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            awaitStop(finished, key);
            throw new TransientInfraException("Processing timed out after " + timeout.toSeconds() + "s", key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new TicketProcessingException("Processing of " + key + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            throw new TicketProcessingException("Interrupted while processing " + key, e);
        }
    }

    private void awaitStop(CountDownLatch finished, String key) {
        try {
            if (!finished.await(ATTEMPT_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed-out attempt on {} did not stop within {}s", key, ATTEMPT_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void discardPartialWrites(RunContext context, String key) {
        try {
            context.getStore().discardFile(context.getRunId(), key);
        } catch (TransientInfraException e) {
            log.error("Could not discard partial writes of {} in run {}: {}",
                    key, context.getRunId(), e.getMessage());
        }
    }

    private boolean rollback(RunContext context) {
        try {
            int undone = context.getStore().rollbackRun(context.getRunId());
            log.warn("Run {} rolled back, {} records undone", context.getRunId(), undone);
            return true;
        } catch (TicketProcessingException e) {
            log.error("Rollback of run {} failed: {}", context.getRunId(), e.getMessage());
            return false;
        }
    }

    private RetryTemplate retryTemplate(BatchPolicy policy) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(policy.maxAttempts(),
                Map.of(TransientInfraException.class, true), false));
        template.setBackOffPolicy(new LinearBackOffPolicy(policy.getBackoffBase()));
        return template;
    }

    static RunStatus resolveStatus(RunCounts totals, boolean cancelled) {
        if (cancelled && totals.getFilesSkipped() > 0) {
            return RunStatus.PARTIAL;
        }
        if (totals.getFilesSucceeded() == totals.getFiles()) {
            return RunStatus.COMPLETED;
        }
        return totals.getFilesSucceeded() > 0 ? RunStatus.PARTIAL : RunStatus.FAILED;
    }

    static List<Path> discoverFiles(Path input, String pattern) {
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new IllegalArgumentException("Input path does not exist or is not a directory: " + input);
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> walk = Files.walk(input)) {
            return walk.filter(Files::isRegularFile)
                    .filter(path -> matcher.matches(path.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TicketProcessingException("Cannot list input directory " + input, e);
        }
    }

    private static FileOutcome failedOutcome(String key, int attempts, Throwable cause, long durationMs) {
        return FileOutcome.builder()
                .sourceFile(key)
                .state(FileState.FAILED_TERMINAL)
                .attempts(attempts)
                .counts(RunCounts.builder().files(1).filesFailed(1).build())
                .errorMessage(cause == null ? null : cause.getMessage())
                .durationMs(durationMs)
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static class PreparedRun {
        private final RunContext context;
        private final List<Path> files;

        PreparedRun(RunContext context, List<Path> files) {
            this.context = context;
            this.files = files;
        }
    }
}
