package com.haulage.tickets.service;

import com.haulage.tickets.dto.BatchPolicy;
import com.haulage.tickets.dto.BatchRunResult;
import com.haulage.tickets.dto.FileOutcome;
import com.haulage.tickets.dto.RunCounts;
import com.haulage.tickets.entity.FileState;
import com.haulage.tickets.entity.PageOutcome;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.RunStatus;
import com.haulage.tickets.exception.MalformedSourceException;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.exception.StateConflictException;
import com.haulage.tickets.exception.TerminalInfraException;
import com.haulage.tickets.exception.TransientInfraException;
import com.haulage.tickets.repository.DryRunTicketStore;
import com.haulage.tickets.repository.TicketStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BatchOrchestrator.
 *
 * Tests cover:
 * - Aggregation of file outcomes into run totals
 * - Retry of transient failures and discarding of partial writes
 * - Abort with and without rollback
 * - Stop-on-error, cancellation and the single-run guard
 * - Per-attempt timeouts
 */
@ExtendWith(MockitoExtension.class)
class BatchOrchestratorTest {

    private static final String RUN_ID = "run-1";

    @Mock
    private TicketPageProcessor pageProcessor;

    @Mock
    private TicketStore store;

    @Mock
    private RunLedger ledger;

    @Mock
    private DuplicateDetector duplicateDetector;

    @TempDir
    Path input;

    private SimpleMeterRegistry meterRegistry;
    private BatchOrchestrator orchestrator;

    private final RunCounts onePageCreated = RunCounts.forPage(PageOutcome.CREATED, 0);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new BatchOrchestrator(pageProcessor, store, ledger, duplicateDetector, meterRegistry);
        orchestrator.initMetrics();

        lenient().when(ledger.start(any(), any())).thenReturn(RUN_ID);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private BatchPolicy.BatchPolicyBuilder policy() {
        return BatchPolicy.builder()
                .workers(2)
                .maxRetries(2)
                .backoffBase(Duration.ZERO)
                .fileTimeout(Duration.ofSeconds(10));
    }

    private Path file(String name) throws IOException {
        return Files.writeString(input.resolve(name), "ticket_number: T1");
    }

    private RunCounts finishedTotals(RunStatus status) {
        ArgumentCaptor<RunCounts> captor = ArgumentCaptor.forClass(RunCounts.class);
        verify(ledger).finish(eq(RUN_ID), eq(status), captor.capture(), any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Successful Run Tests")
    class SuccessfulRunTests {

        @Test
        @DisplayName("All files succeed: COMPLETED with aggregated totals and one ledger update per file")
        void allFilesSucceed() throws IOException {
            // Given
            file("a.pdf");
            file("b.pdf");
            file("c.pdf");
            file("notes.txt");
            when(pageProcessor.processFile(any(), any())).thenReturn(onePageCreated);

            // When
            BatchRunResult result = orchestrator.run(input, "24-105", policy().build());

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.getExitCode()).isZero();
            assertThat(result.getCounts().getFiles()).isEqualTo(3);
            assertThat(result.getCounts().getFilesSucceeded()).isEqualTo(3);
            assertThat(result.getCounts().getTicketsCreated()).isEqualTo(3);
            assertThat(result.getFileOutcomes()).extracting(FileOutcome::getSourceFile)
                    .containsExactlyInAnyOrder("a.pdf", "b.pdf", "c.pdf");

            verify(ledger, times(3)).update(eq(RUN_ID), any());
            assertThat(finishedTotals(RunStatus.COMPLETED).getPages()).isEqualTo(3);
            assertThat(orchestrator.isRunInProgress()).isFalse();
            assertThat(meterRegistry.counter("tickets.files.processed", "state", "SUCCEEDED").count())
                    .isEqualTo(3.0);
        }

        @Test
        @DisplayName("Empty input completes with zero files")
        void emptyInput() {
            BatchRunResult result = orchestrator.run(input, null, policy().build());

            assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
            assertThat(result.getCounts().getFiles()).isZero();
        }

        @Test
        @DisplayName("Dry run hands the processor a buffering store")
        void dryRunUsesOverlay() throws IOException {
            file("a.pdf");
            when(pageProcessor.processFile(any(), any())).thenReturn(onePageCreated);

            orchestrator.run(input, null, policy().dryRun(true).build());

            ArgumentCaptor<RunContext> captor = ArgumentCaptor.forClass(RunContext.class);
            verify(pageProcessor).processFile(captor.capture(), any());
            assertThat(captor.getValue().getStore())
                    .isInstanceOf(DryRunTicketStore.class);
        }
    }

    @Nested
    @DisplayName("Retry Tests")
    class RetryTests {

        @Test
        @DisplayName("Transient failure is retried after discarding the attempt's writes")
        void transientThenSuccess() throws IOException {
            // Given
            Path a = file("a.pdf");
            when(pageProcessor.processFile(any(), eq(a)))
                    .thenThrow(new TransientInfraException("extraction service busy", "a.pdf"))
                    .thenReturn(onePageCreated);

            // When
            BatchRunResult result = orchestrator.run(input, null, policy().build());

            // Then
            FileOutcome outcome = result.getFileOutcomes().get(0);
            assertThat(outcome.getState()).isEqualTo(FileState.SUCCEEDED);
            assertThat(outcome.getAttempts()).isEqualTo(2);
            assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
            verify(store, times(1)).discardFile(RUN_ID, "a.pdf");
            assertThat(meterRegistry.counter("tickets.files.retries").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Retries are bounded; the exhausted file fails and its writes are discarded")
        void retriesExhausted() throws IOException {
            // Given
            Path a = file("a.pdf");
            when(pageProcessor.processFile(any(), eq(a)))
                    .thenThrow(new TransientInfraException("extraction service down", "a.pdf"));

            // When
            BatchRunResult result = orchestrator.run(input, null, policy().build());

            // Then
            FileOutcome outcome = result.getFileOutcomes().get(0);
            assertThat(outcome.getState()).isEqualTo(FileState.FAILED_TERMINAL);
            assertThat(outcome.getAttempts()).isEqualTo(3);
            assertThat(outcome.getErrorMessage()).isEqualTo("extraction service down");
            assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
            verify(pageProcessor, times(3)).processFile(any(), eq(a));
            verify(store, times(3)).discardFile(RUN_ID, "a.pdf");
        }

        @Test
        @DisplayName("Malformed file is not retried and does not stop the others")
        void malformedNotRetried() throws IOException {
            // Given
            Path a = file("a.pdf");
            Path b = file("b.pdf");
            when(pageProcessor.processFile(any(), eq(a)))
                    .thenThrow(new MalformedSourceException("Empty file", "a.pdf"));
            when(pageProcessor.processFile(any(), eq(b))).thenReturn(onePageCreated);

            // When
            BatchRunResult result = orchestrator.run(input, null, policy().build());

            // Then
            verify(pageProcessor, times(1)).processFile(any(), eq(a));
            assertThat(result.getStatus()).isEqualTo(RunStatus.PARTIAL);
            assertThat(result.getExitCode()).isEqualTo(2);
            assertThat(result.getCounts().getFilesFailed()).isEqualTo(1);
            assertThat(result.getCounts().getFilesSucceeded()).isEqualTo(1);
        }

        @Test
        @DisplayName("Attempt exceeding the file timeout fails as transient")
        void attemptTimesOut() throws IOException {
            // Given
            file("a.pdf");
            when(pageProcessor.processFile(any(), any())).thenAnswer(inv -> {
                Thread.sleep(10_000);
                return onePageCreated;
            });

            // When
            BatchRunResult result = orchestrator.run(input, null,
                    policy().maxRetries(0).fileTimeout(Duration.ofMillis(200)).build());

            // Then
            FileOutcome outcome = result.getFileOutcomes().get(0);
            assertThat(outcome.getState()).isEqualTo(FileState.FAILED_TERMINAL);
            assertThat(outcome.getErrorMessage()).contains("timed out");
            assertThat(outcome.getDurationMs()).isLessThan(5_000);
        }
    }

    @Nested
    @DisplayName("Abort Tests")
    class AbortTests {

        @Test
        @DisplayName("Terminal failure aborts the run, skips the rest and rolls back")
        void terminalAbortWithRollback() throws IOException {
            // Given
            Path a = file("a.pdf");
            file("b.pdf");
            file("c.pdf");
            when(pageProcessor.processFile(any(), eq(a)))
                    .thenThrow(new TerminalInfraException("database unreachable"));
            when(store.rollbackRun(RUN_ID)).thenReturn(4);

            // When
            BatchRunResult result = orchestrator.run(input, null, policy().workers(1).build());

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(result.isRolledBack()).isTrue();
            assertThat(result.getAbortReason()).isEqualTo("database unreachable");
            assertThat(result.getCounts().getFilesSkipped()).isEqualTo(2);
            verify(pageProcessor, times(1)).processFile(any(), any());
            verify(store).rollbackRun(RUN_ID);
            verify(ledger).finish(eq(RUN_ID), eq(RunStatus.FAILED), any(),
                    eq("Aborted: database unreachable (rolled back)"));
        }

        @Test
        @DisplayName("Terminal failure without rollback keeps completed work as PARTIAL")
        void terminalAbortWithoutRollback() throws IOException {
            // Given
            Path a = file("a.pdf");
            Path b = file("b.pdf");
            file("c.pdf");
            when(pageProcessor.processFile(any(), eq(a))).thenReturn(onePageCreated);
            when(pageProcessor.processFile(any(), eq(b)))
                    .thenThrow(new TerminalInfraException("database unreachable"));

            // When
            BatchRunResult result = orchestrator.run(input, null,
                    policy().workers(1).rollbackOnCritical(false).build());

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.PARTIAL);
            assertThat(result.isRolledBack()).isFalse();
            assertThat(result.getCounts().getFilesSucceeded()).isEqualTo(1);
            assertThat(result.getCounts().getFilesSkipped()).isEqualTo(1);
            verify(store, never()).rollbackRun(anyString());
        }

        @Test
        @DisplayName("Stop-on-error stops dispatching after the first failed file")
        void stopOnError() throws IOException {
            // Given
            Path a = file("a.pdf");
            file("b.pdf");
            file("c.pdf");
            when(pageProcessor.processFile(any(), eq(a)))
                    .thenThrow(new MalformedSourceException("Empty file", "a.pdf"));

            // When
            BatchRunResult result = orchestrator.run(input, null,
                    policy().workers(1).continueOnError(false).build());

            // Then
            assertThat(result.getCounts().getFilesFailed()).isEqualTo(1);
            assertThat(result.getCounts().getFilesSkipped()).isEqualTo(2);
            assertThat(result.getStatus()).isEqualTo(RunStatus.FAILED);
            assertThat(result.getFileOutcomes()).filteredOn(o -> o.getState() == FileState.SKIPPED)
                    .extracting(FileOutcome::getSourceFile)
                    .containsExactly("b.pdf", "c.pdf");
        }
    }

    @Nested
    @DisplayName("Ledger Failure Tests")
    class LedgerFailureTests {

        @Test
        @DisplayName("Transient ledger failure on a progress update: run still finishes with full totals")
        void transientLedgerUpdateDoesNotKillRun() throws IOException {
            // Given
            file("a.pdf");
            file("b.pdf");
            when(pageProcessor.processFile(any(), any())).thenReturn(onePageCreated);
            when(ledger.update(eq(RUN_ID), any()))
                    .thenThrow(new TransientInfraException("lock timeout", null));

            // When
            BatchRunResult result = orchestrator.run(input, "24-105", policy().build());

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
            RunCounts totals = finishedTotals(RunStatus.COMPLETED);
            assertThat(totals.getFiles()).isEqualTo(2);
            assertThat(totals.getFilesSucceeded()).isEqualTo(2);
            assertThat(totals.getTicketsCreated()).isEqualTo(2);
        }

        @Test
        @DisplayName("Failed finalization falls back to marking the run failed")
        void failedFinishFallsBackToFail() throws IOException {
            // Given
            file("a.pdf");
            when(pageProcessor.processFile(any(), any())).thenReturn(onePageCreated);
            when(ledger.finish(eq(RUN_ID), any(), any(), any()))
                    .thenThrow(new TransientInfraException("connection reset", null));

            // When
            BatchRunResult result = orchestrator.run(input, "24-105", policy().build());

            // Then
            assertThat(result.getStatus()).isEqualTo(RunStatus.COMPLETED);
            verify(ledger).fail(eq(RUN_ID), contains("connection reset"));
        }
    }

    @Nested
    @DisplayName("Interruption Tests")
    class InterruptionTests {

        @Test
        @DisplayName("Interrupted run discards partial writes of in-flight files and still finishes")
        void interruptedRunDiscardsInFlightFiles() throws Exception {
            // Given
            file("a.pdf");
            file("b.pdf");
            CountDownLatch started = new CountDownLatch(1);
            when(pageProcessor.processFile(any(), any())).thenAnswer(invocation -> {
                started.countDown();
                new CountDownLatch(1).await();
                return onePageCreated;
            });
            AtomicReference<BatchRunResult> result = new AtomicReference<>();
            Thread runThread = new Thread(() ->
                    result.set(orchestrator.run(input, "24-105", policy().workers(1).build())));

            // When
            runThread.start();
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            runThread.interrupt();
            runThread.join(TimeUnit.SECONDS.toMillis(15));

            // Then
            assertThat(runThread.isAlive()).isFalse();
            assertThat(result.get()).isNotNull();
            assertThat(result.get().getCounts().getFilesFailed()).isEqualTo(1);
            assertThat(result.get().getCounts().getFilesSkipped()).isEqualTo(1);
            verify(store, atLeastOnce()).discardFile(RUN_ID, "a.pdf");
            verify(store, never()).discardFile(RUN_ID, "b.pdf");
            verify(ledger).finish(eq(RUN_ID), any(), any(), eq("Interrupted"));
        }
    }

    @Nested
    @DisplayName("Run Control Tests")
    class RunControlTests {

        @Test
        @DisplayName("Cancelling stops dispatch; in-flight files finish and the rest are skipped")
        void cancelRun() throws Exception {
            // Given
            file("a.pdf");
            file("b.pdf");
            file("c.pdf");
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(pageProcessor.processFile(any(), any())).thenAnswer(inv -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return onePageCreated;
            });

            // When
            String runId = orchestrator.submit(input, null, policy().workers(1).build());
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(orchestrator.isActive(runId)).isTrue();

            assertThatThrownBy(() -> orchestrator.run(input, null, policy().build()))
                    .isInstanceOf(StateConflictException.class);

            orchestrator.cancel(runId);
            assertThatThrownBy(() -> orchestrator.cancel(runId))
                    .isInstanceOf(StateConflictException.class);
            release.countDown();

            // Then
            ArgumentCaptor<RunCounts> captor = ArgumentCaptor.forClass(RunCounts.class);
            verify(ledger, timeout(5_000)).finish(eq(RUN_ID), eq(RunStatus.PARTIAL), captor.capture(),
                    eq("Cancelled"));
            assertThat(captor.getValue().getFilesSucceeded()).isEqualTo(1);
            assertThat(captor.getValue().getFilesSkipped()).isEqualTo(2);
            verify(pageProcessor, times(1)).processFile(any(), any());
        }

        @Test
        @DisplayName("Cancelling an unknown run is not found")
        void cancelUnknown() {
            assertThatThrownBy(() -> orchestrator.cancel("nope"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("Cancelling a finished run is a conflict")
        void cancelFinished() {
            when(ledger.find("done")).thenReturn(Optional.of(ProcessingRun.builder()
                    .runId("done").status(RunStatus.COMPLETED).build()));

            assertThatThrownBy(() -> orchestrator.cancel("done"))
                    .isInstanceOf(StateConflictException.class);
        }

        @Test
        @DisplayName("Missing input path is rejected before a run is recorded")
        void missingInput() {
            assertThatThrownBy(() -> orchestrator.run(input.resolve("missing"), null, policy().build()))
                    .isInstanceOf(IllegalArgumentException.class);

            verify(ledger, never()).start(any(), any());
            assertThat(orchestrator.isRunInProgress()).isFalse();
        }
    }

    @Nested
    @DisplayName("Status Resolution Tests")
    class StatusResolutionTests {

        @Test
        @DisplayName("All succeeded is COMPLETED, some is PARTIAL, none is FAILED")
        void statusFromTotals() {
            assertThat(BatchOrchestrator.resolveStatus(
                    RunCounts.builder().files(3).filesSucceeded(3).build(), false))
                    .isEqualTo(RunStatus.COMPLETED);
            assertThat(BatchOrchestrator.resolveStatus(
                    RunCounts.builder().files(3).filesSucceeded(2).filesFailed(1).build(), false))
                    .isEqualTo(RunStatus.PARTIAL);
            assertThat(BatchOrchestrator.resolveStatus(
                    RunCounts.builder().files(3).filesFailed(3).build(), false))
                    .isEqualTo(RunStatus.FAILED);
            assertThat(BatchOrchestrator.resolveStatus(RunCounts.ZERO, false))
                    .isEqualTo(RunStatus.COMPLETED);
        }

        @Test
        @DisplayName("Cancelled run with skipped files is PARTIAL even if nothing failed")
        void cancelledIsPartial() {
            assertThat(BatchOrchestrator.resolveStatus(
                    RunCounts.builder().files(3).filesSucceeded(1).filesSkipped(2).build(), true))
                    .isEqualTo(RunStatus.PARTIAL);
        }
    }

    @Nested
    @DisplayName("File Discovery Tests")
    class FileDiscoveryTests {

        @Test
        @DisplayName("Matches the pattern recursively in sorted order")
        void discoversSorted() throws IOException {
            Files.createDirectories(input.resolve("24-105"));
            Files.writeString(input.resolve("24-105/b.pdf"), "x");
            Files.writeString(input.resolve("a.pdf"), "x");
            Files.writeString(input.resolve("c.PDF.txt"), "x");

            List<Path> files = BatchOrchestrator.discoverFiles(input, "*.pdf");

            assertThat(files).containsExactly(input.resolve("24-105/b.pdf"), input.resolve("a.pdf"));
        }

        @Test
        @DisplayName("A single file is its own input")
        void singleFile() throws IOException {
            Path a = file("a.pdf");

            assertThat(BatchOrchestrator.discoverFiles(a, "*.pdf")).containsExactly(a);
        }
    }
}
