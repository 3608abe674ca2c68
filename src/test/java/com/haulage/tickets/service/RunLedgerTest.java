package com.haulage.tickets.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.dto.RunCounts;
import com.haulage.tickets.entity.ProcessingRun;
import com.haulage.tickets.entity.RunStatus;
import com.haulage.tickets.exception.ResourceNotFoundException;
import com.haulage.tickets.repository.ProcessingRunRepository;
import com.haulage.tickets.repository.TicketStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RunLedgerTest {

    @Mock
    private TicketStore store;

    @Mock
    private ProcessingRunRepository runRepository;

    private RunLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new RunLedger(store, runRepository, new ObjectMapper());
    }

    private ProcessingRun inProgress(String runId) {
        return ProcessingRun.builder()
                .runId(runId)
                .status(RunStatus.IN_PROGRESS)
                .startedAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("Start opens an IN_PROGRESS record with the configuration snapshot")
    void startRecordsSnapshot() {
        // Given
        when(store.upsertRunRecord(any())).thenAnswer(inv -> inv.getArgument(0));

        // When
        String runId = ledger.start("24-105", Map.of("workers", 4));

        // Then
        ArgumentCaptor<ProcessingRun> captor = ArgumentCaptor.forClass(ProcessingRun.class);
        verify(store).upsertRunRecord(captor.capture());
        ProcessingRun run = captor.getValue();
        assertThat(run.getRunId()).isEqualTo(runId);
        assertThat(run.getJobId()).isEqualTo("24-105");
        assertThat(run.getStatus()).isEqualTo(RunStatus.IN_PROGRESS);
        assertThat(run.getConfigSnapshot()).isEqualTo("{\"workers\":4}");
    }

    @Nested
    @DisplayName("Update Tests")
    class UpdateTests {

        @Test
        @DisplayName("Deltas are additive")
        void additiveDeltas() {
            // Given
            ProcessingRun run = inProgress("r1");
            when(store.findRunRecord("r1")).thenReturn(Optional.of(run));
            when(store.upsertRunRecord(any())).thenAnswer(inv -> inv.getArgument(0));

            // When
            ledger.update("r1", RunCounts.builder().files(1).filesSucceeded(1).pages(3).ticketsCreated(3).build());
            ProcessingRun updated = ledger.update("r1",
                    RunCounts.builder().files(1).filesSucceeded(1).pages(2).duplicatesFound(2).build());

            // Then
            assertThat(updated.getFilesCount()).isEqualTo(2);
            assertThat(updated.getPagesCount()).isEqualTo(5);
            assertThat(updated.getTicketsCreated()).isEqualTo(3);
            assertThat(updated.getDuplicatesFound()).isEqualTo(2);
            assertThat(updated.toCounts().isConsistent()).isTrue();
        }

        @Test
        @DisplayName("Finished run refuses further updates")
        void terminalRunRefusesUpdate() {
            ProcessingRun run = inProgress("r1");
            run.setStatus(RunStatus.COMPLETED);
            when(store.findRunRecord("r1")).thenReturn(Optional.of(run));

            assertThatThrownBy(() -> ledger.update("r1", RunCounts.ZERO))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Unknown run is reported as not found")
        void unknownRun() {
            when(store.findRunRecord("missing")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> ledger.update("missing", RunCounts.ZERO))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Finish Tests")
    class FinishTests {

        @Test
        @DisplayName("Finish writes final totals and completion time exactly once")
        void finishOnce() {
            // Given
            ProcessingRun run = inProgress("r1");
            when(store.findRunRecord("r1")).thenReturn(Optional.of(run));
            when(store.upsertRunRecord(any())).thenAnswer(inv -> inv.getArgument(0));
            RunCounts totals = RunCounts.builder().files(2).filesSucceeded(1).filesFailed(1).build();

            // When
            ProcessingRun finished = ledger.finish("r1", RunStatus.PARTIAL, totals, "file b.pdf failed");

            // Then
            assertThat(finished.getStatus()).isEqualTo(RunStatus.PARTIAL);
            assertThat(finished.getCompletedAt()).isNotNull();
            assertThat(finished.getFilesFailed()).isEqualTo(1);
            assertThat(finished.getErrorMessage()).isEqualTo("file b.pdf failed");
            assertThatThrownBy(() -> ledger.finish("r1", RunStatus.COMPLETED, totals))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("IN_PROGRESS is not a valid final status")
        void nonTerminalStatusRefused() {
            assertThatThrownBy(() -> ledger.finish("r1", RunStatus.IN_PROGRESS, RunCounts.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
