package com.haulage.tickets.service;

import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.repository.TicketStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DuplicateDetectorTest {

    @Mock
    private TicketStore store;

    private DuplicateDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DuplicateDetector(store, 120);
    }

    @Test
    @DisplayName("Queries the trailing window ending on the ticket date")
    void queriesTrailingWindow() {
        // Given
        LocalDate date = LocalDate.of(2025, 5, 1);
        Ticket original = Ticket.builder().id(7L).ticketDate(date.minusDays(50)).build();
        when(store.findDuplicateCandidate("T1", "WM", date.minusDays(120), date))
                .thenReturn(Optional.of(original));

        // When
        Optional<Long> result = detector.check("T1", "WM", date);

        // Then
        assertThat(result).contains(7L);
    }

    @Test
    @DisplayName("No original in the window means no duplicate")
    void noOriginal() {
        LocalDate date = LocalDate.of(2025, 5, 1);
        when(store.findDuplicateCandidate("T1", "WM", date.minusDays(120), date)).thenReturn(Optional.empty());

        assertThat(detector.check("T1", "WM", date)).isEmpty();
    }

    @Test
    @DisplayName("Incomplete identity never matches and never queries")
    void incompleteIdentity() {
        assertThat(detector.check(null, "WM", LocalDate.now())).isEmpty();
        assertThat(detector.check("T1", null, LocalDate.now())).isEmpty();
        assertThat(detector.check("T1", "WM", null)).isEmpty();

        verify(store, never()).findDuplicateCandidate(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Negative window is refused")
    void negativeWindow() {
        assertThatThrownBy(() -> new DuplicateDetector(store, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
