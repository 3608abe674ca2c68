package com.haulage.tickets.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.dto.PageReference;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.repository.TicketStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewQueueRouterTest {

    @Mock
    private TicketStore store;

    private SimpleMeterRegistry meterRegistry;
    private ReviewQueueRouter router;

    private final PageReference page = PageReference.of("24-105/scan.pdf", 2);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        router = new ReviewQueueRouter(store, new ObjectMapper(), meterRegistry);
        router.initMetrics();
    }

    @Nested
    @DisplayName("Severity Tests")
    class SeverityTests {

        @Test
        @DisplayName("Missing evidence is always critical")
        void missingEvidenceCritical() {
            assertThat(ReviewQueueRouter.severityFor(ReviewReason.MISSING_EVIDENCE, null))
                    .isEqualTo(ReviewSeverity.CRITICAL);
            assertThat(ReviewQueueRouter.severityFor(ReviewReason.MISSING_EVIDENCE, ReviewSeverity.INFO))
                    .isEqualTo(ReviewSeverity.CRITICAL);
        }

        @Test
        @DisplayName("Requested severity can escalate but never downgrade")
        void escalateOnly() {
            assertThat(ReviewQueueRouter.severityFor(ReviewReason.INFERRED_FIELD, ReviewSeverity.WARNING))
                    .isEqualTo(ReviewSeverity.WARNING);
            assertThat(ReviewQueueRouter.severityFor(ReviewReason.DUPLICATE_TICKET, ReviewSeverity.CRITICAL))
                    .isEqualTo(ReviewSeverity.CRITICAL);
            assertThat(ReviewQueueRouter.severityFor(ReviewReason.DUPLICATE_TICKET, ReviewSeverity.INFO))
                    .isEqualTo(ReviewSeverity.WARNING);
        }
    }

    @Nested
    @DisplayName("Routing Tests")
    class RoutingTests {

        @Test
        @DisplayName("Entry carries page, reason, evidence and suggested action")
        void routesEntry() {
            // Given
            when(store.insertReviewEntry(any())).thenAnswer(inv -> inv.getArgument(0));

            // When
            router.route(store, "run-1", page, 42L, ReviewReason.MISSING_EVIDENCE, null,
                    Map.of("material", "CLASS_2_CONTAMINATED"));

            // Then
            ArgumentCaptor<ReviewEntry> captor = ArgumentCaptor.forClass(ReviewEntry.class);
            verify(store).insertReviewEntry(captor.capture());
            ReviewEntry entry = captor.getValue();
            assertThat(entry.getPageId()).isEqualTo("24-105/scan.pdf#page2");
            assertThat(entry.getTicketId()).isEqualTo(42L);
            assertThat(entry.getRunId()).isEqualTo("run-1");
            assertThat(entry.getSeverity()).isEqualTo(ReviewSeverity.CRITICAL);
            assertThat(entry.getEvidence()).isEqualTo("{\"material\":\"CLASS_2_CONTAMINATED\"}");
            assertThat(entry.getSuggestedAction()).isEqualTo(ReviewReason.MISSING_EVIDENCE.getSuggestedAction());
            assertThat(entry.isResolved()).isFalse();
            assertThat(meterRegistry.counter("tickets.review.routed", "severity", "CRITICAL").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Empty evidence is stored as an empty object")
        void emptyEvidence() {
            when(store.insertReviewEntry(any())).thenAnswer(inv -> inv.getArgument(0));

            ReviewEntry entry = router.route(page, ReviewReason.INFERRED_FIELD, null);

            assertThat(entry.getEvidence()).isEqualTo("{}");
            assertThat(entry.getSeverity()).isEqualTo(ReviewSeverity.INFO);
        }

        @Test
        @DisplayName("Entries for the same page are never merged")
        void noMerging() {
            when(store.insertReviewEntry(any())).thenAnswer(inv -> inv.getArgument(0));

            router.route(page, ReviewReason.DUPLICATE_TICKET, Map.of());
            router.route(page, ReviewReason.DUPLICATE_TICKET, Map.of());

            verify(store, times(2)).insertReviewEntry(any());
        }
    }
}
