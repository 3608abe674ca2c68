package com.haulage.tickets.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.haulage.tickets.dto.PageReference;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.repository.TicketStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Records review queue entries.
 * <p>
 * Severity is a function of the reason code. A caller may ask for a higher
 * severity but never a lower one. Entries for the same page are recorded
 * independently; the router never merges or deduplicates them.
 */
@Component
@Slf4j
public class ReviewQueueRouter {

    private final TicketStore defaultStore;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private final Map<ReviewSeverity, Counter> routedCounters = new EnumMap<>(ReviewSeverity.class);

    public ReviewQueueRouter(TicketStore defaultStore, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.defaultStore = defaultStore;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        for (ReviewSeverity severity : ReviewSeverity.values()) {
            routedCounters.put(severity, Counter.builder("tickets.review.routed")
                    .description("Review queue entries routed")
                    .tag("severity", severity.name())
                    .register(meterRegistry));
        }
    }

    public ReviewEntry route(PageReference page, ReviewReason reason, Map<String, Object> evidence) {
        return route(defaultStore, null, page, null, reason, null, evidence);
    }

    public ReviewEntry route(PageReference page, ReviewReason reason, ReviewSeverity requested,
                             Map<String, Object> evidence) {
        return route(defaultStore, null, page, null, reason, requested, evidence);
    }

    /**
     * Records an entry through the given store on behalf of a run.
     *
     * @param ticketId  ticket the entry refers to, or null when none was created
     * @param requested severity asked for by the caller, or null for the reason's own
     */
    public ReviewEntry route(TicketStore store, String runId, PageReference page, Long ticketId,
                             ReviewReason reason, ReviewSeverity requested, Map<String, Object> evidence) {
        ReviewSeverity severity = severityFor(reason, requested);

        ReviewEntry entry = ReviewEntry.builder()
                .ticketId(ticketId)
                .pageId(page.pageId())
                .sourceFile(page.getSourceFile())
                .pageNumber(page.getPageNumber())
                .reason(reason)
                .severity(severity)
                .evidence(toJson(evidence))
                .suggestedAction(reason.getSuggestedAction())
                .resolved(false)
                .runId(runId)
                .build();

        ReviewEntry saved = store.insertReviewEntry(entry);
        Counter counter = routedCounters.get(severity);
        if (counter != null) {
            counter.increment();
        }

        if (severity == ReviewSeverity.INFO) {
            log.debug("Routed {} {} for {}", severity, reason, page);
        } else {
            log.warn("Routed {} {} for {} (ticket {})", severity, reason, page, ticketId);
        }
        return saved;
    }

    /**
     * The reason's severity, escalated to {@code requested} if that is higher.
     */
    public static ReviewSeverity severityFor(ReviewReason reason, ReviewSeverity requested) {
        return reason.getSeverity().escalate(requested);
    }

    private String toJson(Map<String, Object> evidence) {
        if (evidence == null || evidence.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize review evidence: {}", e.getMessage());
            return "{\"unserializable\":true}";
        }
    }
}
