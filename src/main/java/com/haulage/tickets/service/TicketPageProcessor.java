package com.haulage.tickets.service;

import com.haulage.tickets.dto.CandidateValue;
import com.haulage.tickets.dto.ComplianceResult;
import com.haulage.tickets.dto.ExtractedPage;
import com.haulage.tickets.dto.PageReference;
import com.haulage.tickets.dto.ResolvedField;
import com.haulage.tickets.dto.RunCounts;
import com.haulage.tickets.entity.DuplicateLink;
import com.haulage.tickets.entity.PageOutcome;
import com.haulage.tickets.entity.ReviewEntry;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.ReviewSeverity;
import com.haulage.tickets.entity.Ticket;
import com.haulage.tickets.entity.TicketField;
import com.haulage.tickets.exception.MalformedSourceException;
import com.haulage.tickets.exception.RequiredFieldException;
import com.haulage.tickets.exception.TerminalInfraException;
import com.haulage.tickets.exception.TransientInfraException;
import com.haulage.tickets.repository.TicketStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

/**
 * Per-file, per-page pipeline: resolve fields, validate, check for duplicates,
 * then persist the ticket and route whatever needs a human.
 * <p>
 * Each page ends in exactly one {@link PageOutcome}. Transient and terminal
 * infrastructure failures are not absorbed here; they abort the file so the
 * orchestrator can retry it or abort the run.
 */
@Service
@Slf4j
public class TicketPageProcessor {

    private final TicketExtractionClient extractionClient;
    private final FilenameMetadataParser filenameParser;
    private final FieldPrecedenceResolver resolver;
    private final TicketAssembler assembler;
    private final ComplianceValidator complianceValidator;
    private final DuplicateDetector duplicateDetector;
    private final StripedKeyLock keyLock;
    private final ReviewQueueRouter router;
    private final MeterRegistry meterRegistry;

    @Value("${tickets.defaults.quantity-unit:TONS}")
    private String defaultQuantityUnit = "TONS";

    /**
     * Confidence given to the operator-supplied job id. Below filename metadata,
     * so a job code printed in the file name wins.
     */
    @Value("${tickets.defaults.job-confidence:0.85}")
    private double jobConfidence = 0.85;

    private final Map<PageOutcome, Counter> pageCounters = new EnumMap<>(PageOutcome.class);

    public TicketPageProcessor(TicketExtractionClient extractionClient,
                               FilenameMetadataParser filenameParser,
                               FieldPrecedenceResolver resolver,
                               TicketAssembler assembler,
                               ComplianceValidator complianceValidator,
                               DuplicateDetector duplicateDetector,
                               StripedKeyLock keyLock,
                               ReviewQueueRouter router,
                               MeterRegistry meterRegistry) {
        this.extractionClient = extractionClient;
        this.filenameParser = filenameParser;
        this.resolver = resolver;
        this.assembler = assembler;
        this.complianceValidator = complianceValidator;
        this.duplicateDetector = duplicateDetector;
        this.keyLock = keyLock;
        this.router = router;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        for (PageOutcome outcome : PageOutcome.values()) {
            pageCounters.put(outcome, Counter.builder("tickets.pages.processed")
                    .description("Pages processed by outcome")
                    .tag("outcome", outcome.name())
                    .register(meterRegistry));
        }
    }

    /**
     * Processes every page of one file.
     *
     * @return page-level counts for the file (file counters are left to the caller)
     * @throws MalformedSourceException if the file has no pages
     */
    public RunCounts processFile(RunContext run, Path file) {
        String sourceKey = run.sourceKey(file);
        List<ExtractedPage> pages = extractionClient.extract(file);
        if (pages == null || pages.isEmpty()) {
            throw new MalformedSourceException("Extraction returned no pages", sourceKey);
        }

        List<CandidateValue> metadata = filenameParser.parse(file, LocalDateTime.now());

        RunCounts counts = RunCounts.ZERO;
        for (ExtractedPage page : pages) {
            if (Thread.currentThread().isInterrupted()) {
                throw new TransientInfraException("Interrupted while processing " + sourceKey, sourceKey);
            }
            counts = counts.plus(processPage(run, PageReference.of(sourceKey, page.getPageNumber()), metadata, page));
        }
        log.debug("Processed {} pages of {}", pages.size(), sourceKey);
        return counts;
    }

    RunCounts processPage(RunContext run, PageReference ref, List<CandidateValue> metadata, ExtractedPage page) {
        PageResult result;
        try {
            result = resolveAndPersist(run, ref, metadata, page);
        } catch (TransientInfraException | TerminalInfraException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}: {}", ref, e.getMessage(), e);
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("error", e.getClass().getSimpleName());
            evidence.put("message", e.getMessage());
            router.route(run.getStore(), run.getRunId(), ref, null, ReviewReason.PROCESSING_ERROR, null, evidence);
            result = new PageResult(PageOutcome.ERROR, 1);
        }

        Counter counter = pageCounters.get(result.outcome);
        if (counter != null) {
            counter.increment();
        }
        return RunCounts.forPage(result.outcome, result.reviewEntries);
    }

    private PageResult resolveAndPersist(RunContext run, PageReference ref, List<CandidateValue> metadata,
                                         ExtractedPage page) {
        TicketStore store = run.getStore();

        Optional<Ticket> existing = run.getPolicy().isReprocess()
                ? store.findBySourcePage(ref.getSourceFile(), ref.getPageNumber())
                : Optional.empty();

        Map<String, ResolvedField> resolved = resolve(run, metadata, page, existing);
        Ticket ticket = assembler.assemble(resolved, ref, run.getRunId());
        ComplianceResult compliance = complianceValidator.validate(ticket);

        List<ReviewEntry> entries = new ArrayList<>();
        try {
            assembler.requireIdentity(ticket);
        } catch (RequiredFieldException e) {
            entries.add(router.route(store, run.getRunId(), ref, null, e.getReason(), null,
                    requiredFieldEvidence(e, resolved)));
            routeCompliance(run, ref, null, ticket, compliance, entries);
            return new PageResult(PageOutcome.REVIEW, entries.size());
        }

        List<String> inferred = assembler.inferredRequiredFields(ticket);
        ticket.setRequiresReview(compliance.requiresReview());

        PageOutcome outcome;
        Ticket saved;
        Ticket original = null;

        Lock lock = keyLock.lockFor(ticket.getTicketNumber(), ticket.getVendor());
        lock.lock();
        try {
            if (existing.isPresent()) {
                Ticket prior = existing.get();
                ticket.setId(prior.getId());
                ticket.setRunId(prior.getRunId());
                ticket.setVersion(prior.getVersion());
                saved = store.update(ticket, run.getRunId());
                outcome = PageOutcome.UPDATED;
            } else {
                original = duplicateDetector.findOriginal(store, ticket.getTicketNumber(), ticket.getVendor(),
                        ticket.getTicketDate()).orElse(null);
                if (original != null) {
                    ticket.setDuplicateOf(original.getId());
                    ticket.setRequiresReview(true);
                }
                saved = store.create(ticket);
                if (original != null) {
                    store.insertDuplicateLink(DuplicateLink.builder()
                            .ticketId(saved.getId())
                            .originalTicketId(original.getId())
                            .ticketNumber(saved.getTicketNumber())
                            .vendor(saved.getVendor())
                            .daysApart(ChronoUnit.DAYS.between(original.getTicketDate(), saved.getTicketDate()))
                            .runId(run.getRunId())
                            .build());
                }
                outcome = original != null ? PageOutcome.DUPLICATE : PageOutcome.CREATED;
            }
        } finally {
            lock.unlock();
        }

        if (original != null) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("ticketNumber", saved.getTicketNumber());
            evidence.put("vendor", saved.getVendor());
            evidence.put("originalTicketId", original.getId());
            evidence.put("originalDate", String.valueOf(original.getTicketDate()));
            evidence.put("originalSource", original.getSourceFile() + "#page" + original.getPageNumber());
            evidence.put("daysApart", ChronoUnit.DAYS.between(original.getTicketDate(), saved.getTicketDate()));
            entries.add(router.route(store, run.getRunId(), ref, saved.getId(), ReviewReason.DUPLICATE_TICKET,
                    null, evidence));
        }

        routeCompliance(run, ref, saved.getId(), saved, compliance, entries);

        if (!inferred.isEmpty()) {
            Map<String, Object> evidence = new LinkedHashMap<>();
            for (String field : inferred) {
                TicketField value = saved.getFields().get(field);
                evidence.put(field, Map.of("value", value.getValue(), "tier", value.getSourceTier().name(),
                        "confidence", value.getConfidence()));
            }
            entries.add(router.route(store, run.getRunId(), ref, saved.getId(), ReviewReason.INFERRED_FIELD,
                    null, evidence));
        }

        return new PageResult(categorize(outcome, entries), entries.size());
    }

    private Map<String, ResolvedField> resolve(RunContext run, List<CandidateValue> metadata, ExtractedPage page,
                                               Optional<Ticket> existing) {
        List<CandidateValue> candidates = new ArrayList<>(metadata);
        candidates.addAll(page.getCandidates());
        if (run.getJobId() != null && !run.getJobId().isBlank()) {
            candidates.add(CandidateValue.metadata(TicketFields.JOB_CODE, run.getJobId(), jobConfidence, null));
        }
        candidates.add(CandidateValue.systemDefault(TicketFields.QUANTITY_UNIT, defaultQuantityUnit));

        // Human corrections on the ticket being reprocessed outrank anything extracted again
        existing.ifPresent(prior -> prior.getFields().forEach((name, field) -> {
            if (field.isManual()) {
                candidates.add(CandidateValue.manual(name, field.getValue(), field.getResolvedAt()));
            }
        }));

        Map<String, List<CandidateValue>> byField = candidates.stream()
                .filter(c -> TicketFields.isKnown(c.getFieldName()))
                .collect(Collectors.groupingBy(CandidateValue::getFieldName));

        Map<String, ResolvedField> resolved = new TreeMap<>();
        for (String field : TicketFields.ALL) {
            resolved.put(field, resolver.resolve(field, byField.getOrDefault(field, List.of())));
        }
        return resolved;
    }

    private void routeCompliance(RunContext run, PageReference ref, Long ticketId, Ticket ticket,
                                 ComplianceResult compliance, List<ReviewEntry> entries) {
        compliance.reviewReason().ifPresent(reason -> {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("material", ticket.getMaterial());
            evidence.put("destination", ticket.getDestination());
            evidence.put("manifestNumber", ticket.getManifestNumber());
            evidence.put("ticketNumber", ticket.getTicketNumber());
            entries.add(router.route(run.getStore(), run.getRunId(), ref, ticketId, reason, null, evidence));
        });
    }

    private static Map<String, Object> requiredFieldEvidence(RequiredFieldException e,
                                                             Map<String, ResolvedField> resolved) {
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("field", e.getFieldName());
        evidence.put("message", e.getMessage());
        List<String> missing = new ArrayList<>();
        for (String field : TicketFields.REQUIRED) {
            ResolvedField value = resolved.get(field);
            if (value == null || !value.isPresent()) {
                missing.add(field);
            }
        }
        missing.sort(String::compareTo);
        evidence.put("missingFields", missing);
        ResolvedField failed = resolved.get(e.getFieldName());
        if (failed != null && failed.isPresent()) {
            evidence.put("value", failed.getValue());
        }
        return evidence;
    }

    /**
     * DUPLICATE beats REVIEW beats the persistence outcome. INFO entries alone
     * do not send a page to review.
     */
    static PageOutcome categorize(PageOutcome persisted, List<ReviewEntry> entries) {
        if (persisted == PageOutcome.DUPLICATE) {
            return PageOutcome.DUPLICATE;
        }
        boolean needsReview = entries.stream()
                .anyMatch(entry -> entry.getSeverity() != ReviewSeverity.INFO);
        return needsReview ? PageOutcome.REVIEW : persisted;
    }

    private static class PageResult {
        private final PageOutcome outcome;
        private final int reviewEntries;

        PageResult(PageOutcome outcome, int reviewEntries) {
            this.outcome = outcome;
            this.reviewEntries = reviewEntries;
        }
    }
}
