package com.haulage.tickets.service;

import com.haulage.tickets.dto.CandidateValue;
import com.haulage.tickets.dto.ExtractedPage;
import com.haulage.tickets.exception.ExtractionServiceException;
import com.haulage.tickets.exception.MalformedSourceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Mock implementation of the extraction layer.
 * <p>
 * Reads plain-text ticket fixtures instead of running OCR. Pages are separated
 * by a line containing only {@code ---}; within a page, lines of the form
 * {@code field_name: value @0.93} become candidates (confidence defaults to
 * {@code tickets.extraction.mock.default-confidence}), every other line is
 * page text. Real PDF content yields one candidate-free page per file.
 * <p>
 * Behavior per file name can be scripted for testing: fixed pages, a number
 * of failures before success, or a processing delay.
 */
@Service
@Slf4j
public class MockTicketExtractionClient implements TicketExtractionClient {

    private static final String ENGINE_NAME = "MockOcr";
    private static final String PAGE_SEPARATOR = "---";

    private final Map<String, List<ExtractedPage>> scriptedPages = new ConcurrentHashMap<>();
    private final Map<String, ScriptedFailure> scriptedFailures = new ConcurrentHashMap<>();
    private final Map<String, Duration> scriptedDelays = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> callCounts = new ConcurrentHashMap<>();

    private final Random random = new Random();

    @Value("${tickets.extraction.mock.failure-rate:0.0}")
    private double failureRate;

    @Value("${tickets.extraction.mock.latency-ms:0}")
    private int latencyMs;

    @Value("${tickets.extraction.mock.default-confidence:0.95}")
    private double defaultConfidence = 0.95;

    private volatile boolean simulateOutage = false;

    @Override
    @CircuitBreaker(name = "extractionService", fallbackMethod = "extractFallback")
    public List<ExtractedPage> extract(Path file) {
        String name = file.getFileName().toString();
        callCounts.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
        log.debug("Extracting pages from {}", file);

        simulateLatency(name, scriptedDelays.get(name));

        if (simulateOutage) {
            throw new ExtractionServiceException("Extraction engine is currently unavailable", ENGINE_NAME, name);
        }

        ScriptedFailure failure = scriptedFailures.get(name);
        if (failure != null && failure.remaining.getAndDecrement() > 0) {
            throw failure.exception.get();
        }

        if (failureRate > 0 && random.nextDouble() < failureRate) {
            throw new ExtractionServiceException("Simulated extraction failure", ENGINE_NAME, name);
        }

        List<ExtractedPage> scripted = scriptedPages.get(name);
        if (scripted != null) {
            return scripted;
        }
        return readFixture(file);
    }

    /**
     * Fallback when the circuit breaker is open. Reported as transient so the
     * file is retried once the breaker half-opens.
     */
    public List<ExtractedPage> extractFallback(Path file, CallNotPermittedException e) {
        log.warn("Extraction circuit breaker open, rejecting {}", file.getFileName());
        throw new ExtractionServiceException(
                "Extraction circuit breaker is open. Service temporarily unavailable.",
                ENGINE_NAME, file.getFileName().toString(), e);
    }

    List<ExtractedPage> readFixture(Path file) {
        String name = file.getFileName().toString();
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new MalformedSourceException("Cannot read source file: " + e.getMessage(), name, e);
        }
        if (content.length == 0) {
            throw new MalformedSourceException("Source file is empty", name);
        }

        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("%PDF")) {
            return List.of(ExtractedPage.builder().pageNumber(1).text("").build());
        }

        LocalDateTime producedAt = LocalDateTime.now();
        List<ExtractedPage> pages = new ArrayList<>();
        ExtractedPage.ExtractedPageBuilder current = ExtractedPage.builder().pageNumber(1);
        StringBuilder pageText = new StringBuilder();

        for (String line : text.split("\\R")) {
            if (line.trim().equals(PAGE_SEPARATOR)) {
                pages.add(current.text(pageText.toString()).build());
                current = ExtractedPage.builder().pageNumber(pages.size() + 1);
                pageText.setLength(0);
                continue;
            }
            CandidateValue candidate = parseCandidate(line, producedAt);
            if (candidate != null) {
                current.candidate(candidate);
            } else {
                pageText.append(line).append('\n');
            }
        }
        pages.add(current.text(pageText.toString()).build());
        return pages;
    }

    private CandidateValue parseCandidate(String line, LocalDateTime producedAt) {
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return null;
        }
        String field = line.substring(0, colon).trim();
        if (!TicketFields.isKnown(field)) {
            return null;
        }
        String value = line.substring(colon + 1).trim();
        double confidence = defaultConfidence;
        int at = value.lastIndexOf(" @");
        if (at >= 0) {
            try {
                confidence = Double.parseDouble(value.substring(at + 2).trim());
                value = value.substring(0, at).trim();
            } catch (NumberFormatException e) {
                log.debug("Ignoring malformed confidence in '{}'", line);
            }
        }
        return CandidateValue.extracted(field, value, confidence, producedAt);
    }

    private void simulateLatency(String name, Duration scripted) {
        long delay = scripted != null ? scripted.toMillis() : (latencyMs > 0 ? random.nextInt(latencyMs) : 0);
        if (delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExtractionServiceException("Extraction interrupted", ENGINE_NAME, name, e);
            }
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public boolean isAvailable() {
        return !simulateOutage;
    }

    // Methods for testing/simulation control

    public void scriptPages(String fileName, List<ExtractedPage> pages) {
        scriptedPages.put(fileName, List.copyOf(pages));
    }

    /**
     * Makes the next {@code times} extractions of the file throw.
     */
    public void scriptFailures(String fileName, int times, Supplier<RuntimeException> exception) {
        scriptedFailures.put(fileName, new ScriptedFailure(new AtomicInteger(times), exception));
    }

    public void scriptDelay(String fileName, Duration delay) {
        scriptedDelays.put(fileName, delay);
    }

    public int getCallCount(String fileName) {
        AtomicInteger count = callCounts.get(fileName);
        return count == null ? 0 : count.get();
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Extraction outage simulation set to: {}", outage);
    }

    public void reset() {
        scriptedPages.clear();
        scriptedFailures.clear();
        scriptedDelays.clear();
        callCounts.clear();
        simulateOutage = false;
    }

    private static class ScriptedFailure {
        private final AtomicInteger remaining;
        private final Supplier<RuntimeException> exception;

        ScriptedFailure(AtomicInteger remaining, Supplier<RuntimeException> exception) {
            this.remaining = remaining;
            this.exception = exception;
        }
    }
}
