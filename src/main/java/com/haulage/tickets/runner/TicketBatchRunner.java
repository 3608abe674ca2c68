package com.haulage.tickets.runner;

import com.haulage.tickets.config.BatchPolicyFactory;
import com.haulage.tickets.dto.BatchPolicy;
import com.haulage.tickets.dto.BatchRunResult;
import com.haulage.tickets.dto.FileOutcome;
import com.haulage.tickets.dto.RunCounts;
import com.haulage.tickets.entity.RunStatus;
import com.haulage.tickets.exception.TicketProcessingException;
import com.haulage.tickets.service.BatchOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Command-line entry point. Active only when {@code --input} is given:
 * <pre>
 * --input=&lt;dir&gt; [--job=&lt;id&gt;] [--workers=N] [--retries=N] [--timeout-seconds=N]
 * [--dry-run] [--reprocess] [--no-rollback] [--stop-on-error] [--pattern=&lt;glob&gt;]
 * </pre>
 * The process exit code is the run status: 0 completed, 2 partial, 3 failed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TicketBatchRunner implements ApplicationRunner, ExitCodeGenerator {

    private final BatchOrchestrator orchestrator;
    private final BatchPolicyFactory policyFactory;

    private volatile Integer exitCode;
    private volatile BatchRunResult lastResult;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("input")) {
            return;
        }

        try {
            Path input = Path.of(required(args, "input"));
            String jobId = optional(args, "job");
            BatchPolicy policy = toPolicy(args);

            log.info("Batch run requested for {} (job {})", input, jobId);
            BatchRunResult result = orchestrator.run(input, jobId, policy);
            lastResult = result;
            exitCode = result.getExitCode();
            logSummary(result);
        } catch (IllegalArgumentException | TicketProcessingException e) {
            log.error("Batch run failed: {}", e.getMessage());
            exitCode = RunStatus.FAILED.getExitCode();
        }
    }

    BatchPolicy toPolicy(ApplicationArguments args) {
        BatchPolicy.BatchPolicyBuilder builder = policyFactory.defaults().toBuilder();

        String workers = optional(args, "workers");
        if (workers != null) {
            builder.workers(parseInt("workers", workers));
        }
        String retries = optional(args, "retries");
        if (retries != null) {
            builder.maxRetries(parseInt("retries", retries));
        }
        String timeout = optional(args, "timeout-seconds");
        if (timeout != null) {
            builder.fileTimeout(Duration.ofSeconds(parseInt("timeout-seconds", timeout)));
        }
        String pattern = optional(args, "pattern");
        if (pattern != null) {
            builder.filePattern(pattern);
        }
        if (args.containsOption("dry-run")) {
            builder.dryRun(true);
        }
        if (args.containsOption("reprocess")) {
            builder.reprocess(true);
        }
        if (args.containsOption("no-rollback")) {
            builder.rollbackOnCritical(false);
        }
        if (args.containsOption("stop-on-error")) {
            builder.continueOnError(false);
        }
        return BatchPolicyFactory.validate(builder.build());
    }

    private void logSummary(BatchRunResult result) {
        RunCounts counts = result.getCounts();
        log.info("Run {} {} in {} ms: {} files ({} succeeded, {} failed, {} skipped), {} pages, " +
                        "{} created, {} updated, {} duplicates, {} to review, {} errors",
                result.getRunId(), result.getStatus(), result.getDurationMs(),
                counts.getFiles(), counts.getFilesSucceeded(), counts.getFilesFailed(), counts.getFilesSkipped(),
                counts.getPages(), counts.getTicketsCreated(), counts.getTicketsUpdated(),
                counts.getDuplicatesFound(), counts.getReviewQueueCount(), counts.getErrors());
        for (FileOutcome outcome : result.getFileOutcomes()) {
            if (!outcome.isSucceeded()) {
                log.warn("{} {} after {} attempts: {}", outcome.getSourceFile(), outcome.getState(),
                        outcome.getAttempts(), outcome.getErrorMessage());
            }
        }
    }

    private static String required(ApplicationArguments args, String name) {
        String value = optional(args, name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value");
        }
        return value;
    }

    private static String optional(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be a number: " + value);
        }
    }

    public boolean hasRun() {
        return exitCode != null;
    }

    public BatchRunResult getLastResult() {
        return lastResult;
    }

    @Override
    public int getExitCode() {
        return exitCode == null ? 0 : exitCode;
    }
}
