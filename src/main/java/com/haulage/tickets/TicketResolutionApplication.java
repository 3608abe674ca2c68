package com.haulage.tickets;

import com.haulage.tickets.runner.TicketBatchRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;

/**
 * Ticket Resolution Service
 * <p>
 * Processes scanned haul tickets in batches: resolves conflicting field values,
 * flags duplicate loads, enforces the manifest rule for regulated material and
 * routes anything ambiguous to a human review queue.
 * <p>
 * Key Features:
 * - Concurrent, fault-tolerant batch runs with retry, rollback and a durable run ledger
 * - Command-line mode ({@code --input=<dir>}) whose exit code reflects the run status
 * - REST API for run control, the review queue and manual corrections
 * - Circuit breaker around the extraction layer, metrics and MDC-tagged logging
 */
@SpringBootApplication
public class TicketResolutionApplication {

    public static void main(String[] args) {
        boolean batchMode = Arrays.stream(args).anyMatch(arg -> arg.startsWith("--input"));

        ConfigurableApplicationContext context = new SpringApplicationBuilder(TicketResolutionApplication.class)
                .web(batchMode ? WebApplicationType.NONE : WebApplicationType.SERVLET)
                .run(args);

        if (context.getBean(TicketBatchRunner.class).hasRun()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
