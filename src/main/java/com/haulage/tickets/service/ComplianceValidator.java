package com.haulage.tickets.service;

import com.haulage.tickets.dto.ComplianceResult;
import com.haulage.tickets.entity.Ticket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Mandatory-evidence rule for regulated loads.
 * <p>
 * Never rejects a ticket. A failing result names the review entry the caller
 * must route; a regulated ticket without evidence always yields
 * {@link ComplianceResult#MISSING_EVIDENCE}.
 */
@Component
@Slf4j
public class ComplianceValidator {

    static final Pattern MANIFEST_FORMAT = Pattern.compile("^[A-Z0-9_-]{8,20}$");

    public ComplianceResult validate(Ticket ticket) {
        return validate(ticket.isRegulated(), ticket.getManifestNumber());
    }

    /**
     * Variant for pages that never became a ticket because a required field
     * was missing. Regulated pages must still be checked.
     */
    public ComplianceResult validate(boolean regulated, String manifestNumber) {
        if (!regulated) {
            return ComplianceResult.NOT_REQUIRED;
        }
        if (manifestNumber == null || manifestNumber.isBlank()) {
            return ComplianceResult.MISSING_EVIDENCE;
        }
        if (!MANIFEST_FORMAT.matcher(manifestNumber.trim()).matches()) {
            log.debug("Manifest number '{}' does not match the expected format", manifestNumber);
            return ComplianceResult.INVALID_EVIDENCE_FORMAT;
        }
        return ComplianceResult.OK;
    }
}
