package com.haulage.tickets.service;

import com.haulage.tickets.dto.CandidateValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns structured source file names into {@code STRUCTURED_METADATA}
 * candidates.
 * <p>
 * File names follow {@code {JOB}__{DATE}__{AREA}__{FLOW}__{MATERIAL}__{VENDOR}.pdf},
 * for example {@code 24-105__2025-10-17__SPG__EXPORT__CLASS_2_CONTAMINATED__WASTE_MANAGEMENT_LEWISVILLE.pdf}.
 * Any segment may be empty or missing. A parent folder named like a job code
 * contributes a job code candidate as well. Never throws on odd names.
 */
@Component
@Slf4j
public class FilenameMetadataParser {

    static final String DELIMITER = "__";
    static final Pattern JOB_CODE = Pattern.compile("^\\d{2}-\\d{3}$");

    static final double FILENAME_CONFIDENCE = 0.95;
    static final double FOLDER_CONFIDENCE = 0.9;

    private static final int MIN_YEAR = 2020;
    private static final int MAX_YEAR = 2030;

    public List<CandidateValue> parse(Path file, LocalDateTime producedAt) {
        List<CandidateValue> candidates = new ArrayList<>();

        Path parent = file.getParent();
        if (parent != null && parent.getFileName() != null) {
            String folder = parent.getFileName().toString().trim();
            if (JOB_CODE.matcher(folder).matches()) {
                candidates.add(CandidateValue.metadata(TicketFields.JOB_CODE, folder, FOLDER_CONFIDENCE, producedAt));
            }
        }

        String[] parts = stem(file).split(DELIMITER, -1);
        if (parts.length < 2) {
            return candidates;
        }

        String job = segment(parts, 0);
        if (job != null && JOB_CODE.matcher(job).matches()) {
            candidates.add(CandidateValue.metadata(TicketFields.JOB_CODE, job, FILENAME_CONFIDENCE, producedAt));
        }

        String date = parseDate(segment(parts, 1));
        if (date != null) {
            candidates.add(CandidateValue.metadata(TicketFields.TICKET_DATE, date, FILENAME_CONFIDENCE, producedAt));
        }

        String flow = upper(segment(parts, 3));

        String material = upper(segment(parts, 4));
        if (material != null) {
            candidates.add(CandidateValue.metadata(TicketFields.MATERIAL, material, FILENAME_CONFIDENCE, producedAt));
        }

        String vendor = TicketFields.normalizeVendor(segment(parts, 5));
        if (vendor != null) {
            candidates.add(CandidateValue.metadata(TicketFields.VENDOR, vendor, FILENAME_CONFIDENCE, producedAt));
            // Exported loads are hauled to the vendor's facility
            if ("EXPORT".equals(flow)) {
                candidates.add(CandidateValue.metadata(TicketFields.DESTINATION, vendor, FILENAME_CONFIDENCE, producedAt));
            }
        }

        log.debug("Parsed {} metadata candidates from {}", candidates.size(), file.getFileName());
        return candidates;
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String segment(String[] parts, int index) {
        if (index >= parts.length) {
            return null;
        }
        String value = parts[index].trim();
        return value.isEmpty() ? null : value;
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    static String parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            LocalDate date = LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
            if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
                return null;
            }
            return date.toString();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
