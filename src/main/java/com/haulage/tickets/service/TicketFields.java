package com.haulage.tickets.service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical field names shared by candidates, resolved fields and the
 * persisted {@code ticket_fields} table.
 */
public final class TicketFields {

    public static final String TICKET_NUMBER = "ticket_number";
    public static final String VENDOR = "vendor";
    public static final String TICKET_DATE = "ticket_date";
    public static final String JOB_CODE = "job_code";
    public static final String MATERIAL = "material";
    public static final String DESTINATION = "destination";
    public static final String MANIFEST_NUMBER = "manifest_number";
    public static final String QUANTITY = "quantity";
    public static final String QUANTITY_UNIT = "quantity_unit";
    public static final String TRUCK_NUMBER = "truck_number";

    /**
     * Fields every ticket must resolve before it can be persisted.
     */
    public static final Set<String> REQUIRED = Set.of(TICKET_NUMBER, VENDOR, TICKET_DATE);

    public static final List<String> ALL = List.of(
            TICKET_NUMBER, VENDOR, TICKET_DATE, JOB_CODE, MATERIAL, DESTINATION,
            MANIFEST_NUMBER, QUANTITY, QUANTITY_UNIT, TRUCK_NUMBER);

    private TicketFields() {
    }

    public static boolean isKnown(String fieldName) {
        return ALL.contains(fieldName);
    }

    /**
     * Vendor identifiers are compared upper-case with runs of whitespace
     * collapsed to a single underscore.
     */
    public static String normalizeVendor(String vendor) {
        if (vendor == null || vendor.isBlank()) {
            return null;
        }
        return vendor.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}
