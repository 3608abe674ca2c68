package com.haulage.tickets.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a load belongs to a regulated category, which makes a
 * manifest number mandatory.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>a destination that only accepts manifested loads is always regulated;</li>
 *   <li>contaminated material is regulated, even when it also carries a clean
 *       word such as SPOILS;</li>
 *   <li>explicitly clean material is not regulated;</li>
 *   <li>any other non-empty material is treated as regulated, since an unknown
 *       material cannot be cleared without a human;</li>
 *   <li>no material and an ordinary destination is not regulated.</li>
 * </ol>
 */
@Component
@Slf4j
public class RegulatedMaterialPolicy {

    private static final List<String> MANIFEST_DESTINATIONS = List.of(
            "WASTE_MANAGEMENT_LEWISVILLE", "WM_LEWISVILLE", "WASTE_MANAGEMENT");

    // Removed before the contaminated check, both contain CONTAMINATED
    private static final List<String> NEGATED_CONTAMINATION = List.of("NON_CONTAMINATED", "NON-CONTAMINATED");

    private static final List<String> NON_CONTAMINATED_KEYWORDS = List.of(
            "NON_CONTAMINATED", "NON-CONTAMINATED", "CLEAN", "SPOILS", "IMPORT");

    private static final List<String> CONTAMINATED_KEYWORDS = List.of(
            "CLASS_2_CONTAMINATED", "CLASS_2", "CONTAMINATED_SOIL", "HAZARDOUS", "CONTAMINATED");

    public boolean isRegulated(String material, String destination) {
        String normalizedDestination = normalize(destination);
        if (normalizedDestination != null && requiresManifest(normalizedDestination)) {
            return true;
        }

        String normalizedMaterial = normalize(material);
        if (normalizedMaterial == null) {
            return false;
        }
        String withoutNegations = normalizedMaterial;
        for (String negated : NEGATED_CONTAMINATION) {
            withoutNegations = withoutNegations.replace(negated, "");
        }
        if (containsAny(withoutNegations, CONTAMINATED_KEYWORDS)) {
            return true;
        }
        if (containsAny(normalizedMaterial, NON_CONTAMINATED_KEYWORDS)) {
            return false;
        }
        log.debug("Unrecognized material '{}' treated as regulated", material);
        return true;
    }

    public boolean requiresManifest(String destination) {
        String normalized = normalize(destination);
        return normalized != null && containsAny(normalized, MANIFEST_DESTINATIONS);
    }

    private static boolean containsAny(String value, List<String> keywords) {
        return keywords.stream().anyMatch(value::contains);
    }

    static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}
