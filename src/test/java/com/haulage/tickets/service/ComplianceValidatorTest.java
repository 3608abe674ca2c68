package com.haulage.tickets.service;

import com.haulage.tickets.dto.ComplianceResult;
import com.haulage.tickets.entity.ReviewReason;
import com.haulage.tickets.entity.Ticket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceValidatorTest {

    private final ComplianceValidator validator = new ComplianceValidator();
    private final RegulatedMaterialPolicy policy = new RegulatedMaterialPolicy();

    @Nested
    @DisplayName("Regulated Material Policy Tests")
    class RegulatedMaterialPolicyTests {

        @Test
        @DisplayName("Manifest-only destination is regulated regardless of material")
        void manifestDestination() {
            assertThat(policy.isRegulated("CLEAN FILL", "WM Lewisville")).isTrue();
            assertThat(policy.isRegulated(null, "WASTE_MANAGEMENT_LEWISVILLE")).isTrue();
        }

        @Test
        @DisplayName("Non-contaminated material is not regulated, even though it contains CONTAMINATED")
        void nonContaminated() {
            assertThat(policy.isRegulated("NON_CONTAMINATED", "LDI_YARD")).isFalse();
            assertThat(policy.isRegulated("clean spoils", null)).isFalse();
        }

        @Test
        @DisplayName("Contaminated and unknown materials are regulated")
        void contaminatedAndUnknown() {
            assertThat(policy.isRegulated("CLASS_2_CONTAMINATED", null)).isTrue();
            assertThat(policy.isRegulated("Hazardous waste", "LDI_YARD")).isTrue();
            assertThat(policy.isRegulated("MYSTERY_SLUDGE", null)).isTrue();
        }

        @Test
        @DisplayName("Contamination wins over a clean word in the same material")
        void contaminatedWithCleanWord() {
            assertThat(policy.isRegulated("CONTAMINATED SPOILS", "LDI_YARD")).isTrue();
            assertThat(policy.isRegulated("Class 2 import", null)).isTrue();
            assertThat(policy.isRegulated("non-contaminated spoils", null)).isFalse();
        }

        @Test
        @DisplayName("No material and an ordinary destination is not regulated")
        void nothingKnown() {
            assertThat(policy.isRegulated(null, null)).isFalse();
            assertThat(policy.isRegulated("  ", "LDI_YARD")).isFalse();
        }
    }

    @Nested
    @DisplayName("Evidence Validation Tests")
    class EvidenceValidationTests {

        @Test
        @DisplayName("Unregulated ticket needs no evidence")
        void notRequired() {
            ComplianceResult result = validator.validate(false, null);

            assertThat(result).isEqualTo(ComplianceResult.NOT_REQUIRED);
            assertThat(result.requiresReview()).isFalse();
        }

        @Test
        @DisplayName("Regulated ticket without manifest yields MISSING_EVIDENCE")
        void missingEvidence() {
            // Given
            Ticket ticket = Ticket.builder().regulated(true).manifestNumber(" ").build();

            // When
            ComplianceResult result = validator.validate(ticket);

            // Then
            assertThat(result).isEqualTo(ComplianceResult.MISSING_EVIDENCE);
            assertThat(result.reviewReason()).contains(ReviewReason.MISSING_EVIDENCE);
        }

        @ParameterizedTest
        @ValueSource(strings = {"WM-12345678", "MAN_2025_0001", "ABCDEFGH", "12345678901234567890"})
        @DisplayName("Well-formed manifests pass")
        void validFormats(String manifest) {
            assertThat(validator.validate(true, manifest)).isEqualTo(ComplianceResult.OK);
        }

        @ParameterizedTest
        @ValueSource(strings = {"SHORT1", "wm-12345678", "WM 12345678", "123456789012345678901", "WM#12345678"})
        @DisplayName("Malformed manifests yield INVALID_EVIDENCE_FORMAT")
        void invalidFormats(String manifest) {
            ComplianceResult result = validator.validate(true, manifest);

            assertThat(result).isEqualTo(ComplianceResult.INVALID_EVIDENCE_FORMAT);
            assertThat(result.reviewReason()).contains(ReviewReason.INVALID_EVIDENCE_FORMAT);
        }
    }
}
