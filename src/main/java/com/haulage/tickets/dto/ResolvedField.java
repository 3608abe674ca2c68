package com.haulage.tickets.dto;

import com.haulage.tickets.entity.SourceTier;
import lombok.Value;

import java.util.List;

/**
 * The single authoritative value chosen for a field, with the alternatives it
 * beat, in precedence order.
 */
@Value
public class ResolvedField {

    String fieldName;
    String value;
    SourceTier tier;
    double confidence;
    List<CandidateValue> rejected;

    public ResolvedField(String fieldName, String value, SourceTier tier, double confidence,
                         List<CandidateValue> rejected) {
        this.fieldName = fieldName;
        this.value = value;
        this.tier = tier;
        this.confidence = confidence;
        this.rejected = List.copyOf(rejected);
    }

    /**
     * Resolution outcome when no candidate carried a usable value.
     */
    public static ResolvedField absent(String fieldName, List<CandidateValue> rejected) {
        return new ResolvedField(fieldName, null, SourceTier.SYSTEM_DEFAULT, 0.0, rejected);
    }

    public boolean isPresent() {
        return value != null;
    }
}
