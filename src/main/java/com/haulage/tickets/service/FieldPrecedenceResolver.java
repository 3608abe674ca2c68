package com.haulage.tickets.service;

import com.haulage.tickets.dto.CandidateValue;
import com.haulage.tickets.dto.ResolvedField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Merges candidate values for a field into one authoritative value.
 * <p>
 * Candidates are ordered by source tier, then confidence (higher first), then
 * production time (newer first, unknown oldest), then value. The order is
 * total, so the result never depends on the order candidates were supplied in.
 * Null and blank values are never selected but are kept among the rejected
 * alternatives.
 * <p>
 * Stateless and thread-safe.
 */
@Component
public class FieldPrecedenceResolver {

    static final Comparator<CandidateValue> PRECEDENCE = Comparator
            .comparing(CandidateValue::getTier)
            .thenComparing(Comparator.comparingDouble(CandidateValue::getConfidence).reversed())
            .thenComparing(CandidateValue::getProducedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CandidateValue::getValue, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Resolves one field.
     *
     * @throws IllegalArgumentException if a candidate belongs to another field
     */
    public ResolvedField resolve(String fieldName, Collection<CandidateValue> candidates) {
        List<CandidateValue> ordered = new ArrayList<>(candidates.size());
        for (CandidateValue candidate : candidates) {
            if (!fieldName.equals(candidate.getFieldName())) {
                throw new IllegalArgumentException(String.format(
                        "Candidate for field '%s' passed when resolving '%s'",
                        candidate.getFieldName(), fieldName));
            }
            ordered.add(candidate);
        }
        ordered.sort(PRECEDENCE);

        Optional<CandidateValue> winner = ordered.stream()
                .filter(CandidateValue::isPresent)
                .findFirst();

        if (winner.isEmpty()) {
            return ResolvedField.absent(fieldName, ordered);
        }

        CandidateValue chosen = winner.get();
        List<CandidateValue> rejected = new ArrayList<>(ordered);
        rejected.remove(chosen);

        return new ResolvedField(fieldName, chosen.getValue().trim(), chosen.getTier(),
                chosen.getConfidence(), rejected);
    }

    /**
     * Groups candidates by field name and resolves each group.
     */
    public Map<String, ResolvedField> resolveAll(Collection<CandidateValue> candidates) {
        Map<String, List<CandidateValue>> byField = candidates.stream()
                .collect(Collectors.groupingBy(CandidateValue::getFieldName, TreeMap::new, Collectors.toList()));

        Map<String, ResolvedField> resolved = new TreeMap<>();
        byField.forEach((field, group) -> resolved.put(field, resolve(field, group)));
        return resolved;
    }
}
