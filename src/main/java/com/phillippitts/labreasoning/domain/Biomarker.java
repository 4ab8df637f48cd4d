package com.phillippitts.labreasoning.domain;

import java.util.Objects;

/**
 * Immutable laboratory biomarker produced by the upstream extraction step.
 *
 * @param id              stable identifier (e.g. "glucose", "tsh")
 * @param name            display name as printed on the exam
 * @param value           numeric value
 * @param unit            unit of measurement (may be empty)
 * @param labRange        laboratory reference range
 * @param functionalRange optimal functional range
 * @param status          traffic-light status
 * @param interpretation  short clinical interpretation
 */
public record Biomarker(
        String id,
        String name,
        double value,
        String unit,
        NumericRange labRange,
        NumericRange functionalRange,
        BiomarkerStatus status,
        String interpretation
) {
    public Biomarker {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        unit = unit == null ? "" : unit;
        labRange = labRange == null ? NumericRange.UNKNOWN : labRange;
        functionalRange = functionalRange == null ? NumericRange.UNKNOWN : functionalRange;
        interpretation = interpretation == null ? "" : interpretation;
    }
}
