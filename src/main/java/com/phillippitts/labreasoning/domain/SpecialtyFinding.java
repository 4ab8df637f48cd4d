package com.phillippitts.labreasoning.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of Layer 2 (specialty investigation).
 *
 * @param chainOfThought    ordered reasoning steps
 * @param specialtyFindings opaque structured findings, passed through to the fusion prompt
 */
public record SpecialtyFinding(List<String> chainOfThought, Map<String, Object> specialtyFindings) {

    public SpecialtyFinding {
        chainOfThought = chainOfThought == null ? List.of() : List.copyOf(chainOfThought);
        // JSON nulls survive as null values, so Map.copyOf is not an option here
        specialtyFindings = specialtyFindings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(specialtyFindings));
    }

    public static SpecialtyFinding empty() {
        return new SpecialtyFinding(List.of(), Map.of());
    }
}
