package com.phillippitts.labreasoning.domain;

import java.util.List;

/**
 * Multi-marker pattern detected upstream (e.g. metabolic syndrome). Passed through to the
 * fusion prompt and the final result.
 */
public record ClinicalCorrelation(
        String type,
        List<String> markers,
        String pattern,
        String clinicalImplication,
        String confidence
) {
    public ClinicalCorrelation {
        type = type == null ? "custom" : type;
        markers = markers == null ? List.of() : List.copyOf(markers);
        pattern = pattern == null ? "" : pattern;
        clinicalImplication = clinicalImplication == null ? "" : clinicalImplication;
        confidence = confidence == null ? "low" : confidence;
    }
}
