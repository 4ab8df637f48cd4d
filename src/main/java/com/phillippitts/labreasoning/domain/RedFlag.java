package com.phillippitts.labreasoning.domain;

import java.util.List;

/**
 * Red flag alert raised by triage.
 */
public record RedFlag(String description, List<String> relatedMarkers, String action) {

    public RedFlag {
        description = description == null ? "" : description;
        relatedMarkers = relatedMarkers == null ? List.of() : List.copyOf(relatedMarkers);
        action = action == null ? "" : action;
    }
}
