package com.phillippitts.labreasoning.domain;

/**
 * Role of a contributing model in the fusion layer.
 */
public enum ModelRole {
    /** Primary model; always queried. */
    PRIMARY("primary"),
    /** Optional second opinion queried alongside the primary. */
    CHALLENGER("challenger");

    private final String id;

    ModelRole(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
