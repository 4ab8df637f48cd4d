package com.phillippitts.labreasoning.domain;

/**
 * Specialty selected upstream to focus Layer 2, with the reasoning focus given to the model.
 */
public enum ClinicalSpecialty {
    GENERAL_PRACTICE("general practice",
            "overall metabolic, hematologic and organ-function picture; prioritise common conditions"),
    CARDIOLOGY("cardiology",
            "lipid profile, cardiovascular risk markers, inflammation and cardiac enzymes"),
    ENDOCRINOLOGY("endocrinology",
            "glucose metabolism, insulin resistance, thyroid axis and sex hormones"),
    NEUROLOGY("neurology",
            "vitamin B12, folate, electrolytes and metabolic causes of neurological symptoms"),
    FUNCTIONAL_MEDICINE("functional medicine",
            "deviation from functional ranges, nutrient status and early metabolic dysfunction"),
    NEPHROLOGY("nephrology",
            "creatinine, urea, eGFR, electrolytes and acid-base balance"),
    HEMATOLOGY("hematology",
            "blood count indices, iron studies, B12 and folate, signs of hemolysis"),
    HEPATOLOGY("hepatology",
            "transaminases, cholestasis markers, synthetic function and fatty liver patterns");

    private final String displayName;
    private final String focus;

    ClinicalSpecialty(String displayName, String focus) {
        this.displayName = displayName;
        this.focus = focus;
    }

    public String displayName() {
        return displayName;
    }

    public String focus() {
        return focus;
    }
}
