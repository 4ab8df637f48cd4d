package com.phillippitts.labreasoning.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only clinical context of the patient whose labs are analysed.
 *
 * @param age                age in years
 * @param sex                biological sex
 * @param chiefComplaint     chief complaint, may be null
 * @param relevantHistory    relevant medical history entries
 * @param currentMedications current medications
 * @param soapNotes          SOAP notes, may be null
 */
public record PatientContext(
        int age,
        Sex sex,
        String chiefComplaint,
        List<String> relevantHistory,
        List<String> currentMedications,
        SoapNotes soapNotes
) {
    public PatientContext {
        if (age < 0) {
            throw new IllegalArgumentException("age must be >= 0, got: " + age);
        }
        Objects.requireNonNull(sex, "sex");
        relevantHistory = relevantHistory == null ? List.of() : List.copyOf(relevantHistory);
        currentMedications = currentMedications == null ? List.of() : List.copyOf(currentMedications);
    }

    public static PatientContext of(int age, Sex sex) {
        return new PatientContext(age, sex, null, List.of(), List.of(), null);
    }

    public Optional<String> chiefComplaintIfPresent() {
        return Optional.ofNullable(chiefComplaint).filter(s -> !s.isBlank());
    }

    public Optional<SoapNotes> soapNotesIfPresent() {
        return Optional.ofNullable(soapNotes).filter(n -> !n.isEmpty());
    }
}
