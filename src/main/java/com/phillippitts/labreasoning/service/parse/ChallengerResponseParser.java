package com.phillippitts.labreasoning.service.parse;

import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;

import java.util.List;

/**
 * Maps the challenger model's reply, which carries only a ranked {@code differentialDiagnosis}.
 */
public final class ChallengerResponseParser {

    private ChallengerResponseParser() {}

    public static List<ModelDiagnosisInput> parse(String raw) {
        return DiagnosisListParser.parse(LenientJsonParser.parse(raw));
    }
}
