package com.phillippitts.labreasoning.service.consensus;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps diagnosis names to an identity key so that phrasings of the same condition from
 * different models merge.
 *
 * <p>Steps, in order: lower-case and trim, strip one leading descriptive prefix, apply the
 * synonym table, collapse whitespace. Two diagnoses are the same iff their keys are equal.
 */
public final class DiagnosisNameNormalizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Pattern PREFIX = Pattern.compile(
            "^(?:síndrome de|doença de|transtorno de|syndrome of|disease of|disorder of)\\s+", FLAGS);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private record Synonym(Pattern pattern, String canonical) {}

    // Longer phrasings first so that a shorter variant never matches inside a longer one.
    private static final List<Synonym> SYNONYMS = List.of(
            new Synonym(Pattern.compile("\\bdiabetes mellitus tipo 2\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\btype 2 diabetes mellitus\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\bdiabetes mellitus type 2\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\btype 2 diabetes\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\bdm tipo 2\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\bt2dm\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\bdm2\\b", FLAGS), "diabetes tipo 2"),
            new Synonym(Pattern.compile("\\bhipotiroidismo\\b", FLAGS), "hipotireoidismo"),
            new Synonym(Pattern.compile("\\bhipertiroidismo\\b", FLAGS), "hipertireoidismo"),
            new Synonym(Pattern.compile("\\bhypothyroid(?:ism)?\\b", FLAGS), "hipotireoidismo"),
            new Synonym(Pattern.compile("\\bhyperthyroid(?:ism)?\\b", FLAGS), "hipertireoidismo")
    );

    private DiagnosisNameNormalizer() {}

    /**
     * Returns the identity key for a diagnosis name; "" for null.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String key = WHITESPACE.matcher(name.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
        key = PREFIX.matcher(key).replaceFirst("");
        for (Synonym s : SYNONYMS) {
            key = s.pattern().matcher(key).replaceAll(s.canonical());
        }
        return WHITESPACE.matcher(key).replaceAll(" ").trim();
    }
}
