/**
 * Immutable domain records for the clinical reasoning pipeline.
 *
 * <p>Inputs ({@link com.phillippitts.labreasoning.domain.Biomarker},
 * {@link com.phillippitts.labreasoning.domain.PatientContext}) are read-only; each layer produces
 * its own record ({@link com.phillippitts.labreasoning.domain.TriageResult},
 * {@link com.phillippitts.labreasoning.domain.SpecialtyFinding},
 * {@link com.phillippitts.labreasoning.domain.ConsensusDiagnosis}) and the
 * {@link com.phillippitts.labreasoning.domain.LabAnalysisResult} envelope collects them.
 *
 * @since 1.0
 */
package com.phillippitts.labreasoning.domain;
