package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.domain.AnalysisMetadata;
import com.phillippitts.labreasoning.domain.AnalysisSummary;
import com.phillippitts.labreasoning.domain.LabAnalysisRequest;
import com.phillippitts.labreasoning.domain.LabAnalysisResult;
import com.phillippitts.labreasoning.domain.SpecialtyFinding;
import com.phillippitts.labreasoning.domain.TriageResult;
import com.phillippitts.labreasoning.exception.DiagnosisPipelineException;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.parse.ExplanationResult;
import com.phillippitts.labreasoning.service.pipeline.event.LabAnalysisCompletedEvent;
import com.phillippitts.labreasoning.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Default pipeline orchestrator.
 *
 * <p>Each run gets a random {@code analysisId}, placed in the Log4j2 ThreadContext for the
 * duration of the run so that every log line (including those on model worker threads) can be
 * correlated. On success a {@link LabAnalysisCompletedEvent} is published.
 */
@Service
public class DefaultClinicalReasoningPipeline implements ClinicalReasoningPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultClinicalReasoningPipeline.class);

    static final String ANALYSIS_ID_KEY = "analysisId";

    private final TriageLayer triageLayer;
    private final SpecialtyLayer specialtyLayer;
    private final FusionLayer fusionLayer;
    private final ExplainabilityLayer explainabilityLayer;
    private final PipelineProperties properties;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetricsPublisher metrics;

    public DefaultClinicalReasoningPipeline(TriageLayer triageLayer,
                                            SpecialtyLayer specialtyLayer,
                                            FusionLayer fusionLayer,
                                            ExplainabilityLayer explainabilityLayer,
                                            PipelineProperties properties,
                                            ApplicationEventPublisher publisher,
                                            PipelineMetricsPublisher metrics) {
        this.triageLayer = Objects.requireNonNull(triageLayer, "triageLayer");
        this.specialtyLayer = Objects.requireNonNull(specialtyLayer, "specialtyLayer");
        this.fusionLayer = Objects.requireNonNull(fusionLayer, "fusionLayer");
        this.explainabilityLayer = Objects.requireNonNull(explainabilityLayer, "explainabilityLayer");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    @Override
    public LabAnalysisResult analyze(LabAnalysisRequest request) {
        Objects.requireNonNull(request, "request");
        String analysisId = UUID.randomUUID().toString();
        ThreadContext.put(ANALYSIS_ID_KEY, analysisId);
        long t0 = System.nanoTime();
        try {
            LOG.info("Analysis started: {} markers, specialty={}",
                    request.biomarkers().size(), request.detectedSpecialty());

            PipelineStage stage = advance(null, PipelineStage.TRIAGE);
            TriageResult triage = triageLayer.run(request);

            stage = advance(stage, PipelineStage.SPECIALTY);
            SpecialtyFinding specialty = specialtyLayer.run(request);

            stage = advance(stage, PipelineStage.FUSION);
            FusionLayerResult fusion = fusionLayer.run(request, triage, specialty, analysisId);

            stage = advance(stage, PipelineStage.EXPLAINABILITY);
            ExplanationResult explanation = explainabilityLayer.run(request, fusion.differentialDiagnosis());

            long ms = TimeUtils.elapsedMillis(t0);
            LabAnalysisResult result = new LabAnalysisResult(
                    AnalysisSummary.of(request.biomarkers(), triage.confidence()),
                    triage,
                    request.biomarkers(),
                    request.correlations(),
                    fusion.differentialDiagnosis(),
                    fusion.investigativeQuestions(),
                    fusion.suggestedTests(),
                    specialty.chainOfThought(),
                    explanation.validated(),
                    explanation.explanation(),
                    Prompts.DISCLAIMER,
                    new AnalysisMetadata(analysisId, ms, properties.getPrimaryModel(), Prompts.PROMPT_VERSION),
                    fusion.consensusMetrics());

            advance(stage, PipelineStage.COMPLETE);
            LOG.info("Analysis completed in {} ms: urgency={}, {} diagnoses, validated={}",
                    ms, triage.urgency(), result.differentialDiagnosis().size(), result.validated());
            metrics.recordAnalysis(ms, true);
            publisher.publishEvent(new LabAnalysisCompletedEvent(analysisId, result, Instant.now()));
            return result;
        } catch (DiagnosisPipelineException e) {
            LOG.error("Analysis failed: {}", e.getMessage());
            metrics.recordAnalysis(TimeUtils.elapsedMillis(t0), false);
            throw e;
        } finally {
            ThreadContext.remove(ANALYSIS_ID_KEY);
        }
    }

    private static PipelineStage advance(PipelineStage from, PipelineStage to) {
        if (from == null ? to != PipelineStage.TRIAGE : !from.canAdvanceTo(to)) {
            throw new IllegalStateException("Illegal stage transition " + from + " -> " + to);
        }
        LOG.debug("Stage -> {}", to.id());
        return to;
    }
}
