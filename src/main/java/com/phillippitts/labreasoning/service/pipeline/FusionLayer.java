package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.domain.ConsensusMetrics;
import com.phillippitts.labreasoning.domain.LabAnalysisRequest;
import com.phillippitts.labreasoning.domain.ModelDiagnosisInput;
import com.phillippitts.labreasoning.domain.ModelRole;
import com.phillippitts.labreasoning.domain.PatientContext;
import com.phillippitts.labreasoning.domain.SpecialtyFinding;
import com.phillippitts.labreasoning.domain.TriageResult;
import com.phillippitts.labreasoning.exception.DiagnosisPipelineException;
import com.phillippitts.labreasoning.exception.ResponseParseException;
import com.phillippitts.labreasoning.service.consensus.ConsensusAggregator;
import com.phillippitts.labreasoning.service.consensus.ConsensusOutcome;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.model.ModelCallOptions;
import com.phillippitts.labreasoning.service.model.ModelCallOutcome;
import com.phillippitts.labreasoning.service.model.ModelCallRequest;
import com.phillippitts.labreasoning.service.parse.ChallengerResponseParser;
import com.phillippitts.labreasoning.service.parse.FusionParseResult;
import com.phillippitts.labreasoning.service.parse.FusionResponseParser;
import com.phillippitts.labreasoning.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Layer 3: dual-model fusion followed by consensus ranking.
 *
 * <p><b>Failure semantics:</b>
 * <ul>
 *   <li>Both calls failed (or the primary failed with the challenger disabled):
 *       {@link DiagnosisPipelineException}</li>
 *   <li>A call succeeded but its reply is unparseable: that model contributes an empty list</li>
 *   <li>Neither model contributed a diagnosis: {@link DiagnosisPipelineException}</li>
 *   <li>Challenger list empty for any reason: single-model ranking of the primary list</li>
 * </ul>
 */
@Component
public class FusionLayer {

    private static final Logger LOG = LogManager.getLogger(FusionLayer.class);
    private static final String LAYER = PipelineStage.FUSION.id();

    private final DualModelCallService dualModelCallService;
    private final ConsensusAggregator aggregator;
    private final PipelineProperties properties;
    private final PipelineMetricsPublisher metrics;

    public FusionLayer(DualModelCallService dualModelCallService, ConsensusAggregator aggregator,
                       PipelineProperties properties, PipelineMetricsPublisher metrics) {
        this.dualModelCallService = Objects.requireNonNull(dualModelCallService, "dualModelCallService");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
    }

    /**
     * @throws DiagnosisPipelineException if no fusion call succeeded or none yielded a diagnosis
     */
    public FusionLayerResult run(LabAnalysisRequest request, TriageResult triage, SpecialtyFinding specialty,
                                 String analysisId) {
        long t0 = System.nanoTime();
        ModelCallRequest primaryCall = primaryRequest(request, triage, specialty);
        ModelCallRequest challengerCall = properties.isChallengerEnabled()
                ? challengerRequest(request, triage)
                : null;

        DualModelCallService.OutcomePair outcomes =
                dualModelCallService.callBoth(primaryCall, challengerCall, properties.getFusionTimeoutMs());
        recordCall(outcomes.primary(), primaryCall.modelId());
        if (challengerCall != null) {
            recordCall(outcomes.challenger(), challengerCall.modelId());
        }

        if (!outcomes.anySucceeded()) {
            throw new DiagnosisPipelineException("All fusion model calls failed: primary="
                    + outcomes.primary().failureReason() + ", challenger="
                    + outcomes.challenger().failureReason(), analysisId);
        }

        FusionParseResult primaryParsed = parseOutcome(outcomes.primary(), FusionResponseParser::parse,
                FusionParseResult.empty());
        List<ModelDiagnosisInput> challengerDiagnoses = parseOutcome(outcomes.challenger(),
                ChallengerResponseParser::parse, List.of());

        if (primaryParsed.diagnoses().isEmpty() && challengerDiagnoses.isEmpty()) {
            throw new DiagnosisPipelineException("No fusion reply yielded a diagnosis: primary="
                    + describe(outcomes.primary()) + ", challenger="
                    + (challengerCall == null ? "disabled" : describe(outcomes.challenger())), analysisId);
        }

        ConsensusOutcome consensus = aggregator.aggregate(primaryParsed.diagnoses(), challengerDiagnoses);
        if (challengerDiagnoses.isEmpty()) {
            LOG.warn("Single-model ranking: challenger contributed no diagnoses ({})",
                    challengerCall == null ? "disabled" : describe(outcomes.challenger()));
        } else {
            LOG.info("Multi-model consensus: {}% strong, {} divergent",
                    consensus.metrics().strongConsensusRate(), consensus.metrics().divergentCount());
        }
        metrics.recordConsensus(consensus.diagnoses());

        ConsensusMetrics consensusMetrics = consensus.metrics().withModels(
                modelIds(consensus.metrics().modelsUsed(), primaryCall, challengerCall),
                timings(outcomes, challengerCall != null),
                TimeUtils.elapsedMillis(t0));

        return new FusionLayerResult(consensus.diagnoses(), primaryParsed.investigativeQuestions(),
                primaryParsed.suggestedTests(), consensusMetrics);
    }

    private ModelCallRequest primaryRequest(LabAnalysisRequest request, TriageResult triage,
                                            SpecialtyFinding specialty) {
        PatientContext ctx = request.patientContext();
        String userPrompt = PromptFormatter.fill(Prompts.FUSION_USER, Map.of(
                "patientSummary", PromptFormatter.formatPatientContext(ctx),
                "labResults", PromptFormatter.formatMarkers(request.biomarkers()),
                "soapNotes", PromptFormatter.formatSoapNotes(ctx),
                "triageResult", PromptFormatter.triageJson(triage),
                "specialtyAnalysis", PromptFormatter.specialtyJson(specialty),
                "correlations", PromptFormatter.correlationPatterns(request.correlations())));
        return new ModelCallRequest(properties.getPrimaryModel(), Prompts.FUSION_SYSTEM, userPrompt,
                ModelCallOptions.text(properties.getFusionTemperature()));
    }

    private ModelCallRequest challengerRequest(LabAnalysisRequest request, TriageResult triage) {
        String userPrompt = PromptFormatter.fill(Prompts.CHALLENGER_USER, Map.of(
                "patientSummary", PromptFormatter.formatPatientContext(request.patientContext()),
                "labResults", PromptFormatter.formatMarkers(request.biomarkers()),
                "urgency", triage.urgency().name().toLowerCase(Locale.ROOT),
                "redFlags", PromptFormatter.redFlagDescriptions(triage.redFlags()),
                "correlations", PromptFormatter.correlationPatterns(request.correlations())));
        return new ModelCallRequest(properties.getChallengerModel(), Prompts.CHALLENGER_SYSTEM, userPrompt,
                ModelCallOptions.json(properties.getFusionTemperature()));
    }

    private <T> T parseOutcome(ModelCallOutcome outcome, Function<String, T> parser, T empty) {
        if (!outcome.succeeded()) {
            return empty;
        }
        try {
            return parser.apply(outcome.text());
        } catch (ResponseParseException e) {
            LOG.warn("Fusion reply from {} is unparseable: {} [preview: {}]",
                    outcome.modelId(), e.getMessage(), e.getPreview());
            metrics.recordCallFailure(LAYER, outcome.modelId(), "parse_error");
            return empty;
        } catch (RuntimeException e) {
            LOG.warn("Fusion reply from {} did not map to diagnoses: {}", outcome.modelId(), e.getMessage());
            metrics.recordCallFailure(LAYER, outcome.modelId(), "parse_error");
            return empty;
        }
    }

    private void recordCall(ModelCallOutcome outcome, String modelId) {
        if (outcome.succeeded()) {
            metrics.recordCallSuccess(LAYER, modelId, outcome.durationMs());
        } else if (outcome.status() == ModelCallOutcome.Status.FAILED) {
            metrics.recordCallFailure(LAYER, modelId,
                    "timeout".equals(outcome.failureReason()) ? "timeout" : "call_error");
        }
    }

    private static String describe(ModelCallOutcome outcome) {
        return outcome.succeeded() ? "empty or unparseable reply" : outcome.failureReason();
    }

    private static List<String> modelIds(List<String> roleIds, ModelCallRequest primary, ModelCallRequest challenger) {
        List<String> ids = new ArrayList<>(roleIds.size());
        for (String roleId : roleIds) {
            if (ModelRole.PRIMARY.id().equals(roleId)) {
                ids.add(primary.modelId());
            } else if (ModelRole.CHALLENGER.id().equals(roleId) && challenger != null) {
                ids.add(challenger.modelId());
            }
        }
        return ids;
    }

    private static Map<String, Long> timings(DualModelCallService.OutcomePair outcomes, boolean challengerAttempted) {
        Map<String, Long> timings = new LinkedHashMap<>();
        timings.put(outcomes.primary().modelId(), outcomes.primary().durationMs());
        if (challengerAttempted) {
            String key = outcomes.challenger().modelId();
            if (timings.containsKey(key)) {
                key = key + "/" + ModelRole.CHALLENGER.id();
            }
            timings.put(key, outcomes.challenger().durationMs());
        }
        return timings;
    }
}
