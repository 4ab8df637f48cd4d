package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.domain.ConsensusDiagnosis;
import com.phillippitts.labreasoning.domain.LabAnalysisRequest;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.model.ModelCallOptions;
import com.phillippitts.labreasoning.service.model.ModelClient;
import com.phillippitts.labreasoning.service.parse.ExplainabilityResponseParser;
import com.phillippitts.labreasoning.service.parse.ExplanationResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Layer 4: grounding check and plain-language explanation.
 * Any failure yields {@link ExplanationResult#FALLBACK}.
 */
@Component
public class ExplainabilityLayer extends AbstractPipelineLayer {

    public ExplainabilityLayer(ModelClient modelClient, PipelineProperties properties,
                               PipelineMetricsPublisher metrics) {
        super(modelClient, properties, metrics);
    }

    @Override
    protected PipelineStage stage() {
        return PipelineStage.EXPLAINABILITY;
    }

    public ExplanationResult run(LabAnalysisRequest request, List<ConsensusDiagnosis> diagnoses) {
        String userPrompt = PromptFormatter.fill(Prompts.EXPLAINABILITY_USER, Map.of(
                "inputData", PromptFormatter.formatMarkers(request.biomarkers()),
                "analysisResult", PromptFormatter.analysisResultJson(diagnoses, request.correlations())));
        return callAndParse(Prompts.EXPLAINABILITY_SYSTEM, userPrompt,
                ModelCallOptions.text(properties.getExplainabilityTemperature()),
                ExplainabilityResponseParser::parse,
                () -> ExplanationResult.FALLBACK);
    }
}
