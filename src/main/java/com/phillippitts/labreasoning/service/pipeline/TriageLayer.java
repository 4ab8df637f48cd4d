package com.phillippitts.labreasoning.service.pipeline;

import com.phillippitts.labreasoning.config.properties.PipelineProperties;
import com.phillippitts.labreasoning.domain.LabAnalysisRequest;
import com.phillippitts.labreasoning.domain.PatientContext;
import com.phillippitts.labreasoning.domain.TriageResult;
import com.phillippitts.labreasoning.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.labreasoning.service.model.ModelCallOptions;
import com.phillippitts.labreasoning.service.model.ModelClient;
import com.phillippitts.labreasoning.service.parse.TriageResponseParser;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Layer 1: urgency classification.
 *
 * <p>On call or parse failure the result comes from
 * {@link TriageResponseParser#heuristicFallback(java.util.List)}: any critical marker means
 * CRITICAL urgency and the EMERGENCY workflow.
 */
@Component
public class TriageLayer extends AbstractPipelineLayer {

    public TriageLayer(ModelClient modelClient, PipelineProperties properties, PipelineMetricsPublisher metrics) {
        super(modelClient, properties, metrics);
    }

    @Override
    protected PipelineStage stage() {
        return PipelineStage.TRIAGE;
    }

    public TriageResult run(LabAnalysisRequest request) {
        PatientContext ctx = request.patientContext();
        String userPrompt = PromptFormatter.fill(Prompts.TRIAGE_USER, Map.of(
                "age", String.valueOf(ctx.age()),
                "sex", PromptFormatter.sex(ctx.sex()),
                "chiefComplaint", ctx.chiefComplaintIfPresent().orElse(PromptFormatter.NOT_PROVIDED),
                "relevantHistory", ctx.relevantHistory().isEmpty()
                        ? PromptFormatter.NOT_PROVIDED : String.join(", ", ctx.relevantHistory()),
                "labResults", PromptFormatter.formatMarkers(request.biomarkers()),
                "soapNotes", PromptFormatter.formatSoapNotes(ctx)));
        return callAndParse(Prompts.TRIAGE_SYSTEM, userPrompt,
                ModelCallOptions.json(properties.getTriageTemperature()),
                TriageResponseParser::parse,
                () -> TriageResponseParser.heuristicFallback(request.biomarkers()));
    }
}
